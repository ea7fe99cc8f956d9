package com.ospicorp.energyapi.consumption.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;

@JsonPropertyOrder({"timestamp", "consumption", "unit"})
public record Reading(Instant timestamp, Double consumption, String unit) {

  public static Reading of(DataPoint point, String unit) {
    return new Reading(point.timestamp(), point.value(), unit);
  }
}
