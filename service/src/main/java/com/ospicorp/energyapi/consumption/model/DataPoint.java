package com.ospicorp.energyapi.consumption.model;

import java.time.Instant;

// Value object for one observation; a null value marks an undefined bucket
public record DataPoint(Instant timestamp, Double value) {

  public boolean isDefined() {
    return value != null;
  }
}
