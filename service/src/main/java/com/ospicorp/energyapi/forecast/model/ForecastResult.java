package com.ospicorp.energyapi.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Point forecasts for consecutive future timestamps. Confidence intervals are optional and,
 * when present, aligned one-to-one with {@code values}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ForecastResult(
    List<Instant> timestamps,
    List<Double> values,
    @JsonProperty("model_type") String modelLabel,
    @JsonProperty("confidence_intervals") List<ConfidenceInterval> confidenceIntervals
) {

  public ForecastResult {
    Objects.requireNonNull(timestamps, "timestamps");
    Objects.requireNonNull(values, "values");
    Objects.requireNonNull(modelLabel, "modelLabel");
    if (timestamps.size() != values.size()) {
      throw new IllegalArgumentException("timestamps (" + timestamps.size()
          + ") and values (" + values.size() + ") must have the same length");
    }
    if (confidenceIntervals != null && confidenceIntervals.size() != values.size()) {
      throw new IllegalArgumentException("confidence_intervals (" + confidenceIntervals.size()
          + ") must align with values (" + values.size() + ")");
    }
    timestamps = List.copyOf(timestamps);
    values = List.copyOf(values);
    confidenceIntervals = confidenceIntervals == null ? null : List.copyOf(confidenceIntervals);
  }

  public ForecastResult(List<Instant> timestamps, List<Double> values, String modelLabel) {
    this(timestamps, values, modelLabel, null);
  }

  @JsonIgnore
  public boolean hasConfidenceIntervals() {
    return confidenceIntervals != null;
  }

  @JsonIgnore
  public int steps() {
    return values.size();
  }
}
