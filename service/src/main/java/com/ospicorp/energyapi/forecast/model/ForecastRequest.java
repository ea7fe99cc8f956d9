package com.ospicorp.energyapi.forecast.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record ForecastRequest(
    @Schema(description = "View label of the history to fit", example = "daily",
        allowableValues = {"daily", "weekly", "monthly"}) String period,
    @Schema(description = "Forecasting model", example = "arima",
        allowableValues = {"statistical", "arima", "trend_heuristic", "lstm"}) String model,
    @Schema(description = "Number of future points", example = "10")
        @Min(1) @Max(ForecastRequest.MAX_STEPS) Integer steps
) {
  /** Upper bound accepted at the boundary; {@code energy.forecast.max-steps} may lower it. */
  public static final int MAX_STEPS = 365;
  public static final String DEFAULT_PERIOD = "daily";
  public static final String DEFAULT_MODEL = "arima";
  public static final int DEFAULT_STEPS = 10;

  public String periodOrDefault() {
    return period != null ? period : DEFAULT_PERIOD;
  }

  public String modelOrDefault() {
    return model != null ? model : DEFAULT_MODEL;
  }

  public int stepsOrDefault() {
    return steps != null ? steps : DEFAULT_STEPS;
  }
}
