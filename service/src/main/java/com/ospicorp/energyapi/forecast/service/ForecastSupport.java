package com.ospicorp.energyapi.forecast.service;

import com.ospicorp.energyapi.consumption.model.DataPoint;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

final class ForecastSupport {
  static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);

  private ForecastSupport() {
  }

  /**
   * Values of the defined points, in order. Resampled series can only be undefined before
   * their first observation, so this drops the leading gap.
   */
  static double[] definedValues(List<DataPoint> series) {
    return series.stream()
        .filter(DataPoint::isDefined)
        .mapToDouble(DataPoint::value)
        .toArray();
  }

  /**
   * Repeats the last observed spacing {@code steps} times past the final timestamp; one hour
   * when the series is too short to have a spacing.
   */
  static List<Instant> futureTimestamps(List<DataPoint> series, int steps) {
    Instant last = series.get(series.size() - 1).timestamp();
    Duration interval = series.size() > 1
        ? Duration.between(series.get(series.size() - 2).timestamp(), last)
        : DEFAULT_INTERVAL;
    List<Instant> out = new ArrayList<>(steps);
    for (int i = 1; i <= steps; i++) {
      out.add(last.plus(interval.multipliedBy(i)));
    }
    return out;
  }

  static void requirePositiveSteps(int steps) {
    if (steps < 1) {
      throw new IllegalArgumentException("steps must be a positive integer but was " + steps);
    }
  }
}
