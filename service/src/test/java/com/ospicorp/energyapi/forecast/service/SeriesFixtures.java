package com.ospicorp.energyapi.forecast.service;

import com.ospicorp.energyapi.consumption.model.DataPoint;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

final class SeriesFixtures {
  static final Instant START = Instant.parse("2025-01-01T00:00:00Z");

  private SeriesFixtures() {
  }

  static List<DataPoint> series(Duration step, double... values) {
    List<DataPoint> out = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      out.add(new DataPoint(START.plus(step.multipliedBy(i)), values[i]));
    }
    return out;
  }

  static List<DataPoint> hourly(double... values) {
    return series(Duration.ofHours(1), values);
  }

  /** Daily-cycle consumption with seeded noise. */
  static List<DataPoint> noisyHourly(int size, long seed) {
    Random random = new Random(seed);
    double[] values = new double[size];
    for (int i = 0; i < size; i++) {
      values[i] = 40d + 15d * Math.sin(Math.PI * i / 12d) + random.nextGaussian() * 3d;
    }
    return hourly(values);
  }
}
