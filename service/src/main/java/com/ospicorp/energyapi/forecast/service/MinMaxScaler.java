package com.ospicorp.energyapi.forecast.service;

/**
 * Min-max scaling to [0, 1], fit on one window and used only for that call. A window whose
 * values are all equal scales everything to 0 and inverts back to that value.
 */
record MinMaxScaler(double min, double max) {

  static MinMaxScaler fit(double[] values) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double v : values) {
      min = Math.min(min, v);
      max = Math.max(max, v);
    }
    return new MinMaxScaler(min, max);
  }

  double range() {
    return max - min;
  }

  double scale(double value) {
    double range = range();
    return range == 0d ? 0d : (value - min) / range;
  }

  double[] scale(double[] values) {
    double[] out = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      out[i] = scale(values[i]);
    }
    return out;
  }

  double inverse(double scaled) {
    return min + scaled * range();
  }
}
