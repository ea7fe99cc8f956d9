package com.ospicorp.energyapi.forecast.service;

import com.ospicorp.energyapi.error.ModelFitException;

/**
 * ARIMA(1,1,1) without a constant, fit by conditional sum of squares on the first
 * differences:
 *
 * <pre>
 *   y[t] = x[t] - x[t-1]
 *   y[t] = phi * y[t-1] + e[t] + theta * e[t-1]
 * </pre>
 *
 * <p>{@code phi} and {@code theta} are kept inside (-1, 1) so the differenced process is
 * stationary and invertible.
 */
final class ArimaModel {
  static final int MIN_OBSERVATIONS = 3;

  private static final double[] START = {0.1d, 0.1d};
  private static final double SIMPLEX_STEP = 0.5d;
  private static final int MAX_ITERATIONS = 500;
  private static final double TOLERANCE = 1e-10;
  private static final double BOUND = 0.99d;
  // Innovation variance below this share of the differences' mean square is a perfect fit.
  private static final double MIN_RELATIVE_VARIANCE = 1e-6d;

  private final double phi;
  private final double theta;
  private final double sigma2;
  private final double lastLevel;
  private final double lastDiff;
  private final double lastResidual;

  private ArimaModel(double phi, double theta, double sigma2, double lastLevel, double lastDiff,
      double lastResidual) {
    this.phi = phi;
    this.theta = theta;
    this.sigma2 = sigma2;
    this.lastLevel = lastLevel;
    this.lastDiff = lastDiff;
    this.lastResidual = lastResidual;
  }

  static ArimaModel fit(double[] values) {
    if (values.length < MIN_OBSERVATIONS) {
      throw new ModelFitException("ARIMA(1,1,1) needs at least " + MIN_OBSERVATIONS
          + " observations but series has " + values.length, "series.size", values.length);
    }
    double[] diffs = new double[values.length - 1];
    boolean constant = true;
    for (int i = 1; i < values.length; i++) {
      diffs[i - 1] = values[i] - values[i - 1];
      constant &= diffs[i - 1] == 0d;
    }
    if (constant) {
      throw new ModelFitException("ARIMA(1,1,1) cannot be fit to a constant series (value "
          + values[0] + ")", "series", values[0]);
    }

    double[] best = NelderMead.minimize(
        p -> sumOfSquares(diffs, constrain(p[0]), constrain(p[1])),
        START, SIMPLEX_STEP, MAX_ITERATIONS, TOLERANCE);
    double phi = constrain(best[0]);
    double theta = constrain(best[1]);

    double[] residuals = residuals(diffs, phi, theta);
    int effective = residuals.length - 1;
    double sumOfSquares = 0d;
    for (int t = 1; t < residuals.length; t++) {
      sumOfSquares += residuals[t] * residuals[t];
    }
    double sigma2 = sumOfSquares / effective;
    double diffMeanSquare = 0d;
    for (double d : diffs) {
      diffMeanSquare += d * d;
    }
    diffMeanSquare /= diffs.length;
    if (!Double.isFinite(sigma2) || sigma2 <= MIN_RELATIVE_VARIANCE * diffMeanSquare
        || !Double.isFinite(phi) || !Double.isFinite(theta)) {
      throw new ModelFitException("ARIMA(1,1,1) estimation is singular for this series "
          + "(innovation variance " + sigma2 + " against mean squared difference "
          + diffMeanSquare + ")", "series", values.length);
    }
    return new ArimaModel(phi, theta, sigma2, values[values.length - 1],
        diffs[diffs.length - 1], residuals[residuals.length - 1]);
  }

  double phi() {
    return phi;
  }

  double theta() {
    return theta;
  }

  double sigma2() {
    return sigma2;
  }

  /** Point forecasts of the level for horizons 1..steps. */
  double[] forecast(int steps) {
    double[] out = new double[steps];
    double level = lastLevel;
    double diff = phi * lastDiff + theta * lastResidual;
    for (int h = 0; h < steps; h++) {
      if (h > 0) {
        diff = phi * diff;
      }
      level += diff;
      out[h] = level;
    }
    return out;
  }

  /**
   * Forecast standard errors for horizons 1..steps. The level is the running sum of the
   * differenced process, so its psi-weights accumulate and the variance never shrinks with
   * the horizon.
   */
  double[] standardErrors(int steps) {
    double[] out = new double[steps];
    double psi = 1d;
    double cumulativePsi = 0d;
    double variance = 0d;
    for (int j = 0; j < steps; j++) {
      if (j == 1) {
        psi = phi + theta;
      } else if (j > 1) {
        psi = phi * psi;
      }
      cumulativePsi += psi;
      variance += cumulativePsi * cumulativePsi;
      out[j] = Math.sqrt(sigma2 * variance);
    }
    return out;
  }

  private static double sumOfSquares(double[] diffs, double phi, double theta) {
    double[] residuals = residuals(diffs, phi, theta);
    double total = 0d;
    for (int t = 1; t < residuals.length; t++) {
      total += residuals[t] * residuals[t];
    }
    return total;
  }

  // Conditioned on the first difference, with its residual taken as zero.
  private static double[] residuals(double[] diffs, double phi, double theta) {
    double[] residuals = new double[diffs.length];
    for (int t = 1; t < diffs.length; t++) {
      residuals[t] = diffs[t] - phi * diffs[t - 1] - theta * residuals[t - 1];
    }
    return residuals;
  }

  private static double constrain(double unconstrained) {
    return BOUND * Math.tanh(unconstrained);
  }
}
