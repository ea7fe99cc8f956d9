package com.ospicorp.energyapi.forecast.service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.function.ToDoubleFunction;

/**
 * Derivative-free simplex minimiser used to fit model parameters.
 */
final class NelderMead {
  private static final double REFLECT = 1d;
  private static final double EXPAND = 2d;
  private static final double CONTRACT = 0.5d;
  private static final double SHRINK = 0.5d;

  private NelderMead() {
  }

  static double[] minimize(ToDoubleFunction<double[]> objective, double[] start, double step,
      int maxIterations, double tolerance) {
    int n = start.length;
    double[][] simplex = new double[n + 1][];
    double[] scores = new double[n + 1];
    simplex[0] = start.clone();
    for (int i = 0; i < n; i++) {
      double[] vertex = start.clone();
      vertex[i] += step;
      simplex[i + 1] = vertex;
    }
    for (int i = 0; i <= n; i++) {
      scores[i] = objective.applyAsDouble(simplex[i]);
    }

    Integer[] order = new Integer[n + 1];
    for (int iteration = 0; iteration < maxIterations; iteration++) {
      for (int i = 0; i <= n; i++) {
        order[i] = i;
      }
      Arrays.sort(order, Comparator.comparingDouble(i -> scores[i]));
      int best = order[0];
      int worst = order[n];
      int secondWorst = order[n - 1];

      double spread = Math.abs(scores[worst] - scores[best]);
      if (spread <= tolerance * (Math.abs(scores[best]) + tolerance)) {
        break;
      }

      double[] centroid = new double[n];
      for (int k = 0; k < n; k++) {
        int idx = order[k];
        for (int d = 0; d < n; d++) {
          centroid[d] += simplex[idx][d] / n;
        }
      }

      double[] reflected = along(centroid, simplex[worst], -REFLECT);
      double reflectedScore = objective.applyAsDouble(reflected);
      if (reflectedScore < scores[best]) {
        double[] expanded = along(centroid, simplex[worst], -EXPAND);
        double expandedScore = objective.applyAsDouble(expanded);
        if (expandedScore < reflectedScore) {
          simplex[worst] = expanded;
          scores[worst] = expandedScore;
        } else {
          simplex[worst] = reflected;
          scores[worst] = reflectedScore;
        }
        continue;
      }
      if (reflectedScore < scores[secondWorst]) {
        simplex[worst] = reflected;
        scores[worst] = reflectedScore;
        continue;
      }

      double[] contracted = reflectedScore < scores[worst]
          ? along(centroid, reflected, CONTRACT)
          : along(centroid, simplex[worst], CONTRACT);
      double contractedScore = objective.applyAsDouble(contracted);
      if (contractedScore < Math.min(reflectedScore, scores[worst])) {
        simplex[worst] = contracted;
        scores[worst] = contractedScore;
        continue;
      }

      for (int i = 0; i <= n; i++) {
        if (i == best) {
          continue;
        }
        simplex[i] = along(simplex[best], simplex[i], SHRINK);
        scores[i] = objective.applyAsDouble(simplex[i]);
      }
    }

    int best = 0;
    for (int i = 1; i <= n; i++) {
      if (scores[i] < scores[best]) {
        best = i;
      }
    }
    return simplex[best];
  }

  // origin + factor * (target - origin)
  private static double[] along(double[] origin, double[] target, double factor) {
    double[] out = new double[origin.length];
    for (int d = 0; d < origin.length; d++) {
      out[d] = origin[d] + factor * (target[d] - origin[d]);
    }
    return out;
  }
}
