package com.ospicorp.energyapi.forecast.service;

import com.ospicorp.energyapi.consumption.model.DataPoint;
import com.ospicorp.energyapi.error.InsufficientDataException;
import com.ospicorp.energyapi.forecast.model.ForecastResult;
import com.ospicorp.energyapi.forecast.model.enums.ModelKind;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Moving-average-plus-trend extrapolation reported under the legacy {@code LSTM} label.
 *
 * <p>This is a heuristic, not a trained neural network, and it produces no confidence
 * intervals. Values are min-max scaled on the input window, the mean and the mean
 * step-to-step delta of the last {@code min(14, n - 1)} scaled points are extrapolated, and
 * each step gets a {@code 0.02 * sin(i * pi / 4)} wiggle. The wiggle is cosmetic and does
 * not model seasonality. Scaled forecasts are clamped to [0, 1] before inverting, so outputs
 * never leave the observed range.
 */
@Component
public class TrendHeuristicForecaster implements ForecastStrategy {

  private static final Logger log = LoggerFactory.getLogger(TrendHeuristicForecaster.class);
  static final int MAX_WINDOW = 14;
  static final int MIN_OBSERVATIONS = 2;
  static final double OSCILLATION_AMPLITUDE = 0.02d;

  @Override
  public ModelKind kind() {
    return ModelKind.TREND_HEURISTIC;
  }

  @Override
  public ForecastResult forecast(List<DataPoint> series, int steps) {
    ForecastSupport.requirePositiveSteps(steps);
    double[] values = ForecastSupport.definedValues(series);
    int n = values.length;
    if (n < MIN_OBSERVATIONS) {
      throw new InsufficientDataException(kind().label(), MIN_OBSERVATIONS, n);
    }

    MinMaxScaler scaler = MinMaxScaler.fit(values);
    double[] scaled = scaler.scale(values);

    int window = Math.min(MAX_WINDOW, n - 1);
    double movingAverage = 0d;
    for (int i = n - window; i < n; i++) {
      movingAverage += scaled[i];
    }
    movingAverage /= window;

    double trend = 0d;
    if (window >= 2) {
      for (int i = n - window + 1; i < n; i++) {
        trend += scaled[i] - scaled[i - 1];
      }
      trend /= window - 1;
    }
    log.debug("Trend heuristic on {} points: window={}, movingAverage={}, trend={}",
        n, window, movingAverage, trend);

    List<Double> forecastValues = new ArrayList<>(steps);
    for (int i = 1; i <= steps; i++) {
      double next = movingAverage + i * trend + OSCILLATION_AMPLITUDE * Math.sin(i * Math.PI / 4);
      forecastValues.add(scaler.inverse(Math.max(0d, Math.min(1d, next))));
    }
    return new ForecastResult(ForecastSupport.futureTimestamps(series, steps), forecastValues,
        kind().label());
  }
}
