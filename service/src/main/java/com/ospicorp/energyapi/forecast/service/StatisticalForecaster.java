package com.ospicorp.energyapi.forecast.service;

import com.ospicorp.energyapi.consumption.model.DataPoint;
import com.ospicorp.energyapi.forecast.model.ConfidenceInterval;
import com.ospicorp.energyapi.forecast.model.ForecastResult;
import com.ospicorp.energyapi.forecast.model.enums.ModelKind;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * ARIMA(1,1,1) forecasts with 95% confidence intervals. The order is fixed, not tuned.
 */
@Component
public class StatisticalForecaster implements ForecastStrategy {

  private static final Logger log = LoggerFactory.getLogger(StatisticalForecaster.class);
  private static final double Z_95 = 1.959963984540054d;

  @Override
  public ModelKind kind() {
    return ModelKind.STATISTICAL;
  }

  @Override
  public ForecastResult forecast(List<DataPoint> series, int steps) {
    ForecastSupport.requirePositiveSteps(steps);
    double[] values = ForecastSupport.definedValues(series);
    ArimaModel model = ArimaModel.fit(values);
    log.debug("Fitted ARIMA(1,1,1) on {} points: phi={}, theta={}, sigma2={}",
        values.length, model.phi(), model.theta(), model.sigma2());

    double[] point = model.forecast(steps);
    double[] stderr = model.standardErrors(steps);
    List<Double> forecastValues = new ArrayList<>(steps);
    List<ConfidenceInterval> intervals = new ArrayList<>(steps);
    for (int h = 0; h < steps; h++) {
      forecastValues.add(point[h]);
      double margin = Z_95 * stderr[h];
      intervals.add(new ConfidenceInterval(point[h] - margin, point[h] + margin));
    }
    return new ForecastResult(ForecastSupport.futureTimestamps(series, steps), forecastValues,
        kind().label(), intervals);
  }
}
