package com.ospicorp.energyapi.forecast.service;

import com.ospicorp.energyapi.consumption.model.DataPoint;
import com.ospicorp.energyapi.forecast.model.ForecastResult;
import com.ospicorp.energyapi.forecast.model.enums.ModelKind;
import java.util.List;

/**
 * A forecasting approach that turns a regular series into {@code steps} future points.
 *
 * <p>Implementations must not keep per-call state in fields: the same instance serves
 * concurrent requests.
 */
public interface ForecastStrategy {

  ModelKind kind();

  ForecastResult forecast(List<DataPoint> series, int steps);
}
