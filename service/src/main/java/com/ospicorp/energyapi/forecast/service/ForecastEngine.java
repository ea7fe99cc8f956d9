package com.ospicorp.energyapi.forecast.service;

import com.ospicorp.energyapi.consumption.model.DataPoint;
import com.ospicorp.energyapi.error.UnknownModelException;
import com.ospicorp.energyapi.forecast.model.ForecastResult;
import com.ospicorp.energyapi.forecast.model.enums.ModelKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Dispatches a forecast request to the strategy registered for the requested model.
 */
@Service
public class ForecastEngine {

  private final Map<ModelKind, ForecastStrategy> strategies = new EnumMap<>(ModelKind.class);

  public ForecastEngine(List<ForecastStrategy> strategies) {
    for (ForecastStrategy strategy : strategies) {
      ForecastStrategy previous = this.strategies.put(strategy.kind(), strategy);
      if (previous != null) {
        throw new IllegalStateException("Duplicate forecast strategies for " + strategy.kind()
            + ": " + previous.getClass().getName() + ", " + strategy.getClass().getName());
      }
    }
  }

  public ForecastResult predict(List<DataPoint> series, String model, int steps) {
    return predict(series, ModelKind.fromCode(model), steps);
  }

  public ForecastResult predict(List<DataPoint> series, ModelKind kind, int steps) {
    ForecastStrategy strategy = kind == null ? null : strategies.get(kind);
    if (strategy == null) {
      throw new UnknownModelException(kind);
    }
    return strategy.forecast(series, steps);
  }
}
