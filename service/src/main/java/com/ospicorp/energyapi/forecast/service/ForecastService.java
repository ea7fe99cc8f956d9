package com.ospicorp.energyapi.forecast.service;

import com.ospicorp.energyapi.consumption.model.DataPoint;
import com.ospicorp.energyapi.consumption.service.ConsumptionService;
import com.ospicorp.energyapi.forecast.model.ForecastResult;
import com.ospicorp.energyapi.forecast.model.enums.ModelKind;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Forecasts the stored consumption history at the granularity of a view label.
 */
@Service
public class ForecastService {

  private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

  private final ConsumptionService consumptionService;
  private final ForecastEngine engine;
  private final int maxSteps;

  public ForecastService(ConsumptionService consumptionService, ForecastEngine engine,
      @Value("${energy.forecast.max-steps:365}") int maxSteps) {
    this.consumptionService = consumptionService;
    this.engine = engine;
    this.maxSteps = maxSteps;
  }

  public ForecastResult forecast(String view, String model, int steps) {
    if (steps < 1 || steps > maxSteps) {
      throw new IllegalArgumentException("steps must be between 1 and " + maxSteps
          + " but was " + steps);
    }
    ModelKind kind = ModelKind.fromCode(model);
    List<DataPoint> history = consumptionService.history(view);
    long started = System.nanoTime();
    ForecastResult result = engine.predict(history, kind, steps);
    log.debug("{} forecast of {} steps over {} points took {} ms", kind.label(), steps,
        history.size(), (System.nanoTime() - started) / 1_000_000);
    return result;
  }
}
