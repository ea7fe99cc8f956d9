package com.ospicorp.energyapi.error;

public class UnknownModelException extends ForecastingException {

  public UnknownModelException(Object model) {
    super("Unknown model: " + model + ". Supported values: statistical (arima), "
        + "trend_heuristic (lstm).", "model", model, 2005, "unknown-model");
  }
}
