package com.ospicorp.energyapi.error;

public class ModelFitException extends ForecastingException {

  public ModelFitException(String message, String parameter, Object value) {
    super(message, parameter, value, 2003, "model-fit-error");
  }
}
