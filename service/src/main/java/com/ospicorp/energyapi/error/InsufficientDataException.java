package com.ospicorp.energyapi.error;

public class InsufficientDataException extends ForecastingException {

  public InsufficientDataException(String model, int required, int actual) {
    super("Model " + model + " needs at least " + required + " observations but series has "
        + actual, "series.size", actual, 2004, "insufficient-data");
  }
}
