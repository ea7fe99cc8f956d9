package com.ospicorp.energyapi.error;

public class EmptySeriesException extends ForecastingException {

  public EmptySeriesException(String parameter) {
    super("Series '" + parameter + "' must contain at least one observation", parameter, 0, 2002,
        "empty-series");
  }
}
