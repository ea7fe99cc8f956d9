package com.ospicorp.energyapi.error;

public class InvalidPeriodException extends ForecastingException {

  public InvalidPeriodException(Object period) {
    super("Invalid period: " + period + ". Supported values: hourly,daily,weekly "
        + "(views: daily,weekly,monthly).", "period", period, 2001, "invalid-period");
  }
}
