package com.ospicorp.energyapi.forecast.model;

public record ForecastResponse(boolean success, String model, ForecastResult predictions) {

  public static ForecastResponse of(String model, ForecastResult predictions) {
    return new ForecastResponse(true, model, predictions);
  }
}
