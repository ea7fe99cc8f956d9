package com.ospicorp.energyapi.forecast.model;

public record ConfidenceInterval(double lower, double upper) {

  public double width() {
    return upper - lower;
  }
}
