package com.ospicorp.energyapi.alert.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AlertLevel {
  INFO,
  WARNING,
  DANGER;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
