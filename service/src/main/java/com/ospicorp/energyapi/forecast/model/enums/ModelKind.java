package com.ospicorp.energyapi.forecast.model.enums;

import com.ospicorp.energyapi.error.UnknownModelException;
import java.util.List;
import java.util.Locale;

public enum ModelKind {
  STATISTICAL("statistical", "ARIMA", List.of("statistical", "arima")),
  TREND_HEURISTIC("trend_heuristic", "LSTM", List.of("trend_heuristic", "lstm"));

  private final String code;
  private final String label;
  private final List<String> aliases;

  ModelKind(String code, String label, List<String> aliases) {
    this.code = code;
    this.label = label;
    this.aliases = aliases;
  }

  public String code() {
    return code;
  }

  // Legacy label reported in forecast results
  public String label() {
    return label;
  }

  public static ModelKind fromCode(String value) {
    if (value == null) {
      throw new UnknownModelException(null);
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (ModelKind kind : values()) {
      if (kind.aliases.contains(normalized)) {
        return kind;
      }
    }
    throw new UnknownModelException(value);
  }
}
