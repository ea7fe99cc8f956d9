package com.ospicorp.energyapi.alert.service;

import com.ospicorp.energyapi.alert.model.Alert;
import com.ospicorp.energyapi.alert.model.AlertLevel;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compares a consumption value against a threshold supplied by the caller.
 *
 * <p>No alert is raised unless the value is strictly above the threshold. The level depends
 * on how far above it is: more than 30% is {@link AlertLevel#DANGER}, more than 10% is
 * {@link AlertLevel#WARNING}, anything else {@link AlertLevel#INFO}.
 */
@Component
public class AlertEvaluator {

  private static final Logger log = LoggerFactory.getLogger(AlertEvaluator.class);
  private static final double DANGER_PERCENT = 30d;
  private static final double WARNING_PERCENT = 10d;

  private final Clock clock;

  public AlertEvaluator(Clock clock) {
    this.clock = clock;
  }

  public Optional<Alert> evaluate(double value, double threshold) {
    return evaluate(value, threshold, clock.instant());
  }

  public Optional<Alert> evaluate(double value, double threshold, Instant at) {
    if (!Double.isFinite(threshold) || threshold <= 0d) {
      throw new IllegalArgumentException("threshold must be a positive number but was "
          + threshold);
    }
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException("value must be a finite number but was " + value);
    }
    if (value <= threshold) {
      return Optional.empty();
    }

    double percentOver = (value - threshold) / threshold * 100d;
    String formatted = String.format(Locale.ROOT, "%.1f", percentOver);
    Alert alert;
    if (percentOver > DANGER_PERCENT) {
      alert = new Alert(AlertLevel.DANGER,
          "Critical: Energy consumption is " + formatted + "% above threshold!", at);
    } else if (percentOver > WARNING_PERCENT) {
      alert = new Alert(AlertLevel.WARNING,
          "Warning: Energy consumption is " + formatted + "% above threshold.", at);
    } else {
      alert = new Alert(AlertLevel.INFO,
          "Notice: Energy consumption has exceeded threshold by " + formatted + "%.", at);
    }
    log.debug("Consumption {} exceeds threshold {} by {}% -> {}", value, threshold, formatted,
        alert.level());
    return Optional.of(alert);
  }
}
