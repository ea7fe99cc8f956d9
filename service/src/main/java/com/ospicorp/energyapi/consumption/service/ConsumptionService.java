package com.ospicorp.energyapi.consumption.service;

import com.ospicorp.energyapi.alert.model.Alert;
import com.ospicorp.energyapi.alert.service.AlertEvaluator;
import com.ospicorp.energyapi.consumption.model.CurrentConsumption;
import com.ospicorp.energyapi.consumption.model.DataPoint;
import com.ospicorp.energyapi.consumption.model.Reading;
import com.ospicorp.energyapi.consumption.model.enums.Period;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class ConsumptionService {

  private static final Logger log = LoggerFactory.getLogger(ConsumptionService.class);
  private static final double LIVE_FLUCTUATION = 0.1d;
  private static final double LIVE_DAILY_AMPLITUDE = 0.2d;

  private final ConsumptionDataSource dataSource;
  private final AlertEvaluator alertEvaluator;
  private final Clock clock;
  private final double alertThreshold;
  private final String unit;

  public ConsumptionService(ConsumptionDataSource dataSource, AlertEvaluator alertEvaluator,
      Clock clock,
      @Value("${energy.alert.threshold:90}") double alertThreshold,
      @Value("${energy.data.unit:kWh}") String unit) {
    this.dataSource = dataSource;
    this.alertEvaluator = alertEvaluator;
    this.clock = clock;
    this.alertThreshold = alertThreshold;
    this.unit = unit;
  }

  /** Raw history resampled for a view label ({@code daily}, {@code weekly}, {@code monthly}). */
  public List<DataPoint> history(String view) {
    Period period = Period.fromView(view);
    List<DataPoint> raw = dataSource.load();
    List<DataPoint> resampled = Resampler.resample(raw, period);
    log.debug("Resampled {} raw rows into {} {} buckets for view {}", raw.size(),
        resampled.size(), period.code(), view);
    return resampled;
  }

  public List<Reading> readings(String view) {
    return history(view).stream()
        .map(point -> Reading.of(point, unit))
        .toList();
  }

  public Optional<Alert> evaluateAlert(double value, Double threshold) {
    return alertEvaluator.evaluate(value, threshold != null ? threshold : alertThreshold);
  }

  /**
   * Simulated live reading: the latest raw value shaped by a daily cycle with up to 10%
   * random fluctuation, checked against the configured threshold.
   */
  public CurrentConsumption current() {
    List<DataPoint> raw = dataSource.load();
    double last = raw.stream()
        .filter(DataPoint::isDefined)
        .reduce((first, second) -> second)
        .map(DataPoint::value)
        .orElse(0d);
    Instant now = clock.instant();
    int hour = now.atZone(ZoneOffset.UTC).getHour();
    double timeFactor = 1d + LIVE_DAILY_AMPLITUDE * Math.sin(Math.PI * hour / 12d);
    double fluctuation = last
        * ThreadLocalRandom.current().nextDouble(-LIVE_FLUCTUATION, LIVE_FLUCTUATION);
    double value = Math.max(0d, last * timeFactor + fluctuation);

    Alert alert = alertEvaluator.evaluate(value, alertThreshold, now).orElse(null);
    return new CurrentConsumption(new Reading(now, value, unit), alertThreshold, alert);
  }

  public double alertThreshold() {
    return alertThreshold;
  }

  public String unit() {
    return unit;
  }
}
