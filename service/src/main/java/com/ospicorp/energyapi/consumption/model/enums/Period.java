package com.ospicorp.energyapi.consumption.model.enums;

import com.ospicorp.energyapi.error.InvalidPeriodException;
import java.time.Duration;
import java.util.Locale;

/**
 * Bucket width used when resampling.
 *
 * <p>Callers of the consumption API ask for a <em>view</em> label that is one step coarser
 * than the bucket it selects: the {@code daily} view is built from hourly buckets, the
 * {@code weekly} view from daily buckets and the {@code monthly} view from weekly buckets.
 */
public enum Period {
  HOURLY("hourly", "daily", Duration.ofHours(1)),
  DAILY("daily", "weekly", Duration.ofDays(1)),
  WEEKLY("weekly", "monthly", Duration.ofDays(7));

  private final String code;
  private final String view;
  private final Duration width;

  Period(String code, String view, Duration width) {
    this.code = code;
    this.view = view;
    this.width = width;
  }

  public String code() {
    return code;
  }

  public String view() {
    return view;
  }

  public Duration width() {
    return width;
  }

  public static Period fromCode(String value) {
    String normalized = normalize(value);
    for (Period period : values()) {
      if (period.code.equals(normalized)) {
        return period;
      }
    }
    throw new InvalidPeriodException(value);
  }

  public static Period fromView(String value) {
    String normalized = normalize(value);
    for (Period period : values()) {
      if (period.view.equals(normalized)) {
        return period;
      }
    }
    throw new InvalidPeriodException(value);
  }

  private static String normalize(String value) {
    if (value == null) {
      throw new InvalidPeriodException(null);
    }
    return value.trim().toLowerCase(Locale.ROOT);
  }
}
