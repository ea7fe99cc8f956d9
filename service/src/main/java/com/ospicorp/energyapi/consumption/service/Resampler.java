package com.ospicorp.energyapi.consumption.service;

import com.ospicorp.energyapi.consumption.model.DataPoint;
import com.ospicorp.energyapi.consumption.model.enums.Period;
import com.ospicorp.energyapi.error.EmptySeriesException;
import com.ospicorp.energyapi.error.InvalidPeriodException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates a raw series into fixed-width, left-closed buckets aligned to UTC calendar
 * boundaries: the top of the hour, midnight, or Monday 00:00 for weekly buckets.
 *
 * <p>The input must be sorted ascending by timestamp; it is not re-sorted here. Each bucket
 * holds the mean of the raw values that fall inside it. Every bucket between the first and
 * the last observation is emitted, and empty ones are forward-filled (see
 * {@link Filler#forwardFill(List)}).
 */
public final class Resampler {
  private Resampler() {
  }

  public static List<DataPoint> resample(List<DataPoint> in, Period period) {
    if (period == null) {
      throw new InvalidPeriodException(null);
    }
    if (in == null || in.isEmpty()) {
      throw new EmptySeriesException("series");
    }

    Map<Instant, Bucket> buckets = new HashMap<>();
    for (DataPoint p : in) {
      Bucket bucket = buckets.computeIfAbsent(bucketStart(p.timestamp(), period), k -> new Bucket());
      if (p.value() != null) {
        bucket.add(p.value());
      }
    }

    Instant first = bucketStart(in.get(0).timestamp(), period);
    Instant last = bucketStart(in.get(in.size() - 1).timestamp(), period);
    List<DataPoint> out = new ArrayList<>();
    for (Instant start = first; !start.isAfter(last); start = start.plus(period.width())) {
      Bucket bucket = buckets.get(start);
      out.add(new DataPoint(start, bucket == null ? null : bucket.mean()));
    }
    return Filler.forwardFill(out);
  }

  static Instant bucketStart(Instant timestamp, Period period) {
    return switch (period) {
      case HOURLY -> timestamp.truncatedTo(ChronoUnit.HOURS);
      case DAILY -> timestamp.truncatedTo(ChronoUnit.DAYS);
      case WEEKLY -> LocalDate.ofInstant(timestamp, ZoneOffset.UTC)
          .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
          .atStartOfDay(ZoneOffset.UTC)
          .toInstant();
    };
  }

  private static final class Bucket {
    private double sum;
    private int count;

    void add(double value) {
      sum += value;
      count++;
    }

    Double mean() {
      return count == 0 ? null : sum / count;
    }
  }
}
