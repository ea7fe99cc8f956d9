package com.ospicorp.energyapi.consumption.service;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.energyapi.consumption.model.DataPoint;
import com.ospicorp.energyapi.error.DataSourceException;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds a synthetic hourly consumption history: a daily sine cycle, lower weekend usage and
 * uniform noise.
 */
@Component
public class SampleDataGenerator {

  private static final Logger log = LoggerFactory.getLogger(SampleDataGenerator.class);
  static final Instant START = Instant.parse("2025-01-01T00:00:00Z");
  static final Duration SPAN = Duration.ofDays(30);
  private static final Duration STEP = Duration.ofHours(1);
  private static final double NOISE_AMPLITUDE = 5d;
  private static final double WEEKEND_FACTOR = 0.8d;

  private final long seed;
  private final CsvMapper mapper = new CsvMapper();

  public SampleDataGenerator(@Value("${energy.sample.seed:20250101}") long seed) {
    this.seed = seed;
  }

  public List<DataPoint> generate() {
    Random random = new Random(seed);
    List<DataPoint> points = new ArrayList<>();
    Instant end = START.plus(SPAN);
    for (Instant current = START; !current.isAfter(end); current = current.plus(STEP)) {
      ZonedDateTime time = current.atZone(ZoneOffset.UTC);
      double base = 30d + 20d * Math.sin(Math.PI * time.getHour() / 12d);
      DayOfWeek day = time.getDayOfWeek();
      double weekdayFactor = (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY)
          ? WEEKEND_FACTOR
          : 1d;
      double noise = (random.nextDouble() * 2d - 1d) * NOISE_AMPLITUDE;
      double consumption = Math.max(0d, base * weekdayFactor + noise);
      points.add(new DataPoint(current, Math.round(consumption * 100d) / 100d));
    }
    return points;
  }

  public void writeTo(Path file) {
    List<DataPoint> points = generate();
    CsvSchema schema = CsvSchema.builder()
        .addColumn(ConsumptionDataSource.TIMESTAMP_COLUMN)
        .addColumn(ConsumptionDataSource.CONSUMPTION_COLUMN)
        .setUseHeader(true)
        .build();
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
          SequenceWriter sequence = mapper.writer(schema).writeValues(writer)) {
        for (DataPoint point : points) {
          Map<String, Object> row = new LinkedHashMap<>();
          row.put(ConsumptionDataSource.TIMESTAMP_COLUMN,
              ConsumptionDataSource.TIMESTAMP_FORMAT.format(point.timestamp()));
          row.put(ConsumptionDataSource.CONSUMPTION_COLUMN, point.value());
          sequence.write(row);
        }
        sequence.flush();
      }
    } catch (IOException ex) {
      throw new DataSourceException("Unable to write sample data to " + file, ex);
    }
    log.info("Generated {} sample consumption rows in {}", points.size(), file);
  }
}
