package com.ospicorp.energyapi.consumption.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.energyapi.consumption.model.DataPoint;
import com.ospicorp.energyapi.error.DataSourceException;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads the raw consumption history from a {@code timestamp,consumption} CSV file.
 * Timestamps are either {@code yyyy-MM-dd HH:mm:ss} in UTC or ISO-8601 instants. A sample
 * file is generated on first use when none exists.
 */
@Component
public class ConsumptionDataSource {

  private static final Logger log = LoggerFactory.getLogger(ConsumptionDataSource.class);
  static final String TIMESTAMP_COLUMN = "timestamp";
  static final String CONSUMPTION_COLUMN = "consumption";
  private static final DateTimeFormatter LOCAL_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
  static final DateTimeFormatter TIMESTAMP_FORMAT = LOCAL_FORMAT.withZone(ZoneOffset.UTC);

  private final Path dataFile;
  private final SampleDataGenerator generator;
  private final CsvMapper mapper = new CsvMapper();
  private final Object generationLock = new Object();

  public ConsumptionDataSource(
      @Value("${energy.data.file:data/sample_energy_data.csv}") Path dataFile,
      SampleDataGenerator generator) {
    this.dataFile = dataFile;
    this.generator = generator;
  }

  /** Raw observations sorted ascending by timestamp. */
  public List<DataPoint> load() {
    ensureDataFile();
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    List<DataPoint> points = new ArrayList<>();
    try (Reader reader = Files.newBufferedReader(dataFile, StandardCharsets.UTF_8);
        MappingIterator<Map<String, String>> rows =
            mapper.readerForMapOf(String.class).with(schema).readValues(reader)) {
      int line = 1;
      while (rows.hasNext()) {
        line++;
        points.add(toDataPoint(rows.next(), line));
      }
    } catch (IOException ex) {
      throw new DataSourceException("Unable to read consumption data from " + dataFile, ex);
    }
    points.sort(Comparator.comparing(DataPoint::timestamp));
    log.debug("Loaded {} consumption rows from {}", points.size(), dataFile);
    return points;
  }

  public Path dataFile() {
    return dataFile;
  }

  private void ensureDataFile() {
    if (Files.exists(dataFile)) {
      return;
    }
    synchronized (generationLock) {
      if (!Files.exists(dataFile)) {
        log.info("Consumption data file {} not found; generating sample data", dataFile);
        generateAtomically();
      }
    }
  }

  // Readers outside the lock only ever see a missing or a complete file.
  private void generateAtomically() {
    Path target = dataFile.toAbsolutePath();
    Path staging = null;
    try {
      Files.createDirectories(target.getParent());
      staging = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
      generator.writeTo(staging);
      Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException ex) {
      throw new DataSourceException("Unable to generate sample data at " + dataFile, ex);
    } finally {
      deleteQuietly(staging);
    }
  }

  private void deleteQuietly(Path staging) {
    if (staging == null) {
      return;
    }
    try {
      Files.deleteIfExists(staging);
    } catch (IOException ex) {
      log.warn("Unable to delete staging file {}: {}", staging, ex.getMessage());
    }
  }

  private DataPoint toDataPoint(Map<String, String> row, int line) {
    String timestamp = row.get(TIMESTAMP_COLUMN);
    String consumption = row.get(CONSUMPTION_COLUMN);
    if (!StringUtils.hasText(timestamp)) {
      throw new DataSourceException("Missing timestamp at line " + line + " of " + dataFile, null);
    }
    Double value;
    Instant at;
    try {
      value = StringUtils.hasText(consumption) ? Double.valueOf(consumption.trim()) : null;
      at = parseTimestamp(timestamp.trim());
    } catch (NumberFormatException | DateTimeParseException ex) {
      throw new DataSourceException("Invalid row at line " + line + " of " + dataFile + ": "
          + ex.getMessage(), ex);
    }
    if (value != null && (!Double.isFinite(value) || value < 0d)) {
      throw new DataSourceException("Invalid consumption '" + consumption.trim() + "' at line "
          + line + " of " + dataFile + ": must be a finite number >= 0", null);
    }
    return new DataPoint(at, value);
  }

  static Instant parseTimestamp(String text) {
    if (text.indexOf('T') < 0) {
      return LocalDateTime.parse(text, LOCAL_FORMAT).toInstant(ZoneOffset.UTC);
    }
    if (text.endsWith("Z") || text.lastIndexOf('+') > 0 || text.lastIndexOf('-') > 9) {
      return OffsetDateTime.parse(text).toInstant();
    }
    return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
  }
}
