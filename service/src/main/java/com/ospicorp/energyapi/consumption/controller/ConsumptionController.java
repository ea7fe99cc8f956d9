package com.ospicorp.energyapi.consumption.controller;

import com.ospicorp.energyapi.consumption.model.CurrentConsumption;
import com.ospicorp.energyapi.consumption.model.Reading;
import com.ospicorp.energyapi.consumption.service.ConsumptionService;
import com.ospicorp.energyapi.error.InvalidParameterException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/consumption")
@Tag(name = "Consumption")
public class ConsumptionController {
  private static final MediaType CSV_MEDIA_TYPE = MediaType.valueOf("text/csv");
  private static final int UNSUPPORTED_FORMAT = 1007;

  private final ConsumptionService svc;

  public ConsumptionController(ConsumptionService svc) {
    this.svc = svc;
  }

  @GetMapping
  @Operation(summary = "Get resampled consumption",
      description = "Load the consumption history and resample it for a view. The daily view "
          + "uses hourly buckets, weekly uses daily buckets and monthly uses weekly buckets.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Resampled readings",
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = Reading.class))),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Invalid period",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public ResponseEntity<List<Reading>> readings(
      @RequestParam(defaultValue = "daily")
          @Parameter(description = "View label: daily, weekly or monthly", example = "daily")
          String period,
      @RequestParam(name = "format", required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    return ResponseEntity.ok()
        .contentType(contentType)
        .body(svc.readings(period));
  }

  @GetMapping("/current")
  @Operation(summary = "Get simulated live consumption",
      description = "Simulate the current reading from the latest observation and evaluate it "
          + "against the configured alert threshold.")
  public CurrentConsumption current() {
    return svc.current();
  }

  private static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("format", format,
          "Invalid format value. Supported values: json,csv.", UNSUPPORTED_FORMAT);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
