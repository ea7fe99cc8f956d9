package com.ospicorp.energyapi.forecast.controller;

import com.ospicorp.energyapi.forecast.model.ForecastRequest;
import com.ospicorp.energyapi.forecast.model.ForecastResponse;
import com.ospicorp.energyapi.forecast.model.ForecastResult;
import com.ospicorp.energyapi.forecast.model.enums.ModelKind;
import com.ospicorp.energyapi.forecast.service.ForecastService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/forecasts")
@Tag(name = "Forecasts")
public class ForecastController {

  private final ForecastService svc;

  public ForecastController(ForecastService svc) {
    this.svc = svc;
  }

  @PostMapping
  @Operation(summary = "Forecast consumption",
      description = "Fit the requested model to the resampled history and forecast future "
          + "points. The statistical model (arima) also returns 95% confidence intervals; the "
          + "trend heuristic (lstm) does not.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Forecast",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = ForecastResponse.class))),
      @ApiResponse(responseCode = "400", description = "Invalid period, model or steps",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class))),
      @ApiResponse(responseCode = "422", description = "History cannot support the model",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public ForecastResponse forecast(
      @Valid @RequestBody(required = false) ForecastRequest request) {
    ForecastRequest effective = request != null
        ? request
        : new ForecastRequest(null, null, null);
    ForecastResult result = svc.forecast(effective.periodOrDefault(),
        effective.modelOrDefault(), effective.stepsOrDefault());
    return ForecastResponse.of(ModelKind.fromCode(effective.modelOrDefault()).code(), result);
  }
}
