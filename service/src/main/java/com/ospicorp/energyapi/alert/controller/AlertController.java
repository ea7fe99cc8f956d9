package com.ospicorp.energyapi.alert.controller;

import com.ospicorp.energyapi.alert.model.Alert;
import com.ospicorp.energyapi.consumption.service.ConsumptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequestMapping("/v1/alerts")
@Tag(name = "Alerts")
public class AlertController {

  private final ConsumptionService svc;

  public AlertController(ConsumptionService svc) {
    this.svc = svc;
  }

  @GetMapping("/evaluate")
  @Operation(summary = "Evaluate a consumption value",
      description = "Return an alert when the value is above the threshold, or 204 otherwise.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Threshold exceeded",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = Alert.class))),
      @ApiResponse(responseCode = "204", description = "Within threshold"),
      @ApiResponse(responseCode = "400", description = "Invalid value or threshold",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public ResponseEntity<Alert> evaluate(
      @RequestParam @Parameter(description = "Consumption value", example = "100") double value,
      @RequestParam(required = false)
          @Parameter(description = "Threshold; defaults to the configured value", example = "90")
          @Positive Double threshold) {
    return svc.evaluateAlert(value, threshold)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }
}
