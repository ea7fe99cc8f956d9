package com.ospicorp.energyapi.web;

import com.ospicorp.energyapi.consumption.model.enums.Period;
import com.ospicorp.energyapi.forecast.model.enums.ModelKind;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Service")
public class RootController {

  private final String serviceName;

  public RootController(
      @Value("${spring.application.name:energy-forecast-service}") String serviceName) {
    this.serviceName = serviceName;
  }

  @GetMapping("/")
  @Operation(summary = "Describe the service",
      description = "List the accepted consumption views and forecasting models.")
  public Map<String, Object> root() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", serviceName);
    body.put("status", "ok");
    body.put("periods", Arrays.stream(Period.values()).map(Period::view).toList());
    body.put("models", Arrays.stream(ModelKind.values()).map(ModelKind::code).toList());
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
