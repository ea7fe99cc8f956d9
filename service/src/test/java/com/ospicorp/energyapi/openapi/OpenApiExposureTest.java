package com.ospicorp.energyapi.openapi;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "energy.data.file=target/test-data/openapi.csv")
class OpenApiExposureTest {

  @Autowired
  private TestRestTemplate rest;

  @Test
  void openapiYamlServed() {
    ResponseEntity<String> response = rest.getForEntity("/v3/api-docs.yaml", String.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).contains("openapi:");
    assertThat(response.getBody()).contains("ProblemDetail");
    assertThat(response.getBody()).contains("/v1/forecasts");
  }

  @Test
  void pingRespondsWithPong() {
    ResponseEntity<String> response = rest.getForEntity("/v1/ping", String.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).contains("\"pong\":true");
  }

  @Test
  @SuppressWarnings("unchecked")
  void rootListsViewsAndModels() {
    ResponseEntity<Map> response = rest.getForEntity("/", Map.class);
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("service", "energy-forecast-service");
    assertThat((List<Object>) response.getBody().get("periods"))
        .containsExactly("daily", "weekly", "monthly");
    assertThat((List<Object>) response.getBody().get("models"))
        .containsExactly("statistical", "trend_heuristic");
  }
}
