package com.ospicorp.energyapi.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "energy.data.file=target/test-data/forecast-api.csv")
@ActiveProfiles("test")
class ForecastApiTest {

  @Autowired
  private TestRestTemplate rest;

  private ResponseEntity<Map<String, Object>> post(Map<String, Object> body) {
    return rest.exchange("/v1/forecasts", HttpMethod.POST, new HttpEntity<>(body),
        new ParameterizedTypeReference<>() {});
  }

  @Test
  @SuppressWarnings("unchecked")
  void arimaForecastIncludesConfidenceIntervals() {
    ResponseEntity<Map<String, Object>> response =
        post(Map.of("period", "weekly", "model", "arima", "steps", 5));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = response.getBody();
    assertThat(body).containsEntry("success", true).containsEntry("model", "statistical");
    Map<String, Object> predictions = (Map<String, Object>) body.get("predictions");
    assertThat(predictions).containsEntry("model_type", "ARIMA");
    assertThat((List<Object>) predictions.get("values")).hasSize(5);
    assertThat((List<Object>) predictions.get("confidence_intervals")).hasSize(5);
    List<Object> timestamps = (List<Object>) predictions.get("timestamps");
    assertThat(timestamps).containsExactly(
        "2025-02-01T00:00:00Z",
        "2025-02-02T00:00:00Z",
        "2025-02-03T00:00:00Z",
        "2025-02-04T00:00:00Z",
        "2025-02-05T00:00:00Z");
  }

  @Test
  @SuppressWarnings("unchecked")
  void lstmForecastOmitsConfidenceIntervals() {
    ResponseEntity<Map<String, Object>> response =
        post(Map.of("period", "daily", "model", "lstm", "steps", 3));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> predictions = (Map<String, Object>) response.getBody().get("predictions");
    assertThat(predictions).containsEntry("model_type", "LSTM");
    assertThat(predictions).doesNotContainKey("confidence_intervals");
    assertThat((List<Object>) predictions.get("values")).hasSize(3);
  }

  @Test
  void defaultsApplyToEmptyRequest() {
    ResponseEntity<Map<String, Object>> response = post(Map.of());

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("model", "statistical");
  }

  @Test
  void unknownModelIsBadRequest() {
    ResponseEntity<Map<String, Object>> response =
        post(Map.of("period", "daily", "model", "prophet", "steps", 3));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().get("type").toString()).endsWith("/unknown-model");
    assertThat(response.getBody()).containsEntry("value", "prophet");
  }

  @Test
  void nonPositiveStepsIsBadRequest() {
    ResponseEntity<Map<String, Object>> response =
        post(Map.of("period", "daily", "model", "arima", "steps", 0));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().get("detail").toString()).startsWith("steps: ");
  }

  @Test
  void stepsAboveLimitIsBadRequest() {
    ResponseEntity<Map<String, Object>> response =
        post(Map.of("period", "daily", "model", "lstm", "steps", 1000));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().get("detail").toString()).startsWith("steps: ");
    assertThat(response.getBody().get("type").toString()).endsWith("/invalid-parameter");
  }
}
