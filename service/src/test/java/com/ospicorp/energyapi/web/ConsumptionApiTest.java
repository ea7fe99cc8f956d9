package com.ospicorp.energyapi.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = "energy.data.file=target/test-data/consumption-api.csv")
@ActiveProfiles("test")
class ConsumptionApiTest {

  @Autowired
  private TestRestTemplate rest;

  private ResponseEntity<List<Map<String, Object>>> readings(String period) {
    return rest.exchange("/v1/consumption?period=" + period, HttpMethod.GET, null,
        new ParameterizedTypeReference<>() {});
  }

  @Test
  void dailyViewReturnsHourlyBuckets() {
    ResponseEntity<List<Map<String, Object>>> response = readings("daily");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    List<Map<String, Object>> body = response.getBody();
    assertThat(body).hasSize(721);
    assertThat(body.get(0)).containsEntry("timestamp", "2025-01-01T00:00:00Z");
    assertThat(body.get(0)).containsEntry("unit", "kWh");
    assertThat(body.get(1)).containsEntry("timestamp", "2025-01-01T01:00:00Z");
  }

  @Test
  void weeklyViewReturnsDailyBuckets() {
    List<Map<String, Object>> body = readings("weekly").getBody();

    assertThat(body).hasSize(31);
    assertThat(body.get(30)).containsEntry("timestamp", "2025-01-31T00:00:00Z");
  }

  @Test
  void monthlyViewReturnsMondayWeeks() {
    List<Map<String, Object>> body = readings("monthly").getBody();

    assertThat(body).hasSize(5);
    assertThat(body.get(0)).containsEntry("timestamp", "2024-12-30T00:00:00Z");
  }

  @Test
  void unknownPeriodIsProblemDetail() {
    ResponseEntity<Map> response = rest.getForEntity("/v1/consumption?period=yearly", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getHeaders().getContentType().toString())
        .contains("application/problem+json");
    Map<String, Object> body = response.getBody();
    assertThat(body).containsKeys("type", "title", "status", "detail", "instance");
    assertThat(body.get("type").toString()).endsWith("/invalid-period");
    assertThat(body.get("parameter")).isEqualTo("period");
    assertThat(body.get("value")).isEqualTo("yearly");
  }

  @Test
  void csvFormatWritesHeaderRow() {
    ResponseEntity<String> response =
        rest.getForEntity("/v1/consumption?period=weekly&format=csv", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType().toString()).startsWith("text/csv");
    assertThat(response.getBody()).startsWith("timestamp,consumption,unit");
  }

  @Test
  void unsupportedFormatIsRejected() {
    ResponseEntity<Map> response =
        rest.getForEntity("/v1/consumption?format=xml", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 1007);
    assertThat(response.getBody()).containsEntry("parameter", "format")
        .containsEntry("moreInfo", "https://docs.energy-api.dev/errors/1007");
  }

  @Test
  void currentReadingCarriesConfiguredThreshold() {
    ResponseEntity<Map<String, Object>> response = rest.exchange("/v1/consumption/current",
        HttpMethod.GET, null, new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = response.getBody();
    assertThat(body).containsKey("reading");
    assertThat(((Number) body.get("threshold")).doubleValue()).isEqualTo(90d);
    @SuppressWarnings("unchecked")
    Map<String, Object> reading = (Map<String, Object>) body.get("reading");
    assertThat(((Number) reading.get("consumption")).doubleValue()).isGreaterThanOrEqualTo(0d);
  }
}
