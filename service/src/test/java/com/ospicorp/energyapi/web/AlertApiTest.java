package com.ospicorp.energyapi.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "energy.data.file=target/test-data/alert-api.csv",
        "energy.alert.threshold=50"
    })
class AlertApiTest {

  @Autowired
  private TestRestTemplate rest;

  @Test
  void explicitThresholdRaisesWarning() {
    ResponseEntity<Map> response =
        rest.getForEntity("/v1/alerts/evaluate?value=100&threshold=90", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("level", "warning");
    assertThat(response.getBody().get("message").toString()).contains("11.1%");
    assertThat(response.getBody()).containsKey("timestamp");
  }

  @Test
  void configuredThresholdIsTheDefault() {
    ResponseEntity<Map> response = rest.getForEntity("/v1/alerts/evaluate?value=70", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("level", "danger");
  }

  @Test
  void withinThresholdIsNoContent() {
    ResponseEntity<Map> response =
        rest.getForEntity("/v1/alerts/evaluate?value=90&threshold=90", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
    assertThat(response.getBody()).isNull();
  }

  @Test
  void zeroThresholdIsBadRequest() {
    ResponseEntity<Map> response =
        rest.getForEntity("/v1/alerts/evaluate?value=10&threshold=0", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().get("detail").toString()).contains("threshold");
  }

  @Test
  void negativeThresholdIsBadRequest() {
    ResponseEntity<Map> response =
        rest.getForEntity("/v1/alerts/evaluate?value=10&threshold=-5", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().get("detail").toString()).contains("threshold");
  }

  @Test
  void missingValueIsBadRequest() {
    ResponseEntity<Map> response = rest.getForEntity("/v1/alerts/evaluate", Map.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }
}
