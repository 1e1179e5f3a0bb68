package com.ospicorp.tides.openapi;

import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class OpenApiExposureTest {

  @Autowired
  private TestRestTemplate rest;

  @Test
  void tideEndpointsAreDocumented() {
    ResponseEntity<Map<String, Object>> response = rest.exchange("/v3/api-docs", HttpMethod.GET,
        null, new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> docs = requireNonNull(response.getBody());
    assertThat(section(docs, "info")).containsEntry("title", "Tide Validation API");
    Map<String, Object> paths = section(docs, "paths");
    assertThat(paths).containsKeys("/v1/tides/fit", "/v1/tides/predict", "/v1/tides/validate");

    Map<String, Object> validate = section(section(paths, "/v1/tides/validate"), "post");
    Map<String, Object> responses = section(validate, "responses");
    assertThat(responses).containsKeys("200", "422");
    assertThat(section(section(responses, "200"), "content"))
        .containsKeys("application/json", "text/plain");
    assertThat(section(section(paths, "/v1/tides/predict"), "post").toString())
        .contains("text/csv");
  }

  @Test
  void reportAndModelSchemasArePublished() {
    ResponseEntity<String> response = rest.getForEntity("/v3/api-docs.yaml", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody())
        .contains("ValidationReport:")
        .contains("HarmonicModel:")
        .contains("mean_level")
        .contains("high_count");
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> section(Map<String, Object> parent, String key) {
    assertThat(parent).containsKey(key);
    return (Map<String, Object>) parent.get(key);
  }
}
