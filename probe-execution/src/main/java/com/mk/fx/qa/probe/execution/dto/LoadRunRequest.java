package com.mk.fx.qa.probe.execution.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Request to start a load run. Endpoints use {@code "METHOD /path"} notation; duration accepts
 * {@code 500ms}, {@code 30s}, {@code 5m}, {@code 1h} or a bare number of seconds.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoadRunRequest {

  @NotBlank
  @JsonProperty("baseUrl")
  private String baseUrl;

  @JsonProperty("profile")
  private String profile;

  @Min(1)
  @JsonProperty("concurrency")
  private Integer concurrency;

  @JsonProperty("duration")
  private String duration;

  @Positive
  @JsonProperty("ratePerSec")
  private Double ratePerSec;

  @NotEmpty
  @JsonProperty("endpoints")
  private List<String> endpoints;

  @JsonProperty("headers")
  private Map<String, String> headers;

  @JsonProperty("variables")
  private Map<String, String> variables;
}
