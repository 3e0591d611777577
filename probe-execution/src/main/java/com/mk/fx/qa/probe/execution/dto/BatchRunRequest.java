package com.mk.fx.qa.probe.execution.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.Map;
import lombok.Data;

/** Request to verify a batch of scenarios against one base URL. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchRunRequest {

  @NotBlank
  @JsonProperty("baseUrl")
  private String baseUrl;

  @Min(1)
  @JsonProperty("concurrency")
  private Integer concurrency;

  @JsonProperty("category")
  private String category;

  @JsonProperty("categories")
  private List<String> categories;

  @JsonProperty("headers")
  private Map<String, String> headers;

  @JsonProperty("variables")
  private Map<String, String> variables;

  @Valid
  @NotEmpty
  @JsonProperty("scenarios")
  private List<ScenarioRequest> scenarios;
}
