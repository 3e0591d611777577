package com.mk.fx.qa.probe.execution.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScenarioRequest {

  @NotBlank
  @JsonProperty("id")
  private String id;

  @JsonProperty("name")
  private String name;

  @JsonProperty("category")
  private String category;

  @JsonProperty("severity")
  private String severity;

  @JsonProperty("method")
  private String method;

  @JsonAlias({"url", "path"})
  @JsonProperty("target")
  private String target;

  @JsonProperty("headers")
  private Map<String, String> headers;

  @JsonProperty("body")
  private Object body;

  @JsonAlias("expected")
  @JsonProperty("expectation")
  private ExpectationRequest expectation;
}
