package com.mk.fx.qa.probe.execution.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Data;

/** Response checks for one scenario; omitted fields are not checked. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExpectationRequest {

  @JsonProperty("statusCode")
  private Integer statusCode;

  @JsonAlias("statusCodeRange")
  @JsonProperty("statusRange")
  private StatusRangeRequest statusRange;

  @JsonProperty("bodyContains")
  private List<String> bodyContains;

  @JsonProperty("bodyNotContains")
  private List<String> bodyNotContains;

  @JsonProperty("headerContains")
  private Map<String, String> headerContains;

  @JsonProperty("maxDurationMs")
  private Long maxDurationMs;

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class StatusRangeRequest {

    @JsonProperty("min")
    private int min;

    @JsonProperty("max")
    private int max;
  }
}
