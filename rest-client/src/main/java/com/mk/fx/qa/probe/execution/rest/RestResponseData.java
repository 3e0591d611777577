package com.mk.fx.qa.probe.execution.rest;

import java.util.Map;
import lombok.Data;

@Data
public class RestResponseData {
  private int statusCode;
  private Map<String, String> headers;
  private String body;
  private long responseTimeNanos;

  public long getResponseTimeMs() {
    return responseTimeNanos / 1_000_000;
  }
}
