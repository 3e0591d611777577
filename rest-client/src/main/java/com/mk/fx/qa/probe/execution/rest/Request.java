package com.mk.fx.qa.probe.execution.rest;

import java.util.Map;
import lombok.Data;

/**
 * A single outbound request. {@code path} is either relative to the client's base URL or an
 * absolute {@code http(s)://} URL. A {@link String} body is sent verbatim, anything else is
 * serialised as JSON.
 */
@Data
public class Request {
  private HttpMethod method;
  private String path;
  private Map<String, String> headers;
  private Map<String, String> query;
  private Object body;
}
