package com.mk.fx.qa.probe.execution.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP client used by probes to execute a single {@link Request} and capture the response.
 * Supports {@code {{name}}} variable resolution in paths and query strings, global headers and
 * timeout configuration.
 *
 * <p>Instances are thread-safe and are shared by every worker of a run. No retry logic is applied:
 * a failed call surfaces as an exception to the caller.
 */
@Slf4j
public class ProbeHttpClient implements AutoCloseable {

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Global headers sent with every request; request headers override them. */
  private final Map<String, String> headers;

  /** Variables for resolving placeholders in request paths and queries. */
  private final Map<String, String> variables;

  /** Base URL prepended to relative paths. */
  private final String baseUrl;

  private final Duration requestTimeout;

  /**
   * Creates a client.
   *
   * @param baseUrl the base URL for relative request paths
   * @param connectTimeout connection timeout
   * @param requestTimeout per-request timeout
   * @param headers global headers to include in all requests, may be null
   * @param variables variables for resolving placeholders, may be null
   * @throws IllegalArgumentException if the base URL is blank
   */
  public ProbeHttpClient(
      String baseUrl,
      Duration connectTimeout,
      Duration requestTimeout,
      Map<String, String> headers,
      Map<String, String> variables) {
    this.baseUrl = validateAndNormalizeBaseUrl(baseUrl);
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Objects.requireNonNull(connectTimeout, "connectTimeout"))
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    this.headers = headers != null ? Map.copyOf(headers) : Map.of();
    this.variables = variables != null ? Map.copyOf(variables) : Map.of();

    log.info(
        "ProbeHttpClient initialised - Base URL: {}, Connection timeout: {}, Request timeout: {}",
        this.baseUrl,
        connectTimeout,
        requestTimeout);
  }

  /**
   * Executes a request synchronously.
   *
   * @param request the request to execute
   * @return the captured response, including the measured round-trip time
   * @throws InterruptedException if the calling thread is interrupted while waiting
   * @throws RuntimeException wrapping the transport failure (timeout, refused connection, ...)
   */
  public RestResponseData execute(Request request) throws InterruptedException {
    Objects.requireNonNull(request, "Request cannot be null");

    var httpRequest = buildHttpRequest(request);
    log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());
    var startTime = System.nanoTime();
    try {
      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      var elapsed = System.nanoTime() - startTime;
      var result = buildResponseData(response, elapsed);
      log.debug(
          "Request completed in {} ms with status {}",
          result.getResponseTimeMs(),
          response.statusCode());
      return result;
    } catch (HttpTimeoutException e) {
      log.debug("Request timed out after {}: {}", requestTimeout, e.getMessage());
      throw new RuntimeException(
          "Request timed out after " + requestTimeout.toMillis() + "ms: " + e.getMessage(), e);
    } catch (java.io.IOException e) {
      log.debug("Error executing request to {}: {}", httpRequest.uri(), e.toString());
      throw new RuntimeException("Error executing request: " + describe(e), e);
    }
  }

  /** Resolves the absolute URI a request would be sent to. */
  public URI resolveUri(Request request) {
    var resolvedPath = resolveVars(request.getPath(), variables);
    String url;
    if (resolvedPath != null && resolvedPath.matches("(?i)^https?://.*")) {
      url = resolvedPath;
    } else if (resolvedPath == null || resolvedPath.isEmpty()) {
      url = baseUrl;
    } else {
      url = baseUrl + (resolvedPath.startsWith("/") ? resolvedPath : "/" + resolvedPath);
    }

    if (request.getQuery() != null && !request.getQuery().isEmpty()) {
      url += (url.contains("?") ? "&" : "?") + buildQueryString(request.getQuery(), variables);
    }
    return URI.create(url);
  }

  private HttpRequest buildHttpRequest(Request request) {
    if (request.getMethod() == null) {
      throw new IllegalArgumentException("Request method is required");
    }
    var requestBuilder = HttpRequest.newBuilder().uri(resolveUri(request)).timeout(requestTimeout);

    // global headers
    headers.forEach(requestBuilder::setHeader);

    // request-specific headers override
    if (request.getHeaders() != null) {
      request.getHeaders().forEach(requestBuilder::setHeader);
    }

    var body = request.getBody();
    if (body == null) {
      requestBuilder.method(request.getMethod().name(), HttpRequest.BodyPublishers.noBody());
    } else {
      requestBuilder.method(
          request.getMethod().name(), HttpRequest.BodyPublishers.ofString(serialiseBody(body)));
      if (!hasContentType(request)) {
        requestBuilder.setHeader("Content-Type", "application/json");
      }
    }
    return requestBuilder.build();
  }

  private String serialiseBody(Object body) {
    if (body instanceof String text) {
      return text;
    }
    try {
      return JsonUtil.toJson(body);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize request body: " + e.getMessage(), e);
    }
  }

  private boolean hasContentType(Request request) {
    if (request.getHeaders() != null
        && request.getHeaders().keySet().stream().anyMatch("Content-Type"::equalsIgnoreCase)) {
      return true;
    }
    return headers.keySet().stream().anyMatch("Content-Type"::equalsIgnoreCase);
  }

  private RestResponseData buildResponseData(HttpResponse<String> response, long elapsedNanos) {
    var result = new RestResponseData();
    result.setStatusCode(response.statusCode());
    Map<String, String> responseHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    response
        .headers()
        .map()
        .forEach((name, values) -> responseHeaders.put(name, String.join(",", values)));
    result.setHeaders(responseHeaders);
    result.setBody(response.body());
    result.setResponseTimeNanos(elapsedNanos);
    return result;
  }

  private String buildQueryString(Map<String, String> query, Map<String, String> variables) {
    return query.entrySet().stream()
        .filter(e -> e.getKey() != null && e.getValue() != null)
        .map(
            e ->
                encode(resolveVars(e.getKey(), variables))
                    + "="
                    + encode(resolveVars(e.getValue(), variables)))
        .collect(Collectors.joining("&"));
  }

  private String encode(String value) {
    return value != null ? URLEncoder.encode(value, StandardCharsets.UTF_8) : "";
  }

  private String resolveVars(String text, Map<String, String> variables) {
    if (text == null || text.isEmpty() || variables.isEmpty()) {
      return text;
    }
    var result = text;
    for (var entry : variables.entrySet()) {
      var placeholder = "{{" + entry.getKey() + "}}";
      if (result.contains(placeholder)) {
        result = result.replace(placeholder, entry.getValue());
      }
    }
    return result;
  }

  private static String describe(Throwable t) {
    var message = t.getMessage();
    return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
  }

  private String validateAndNormalizeBaseUrl(String baseUrl) {
    Objects.requireNonNull(baseUrl, "Base URL cannot be null");
    var trimmed = baseUrl.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("Base URL cannot be empty");
    }
    return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
  }

  @Override
  public void close() {}
}
