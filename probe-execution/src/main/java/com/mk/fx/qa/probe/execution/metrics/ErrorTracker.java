package com.mk.fx.qa.probe.execution.metrics;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts failed invocations by category. Transport failures are classified by root cause, HTTP
 * failures by status class. Keeps the first few distinct messages as samples.
 */
public final class ErrorTracker {
  private static final int MAX_ERROR_SAMPLES = 5;

  private final AtomicLong totalErrors = new AtomicLong();
  private final Map<String, AtomicLong> errorBreakdown = new ConcurrentHashMap<>();
  private final List<ErrorSample> errorSamples = new CopyOnWriteArrayList<>();

  /**
   * A representative failure.
   *
   * @param type category the failure was counted under
   * @param message failure message
   */
  public record ErrorSample(String type, String message) {}

  /** Records a probe exception and returns the category it was counted under. */
  public String recordFailure(Throwable t) {
    String key = classifyError(t);
    count(key, t == null ? null : describe(t));
    return key;
  }

  /** Records a response whose status marks it failed and returns its category. */
  public String recordHttpFailure(int statusCode) {
    String key = httpCategory(statusCode);
    count(key, "HTTP status " + statusCode);
    return key;
  }

  public long totalErrors() {
    return totalErrors.get();
  }

  public Map<String, Long> breakdownSnapshot() {
    Map<String, Long> map = new HashMap<>();
    for (var e : errorBreakdown.entrySet()) map.put(e.getKey(), e.getValue().get());
    return Map.copyOf(map);
  }

  public List<ErrorSample> samplesSnapshot() {
    return List.copyOf(errorSamples);
  }

  private void count(String key, String message) {
    totalErrors.incrementAndGet();
    errorBreakdown.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    if (message == null || errorSamples.size() >= MAX_ERROR_SAMPLES) {
      return;
    }
    var sample = new ErrorSample(key, message);
    synchronized (errorSamples) {
      if (errorSamples.size() < MAX_ERROR_SAMPLES && !errorSamples.contains(sample)) {
        errorSamples.add(sample);
      }
    }
  }

  static String httpCategory(int statusCode) {
    if (statusCode >= 500) return "HTTP_5xx";
    if (statusCode >= 400) return "HTTP_4xx";
    if (statusCode >= 300) return "HTTP_3xx";
    return "HTTP_" + statusCode;
  }

  private String classifyError(Throwable t) {
    if (t == null) return "UNKNOWN";
    var clsName = rootCause(t).getClass().getSimpleName();
    return switch (clsName) {
      case "ConnectException" -> "CONNECTION_REFUSED";
      case "SocketTimeoutException" -> "SOCKET_TIMEOUT";
      case "UnknownHostException" -> "UNKNOWN_HOST";
      case "SSLException", "SSLHandshakeException" -> "SSL_ERROR";
      case "HttpTimeoutException", "HttpConnectTimeoutException" -> "HTTP_TIMEOUT";
      default -> clsName.isBlank() ? "EXCEPTION" : clsName;
    };
  }

  private static Throwable rootCause(Throwable t) {
    Throwable rootCause = t;
    while (rootCause.getCause() != null && rootCause.getCause() != rootCause) {
      rootCause = rootCause.getCause();
    }
    return rootCause;
  }

  private static String describe(Throwable t) {
    String msg = t.getMessage();
    if (msg == null || msg.equals("null")) {
      msg = rootCause(t).getMessage();
    }
    if (msg == null || msg.equals("null")) {
      msg = rootCause(t).getClass().getSimpleName() + " occurred";
    }
    return msg;
  }
}
