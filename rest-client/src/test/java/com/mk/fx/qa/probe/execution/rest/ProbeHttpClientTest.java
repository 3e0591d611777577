package com.mk.fx.qa.probe.execution.rest;

import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProbeHttpClientTest {

  private HttpServer server;
  private String baseUrl;
  private final AtomicReference<String> lastUri = new AtomicReference<>();
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private final AtomicReference<String> lastContentType = new AtomicReference<>();
  private final AtomicReference<String> lastAuth = new AtomicReference<>();

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    server.createContext("/echo", this::echo);
    server.createContext(
        "/slow",
        exchange -> {
          try {
            Thread.sleep(1_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          respond(exchange, 200, "late");
        });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
  }

  private void echo(HttpExchange exchange) throws IOException {
    lastUri.set(exchange.getRequestURI().toString());
    lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
    lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
    lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
    exchange.getResponseHeaders().add("X-Request-Method", exchange.getRequestMethod());
    respond(exchange, 201, "echoed");
  }

  private static void respond(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  private ProbeHttpClient client(Map<String, String> headers, Map<String, String> vars) {
    return new ProbeHttpClient(
        baseUrl, Duration.ofSeconds(2), Duration.ofMillis(300), headers, vars);
  }

  @Test
  void execute_capturesStatusBodyHeadersAndTiming() throws Exception {
    var request = new Request();
    request.setMethod(HttpMethod.POST);
    request.setPath("echo");
    request.setBody(Map.of("name", "probe"));

    var response = client(Map.of("Authorization", "Bearer t"), null).execute(request);

    assertEquals(201, response.getStatusCode());
    assertEquals("echoed", response.getBody());
    assertEquals("POST", response.getHeaders().get("x-request-method"));
    assertTrue(response.getResponseTimeNanos() > 0);
    assertEquals("/echo", lastUri.get());
    assertEquals("{\"name\":\"probe\"}", lastBody.get());
    assertEquals("application/json", lastContentType.get());
    assertEquals("Bearer t", lastAuth.get());
  }

  @Test
  void execute_sendsStringBodyVerbatim_andRequestHeadersOverrideGlobals() throws Exception {
    var request = new Request();
    request.setMethod(HttpMethod.PUT);
    request.setPath("/echo");
    request.setHeaders(Map.of("Content-Type", "text/plain", "Authorization", "Basic x"));
    request.setBody("raw text");

    client(Map.of("Authorization", "Bearer t"), null).execute(request);

    assertEquals("raw text", lastBody.get());
    assertEquals("text/plain", lastContentType.get());
    assertEquals("Basic x", lastAuth.get());
  }

  @Test
  void resolveUri_substitutesVariablesAndEncodesQuery() {
    var request = new Request();
    request.setMethod(HttpMethod.GET);
    request.setPath("/users/{{id}}");
    Map<String, String> query = new LinkedHashMap<>();
    query.put("q", "a b");
    query.put("page", "{{page}}");
    request.setQuery(query);

    var uri = client(null, Map.of("id", "42", "page", "3")).resolveUri(request);

    assertEquals(baseUrl + "users/42?q=a+b&page=3", uri.toString());
  }

  @Test
  void resolveUri_keepsAbsoluteUrls() {
    var request = new Request();
    request.setMethod(HttpMethod.GET);
    request.setPath("https://example.org/status");

    assertEquals(
        "https://example.org/status", client(null, null).resolveUri(request).toString());
  }

  @Test
  void execute_timeoutSurfacesAsRuntimeException() {
    var request = new Request();
    request.setMethod(HttpMethod.GET);
    request.setPath("/slow");

    var ex = assertThrows(RuntimeException.class, () -> client(null, null).execute(request));
    assertTrue(ex.getMessage().startsWith("Request timed out after 300ms"));
  }

  @Test
  void constructor_rejectsBlankBaseUrl() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new ProbeHttpClient(" ", Duration.ofSeconds(1), Duration.ofSeconds(1), null, null));
  }

  @Test
  void httpMethod_fromValueIsCaseInsensitive() {
    assertEquals(HttpMethod.PATCH, HttpMethod.fromValue("patch"));
    assertThrows(IllegalArgumentException.class, () -> HttpMethod.fromValue("TRACE"));
    assertThrows(IllegalArgumentException.class, () -> HttpMethod.fromValue(""));
  }
}
