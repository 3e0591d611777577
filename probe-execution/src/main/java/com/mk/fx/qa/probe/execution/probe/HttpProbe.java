package com.mk.fx.qa.probe.execution.probe;

import com.mk.fx.qa.probe.execution.model.ScenarioDescriptor;
import com.mk.fx.qa.probe.execution.rest.HttpMethod;
import com.mk.fx.qa.probe.execution.rest.ProbeHttpClient;
import com.mk.fx.qa.probe.execution.rest.Request;
import java.time.Duration;
import java.util.Objects;

/** {@link Probe} backed by a shared {@link ProbeHttpClient}. */
public class HttpProbe implements Probe, AutoCloseable {

  private final ProbeHttpClient client;

  public HttpProbe(ProbeHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public ProbeResponse invoke(ScenarioDescriptor descriptor) throws InterruptedException {
    var request = new Request();
    request.setMethod(HttpMethod.fromValue(descriptor.method()));
    request.setPath(descriptor.target());
    request.setHeaders(descriptor.headers());
    request.setBody(descriptor.body());

    var response = client.execute(request);
    return new ProbeResponse(
        response.getStatusCode(),
        response.getBody(),
        response.getHeaders(),
        Duration.ofNanos(response.getResponseTimeNanos()));
  }

  @Override
  public void close() {
    client.close();
  }
}
