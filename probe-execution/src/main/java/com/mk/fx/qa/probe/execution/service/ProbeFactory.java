package com.mk.fx.qa.probe.execution.service;

import com.mk.fx.qa.probe.execution.cfg.ProbeEngineCfg;
import com.mk.fx.qa.probe.execution.probe.HttpProbe;
import com.mk.fx.qa.probe.execution.probe.Probe;
import com.mk.fx.qa.probe.execution.rest.ProbeHttpClient;
import java.time.Duration;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Creates the probe a run invokes, one per run, sharing one HTTP client across its workers. */
@Component
@RequiredArgsConstructor
public class ProbeFactory {

  private final ProbeEngineCfg properties;

  /**
   * @throws IllegalArgumentException if the base URL is blank
   * @throws NullPointerException if the base URL is null
   */
  public Probe create(String baseUrl, Map<String, String> headers, Map<String, String> variables) {
    var client =
        new ProbeHttpClient(
            baseUrl,
            Duration.ofMillis(properties.getConnectionTimeoutMs()),
            Duration.ofMillis(properties.getRequestTimeoutMs()),
            headers,
            variables);
    return new HttpProbe(client);
  }
}
