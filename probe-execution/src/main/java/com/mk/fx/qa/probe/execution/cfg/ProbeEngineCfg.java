package com.mk.fx.qa.probe.execution.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "probe.engine")
public class ProbeEngineCfg {

  /** Concurrency ceiling for batch runs that do not specify one. */
  @Min(1)
  @Max(256)
  private int batchConcurrency = 5;

  @Positive private int connectionTimeoutMs = 5_000;

  @Positive private int requestTimeoutMs = 30_000;

  /** Load runs allowed to execute at the same time. */
  @Min(1)
  @Max(64)
  private int maxActiveLoadRuns = 4;

  /** Virtual users a single load run may start; larger requests are capped. */
  @Min(1)
  @Max(5_000)
  private int maxLoadConcurrency = 500;

  /** Finished load runs kept for status queries. */
  @Positive private int historySize = 50;

  @Positive private int snapshotIntervalSeconds = 5;
}
