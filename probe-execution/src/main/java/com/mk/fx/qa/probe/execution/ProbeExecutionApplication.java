package com.mk.fx.qa.probe.execution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProbeExecutionApplication {

  public static void main(String[] args) {
    SpringApplication.run(ProbeExecutionApplication.class, args);
  }
}
