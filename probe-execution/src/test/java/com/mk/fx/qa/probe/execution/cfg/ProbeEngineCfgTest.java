package com.mk.fx.qa.probe.execution.cfg;

import static org.junit.jupiter.api.Assertions.*;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Properties;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.config.YamlPropertiesFactoryBean;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.core.io.ClassPathResource;

class ProbeEngineCfgTest {

  private static ValidatorFactory validatorFactory;
  private static Validator validator;

  @BeforeAll
  static void setUpValidator() {
    validatorFactory = Validation.buildDefaultValidatorFactory();
    validator = validatorFactory.getValidator();
  }

  @AfterAll
  static void closeValidator() {
    validatorFactory.close();
  }

  private static Properties applicationYaml() {
    var resource = new ClassPathResource("application.yml");
    assertTrue(resource.exists(), "application.yml is not on the classpath");
    var yaml = new YamlPropertiesFactoryBean();
    yaml.setResources(resource);
    return yaml.getObject();
  }

  @Test
  void applicationYaml_isOnClasspath_andBindsEngineProperties() {
    var props = applicationYaml();

    var cfg =
        new Binder(new MapConfigurationPropertySource(props))
            .bind("probe.engine", ProbeEngineCfg.class)
            .get();

    assertEquals("probe-execution-runner", props.getProperty("spring.application.name"));
    assertEquals("/swagger-ui.html", props.getProperty("springdoc.swagger-ui.path"));
    assertEquals(5, cfg.getBatchConcurrency());
    assertEquals(4, cfg.getMaxActiveLoadRuns());
    assertEquals(500, cfg.getMaxLoadConcurrency());
    assertEquals(50, cfg.getHistorySize());
    assertEquals(5, cfg.getSnapshotIntervalSeconds());
    assertTrue(validator.validate(cfg).isEmpty());
  }

  @Test
  void maxLoadConcurrency_acceptsBounds() {
    var cfg = new ProbeEngineCfg();

    cfg.setMaxLoadConcurrency(1);
    assertTrue(validator.validate(cfg).isEmpty());
    cfg.setMaxLoadConcurrency(5_000);
    assertTrue(validator.validate(cfg).isEmpty());
  }

  @Test
  void maxLoadConcurrency_rejectsValuesOutsideBounds() {
    var cfg = new ProbeEngineCfg();

    cfg.setMaxLoadConcurrency(0);
    assertViolationOn(validator.validate(cfg), "maxLoadConcurrency");
    cfg.setMaxLoadConcurrency(5_001);
    assertViolationOn(validator.validate(cfg), "maxLoadConcurrency");
  }

  private static void assertViolationOn(
      Set<ConstraintViolation<ProbeEngineCfg>> violations, String field) {
    assertEquals(1, violations.size());
    assertEquals(field, violations.iterator().next().getPropertyPath().toString());
  }
}
