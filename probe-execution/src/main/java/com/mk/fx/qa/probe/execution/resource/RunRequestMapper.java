package com.mk.fx.qa.probe.execution.resource;

import com.mk.fx.qa.probe.execution.dto.BatchRunRequest;
import com.mk.fx.qa.probe.execution.dto.ExpectationRequest;
import com.mk.fx.qa.probe.execution.dto.LoadRunRequest;
import com.mk.fx.qa.probe.execution.dto.ScenarioRequest;
import com.mk.fx.qa.probe.execution.model.BatchRunCommand;
import com.mk.fx.qa.probe.execution.model.Expectation;
import com.mk.fx.qa.probe.execution.model.LoadProfile;
import com.mk.fx.qa.probe.execution.model.LoadRunCommand;
import com.mk.fx.qa.probe.execution.model.ScenarioDescriptor;
import com.mk.fx.qa.probe.execution.model.StatusRange;
import com.mk.fx.qa.probe.execution.utils.LoadUtils;
import java.time.Duration;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper(componentModel = "spring")
public interface RunRequestMapper {

  BatchRunCommand toBatchCommand(BatchRunRequest request);

  @Mapping(target = "profile", source = "profile", qualifiedByName = "mapProfile")
  @Mapping(target = "duration", source = "duration", qualifiedByName = "mapDuration")
  LoadRunCommand toLoadCommand(LoadRunRequest request);

  ScenarioDescriptor toDescriptor(ScenarioRequest request);

  Expectation toExpectation(ExpectationRequest request);

  StatusRange toStatusRange(ExpectationRequest.StatusRangeRequest request);

  @Named("mapProfile")
  default LoadProfile mapProfile(String profile) {
    return LoadProfile.fromValue(profile);
  }

  /** Blank or missing durations stay null so the profile default applies. */
  @Named("mapDuration")
  default Duration mapDuration(String duration) {
    if (duration == null || duration.isBlank()) {
      return null;
    }
    return LoadUtils.parseDuration(duration);
  }
}
