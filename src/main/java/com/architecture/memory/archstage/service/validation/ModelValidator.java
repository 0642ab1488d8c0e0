package com.architecture.memory.archstage.service.validation;

import com.architecture.memory.archstage.service.staging.ProjectedModel;

import java.util.List;

/**
 * One rule set run by the {@link ValidationPipeline}.
 */
public interface ModelValidator {

    String getName();

    List<ValidationFinding> validate(ProjectedModel model);
}
