package com.architecture.memory.archstage.service.validation;

import com.architecture.memory.archstage.service.staging.ProjectedModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every registered {@link ModelValidator} over a model view and collects the findings.
 * Any ERROR finding blocks a commit.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ValidationPipeline {

    private final List<ModelValidator> validators;

    public List<ValidationFinding> validate(ProjectedModel model) {
        List<ValidationFinding> findings = new ArrayList<>();
        for (ModelValidator validator : validators) {
            List<ValidationFinding> result = validator.validate(model);
            log.debug("Validator {} reported {} finding(s)", validator.getName(), result.size());
            findings.addAll(result);
        }
        return findings;
    }

    public static List<ValidationFinding> errors(List<ValidationFinding> findings) {
        return findings.stream().filter(ValidationFinding::isError).toList();
    }
}
