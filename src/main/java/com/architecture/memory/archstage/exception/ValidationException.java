package com.architecture.memory.archstage.exception;

import com.architecture.memory.archstage.service.validation.ValidationFinding;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The projected model produced ERROR findings; carries every violation.
 */
@Getter
public class ValidationException extends ArchStageException {

    private final transient List<ValidationFinding> violations;

    public ValidationException(String changesetName, List<ValidationFinding> violations) {
        super(String.format("Validation failed for changeset '%s' (%d violation(s)): %s",
                changesetName, violations.size(),
                violations.stream().map(ValidationFinding::describe).collect(Collectors.joining("; "))));
        this.violations = List.copyOf(violations);
    }
}
