package com.architecture.memory.archstage.exception;

import lombok.Getter;

/**
 * Raised when a changeset contains contradictory changes for one element,
 * e.g. an update staged after a delete of the same element.
 */
@Getter
public class ConflictException extends ArchStageException {

    private final String elementId;

    public ConflictException(String elementId, String message) {
        super(message);
        this.elementId = elementId;
    }
}
