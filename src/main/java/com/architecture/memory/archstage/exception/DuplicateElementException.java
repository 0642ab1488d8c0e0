package com.architecture.memory.archstage.exception;

import lombok.Getter;

/**
 * Raised when a node or edge id is already present and no replace was requested.
 */
@Getter
public class DuplicateElementException extends ArchStageException {

    private final String id;

    public DuplicateElementException(String id) {
        super("Element already exists: " + id);
        this.id = id;
    }
}
