package com.architecture.memory.archstage.exception;

/**
 * Base type for every failure raised by the model store and the staging layer.
 */
public class ArchStageException extends RuntimeException {

    public ArchStageException(String message) {
        super(message);
    }

    public ArchStageException(String message, Throwable cause) {
        super(message, cause);
    }
}
