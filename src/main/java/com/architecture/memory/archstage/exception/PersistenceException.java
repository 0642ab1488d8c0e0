package com.architecture.memory.archstage.exception;

/**
 * A durable write or read of model or changeset documents failed.
 */
public class PersistenceException extends ArchStageException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
