package com.architecture.memory.archstage.exception;

public class InvalidStateException extends ArchStageException {

    public InvalidStateException(String message) {
        super(message);
    }
}
