package com.architecture.memory.archstage.exception;

public class NotFoundException extends ArchStageException {

    public NotFoundException(String message) {
        super(message);
    }
}
