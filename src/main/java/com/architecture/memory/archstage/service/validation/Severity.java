package com.architecture.memory.archstage.service.validation;

public enum Severity {
    ERROR,
    WARNING,
    INFO
}
