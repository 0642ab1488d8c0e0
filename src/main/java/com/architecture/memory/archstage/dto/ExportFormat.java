package com.architecture.memory.archstage.dto;

public enum ExportFormat {
    YAML,
    JSON
}
