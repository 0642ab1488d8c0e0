package com.architecture.memory.archstage.service.validation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationFinding {
    private Severity severity;
    private String layer;
    private String elementId;
    private String message;

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder().append('[').append(severity).append(']');
        if (layer != null) {
            sb.append(' ').append(layer);
        }
        if (elementId != null) {
            sb.append(' ').append(elementId);
        }
        return sb.append(": ").append(message).toString();
    }
}
