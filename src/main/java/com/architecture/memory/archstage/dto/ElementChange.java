package com.architecture.memory.archstage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * A single element change between the base model and a projected model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ElementChange {

    public enum ChangeKind {
        ADDED,
        MODIFIED,
        REMOVED
    }

    private ChangeKind changeKind;
    private String elementId;
    private String layerName;
    private String elementType;
    private String displayName;

    // For MODIFIED elements: what changed. Nested properties are reported as "properties.<key>"
    private List<PropertyDiff> propertyDiffs;

    private Map<String, Object> baseState;
    private Map<String, Object> projectedState;
}
