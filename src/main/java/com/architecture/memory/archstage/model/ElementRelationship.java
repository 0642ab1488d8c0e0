package com.architecture.memory.archstage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outgoing relationship as seen from an element view.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ElementRelationship {
    private String predicate;
    private String target;

    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();
}
