package com.architecture.memory.archstage.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Typed cross-layer reference from one element to another (e.g. "realizes" -> application.component.x).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ElementReference {
    private String type;
    private String target;

    public ElementReference copy() {
        return new ElementReference(type, target);
    }
}
