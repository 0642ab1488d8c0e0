package com.architecture.memory.archstage.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A model element stored in the graph.
 * Ids are globally unique and layer-prefixed, e.g. {@code business.service.orders}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GraphNode {

    private String id;
    private String layer;
    private String type;
    private String name;
    private String description;

    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    @Builder.Default
    private List<ElementReference> references = new ArrayList<>();

    public GraphNode copy() {
        List<ElementReference> refs = new ArrayList<>();
        if (references != null) {
            references.forEach(r -> refs.add(r.copy()));
        }
        return toBuilder()
                .properties(GraphValues.copyMap(properties))
                .references(refs)
                .build();
    }
}
