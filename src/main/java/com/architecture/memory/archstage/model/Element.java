package com.architecture.memory.archstage.model;

import com.architecture.memory.archstage.model.graph.ElementReference;
import com.architecture.memory.archstage.model.graph.GraphEdge;
import com.architecture.memory.archstage.model.graph.GraphNode;
import com.architecture.memory.archstage.model.graph.GraphValues;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detached view of a graph node together with its outgoing relationships.
 * Changing an element never changes the graph; changes go back through {@link Layer}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Element {

    private String id;
    private String layer;
    private String type;
    private String name;
    private String description;

    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    @Builder.Default
    private List<ElementReference> references = new ArrayList<>();

    @Builder.Default
    private List<ElementRelationship> relationships = new ArrayList<>();

    static Element fromGraph(GraphNode node, List<GraphEdge> outgoing) {
        List<ElementReference> refs = new ArrayList<>();
        if (node.getReferences() != null) {
            node.getReferences().forEach(r -> refs.add(r.copy()));
        }
        List<ElementRelationship> rels = new ArrayList<>();
        for (GraphEdge edge : outgoing) {
            rels.add(ElementRelationship.builder()
                    .predicate(edge.getPredicate())
                    .target(edge.getDestination())
                    .properties(GraphValues.copyMap(edge.getProperties()))
                    .build());
        }
        return Element.builder()
                .id(node.getId())
                .layer(node.getLayer())
                .type(node.getType())
                .name(node.getName())
                .description(node.getDescription())
                .properties(GraphValues.copyMap(node.getProperties()))
                .references(refs)
                .relationships(rels)
                .build();
    }

    GraphNode toGraphNode() {
        List<ElementReference> refs = new ArrayList<>();
        if (references != null) {
            references.forEach(r -> refs.add(r.copy()));
        }
        return GraphNode.builder()
                .id(id)
                .layer(layer)
                .type(type)
                .name(name)
                .description(description)
                .properties(GraphValues.copyMap(properties))
                .references(refs)
                .build();
    }

    /**
     * Deep copy, so a mutator can work on it without touching the view it came from.
     */
    public Element copy() {
        Element copy = ElementStates.toElement(id, layer, ElementStates.toState(this));
        copy.setType(type);
        copy.setName(name);
        copy.setDescription(description);
        return copy;
    }
}
