package com.architecture.memory.archstage.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Directed, typed relationship between two nodes.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GraphEdge {

    private String id;
    private String source;
    private String destination;
    private String predicate;

    @Builder.Default
    private Map<String, Object> properties = new LinkedHashMap<>();

    /**
     * Stable edge id. Format: {predicate}:{source}->{destination}
     */
    public static String canonicalId(String source, String predicate, String destination) {
        return String.format("%s:%s->%s", predicate, source, destination);
    }

    public GraphEdge copy() {
        return toBuilder().properties(GraphValues.copyMap(properties)).build();
    }

    public String describe() {
        return source + " -[" + predicate + "]-> " + destination;
    }
}
