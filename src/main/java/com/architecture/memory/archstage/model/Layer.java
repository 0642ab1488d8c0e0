package com.architecture.memory.archstage.model;

import com.architecture.memory.archstage.exception.DuplicateElementException;
import com.architecture.memory.archstage.exception.NotFoundException;
import com.architecture.memory.archstage.exception.ReferenceException;
import com.architecture.memory.archstage.model.graph.GraphEdge;
import com.architecture.memory.archstage.model.graph.GraphModel;
import com.architecture.memory.archstage.model.graph.GraphNode;
import com.architecture.memory.archstage.model.graph.GraphValues;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Per-layer adapter over a {@link GraphModel}: presents the layer's nodes as {@link Element}
 * views and routes element edits back into the graph.
 *
 * The materialized element list is cached and keyed by {@link GraphModel#getVersion()},
 * so it is rebuilt only after the graph changed.
 */
@Slf4j
public class Layer {

    @Getter
    private final String name;
    private final GraphModel graph;

    private List<Element> cachedElements;
    private long cachedVersion = -1;

    public Layer(String name, GraphModel graph) {
        this.name = Objects.requireNonNull(name, "layer name");
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * All elements of this layer sorted by id. The returned views are copies.
     */
    public List<Element> listElements() {
        if (cachedElements == null || cachedVersion != graph.getVersion()) {
            List<GraphNode> nodes = new ArrayList<>(graph.getNodesByLayer(name));
            nodes.sort(Comparator.comparing(GraphNode::getId));
            List<Element> elements = new ArrayList<>(nodes.size());
            for (GraphNode node : nodes) {
                elements.add(Element.fromGraph(node, graph.getEdgesFrom(node.getId())));
            }
            cachedElements = Collections.unmodifiableList(elements);
            cachedVersion = graph.getVersion();
        }
        List<Element> copies = new ArrayList<>(cachedElements.size());
        cachedElements.forEach(e -> copies.add(e.copy()));
        return copies;
    }

    public Optional<Element> getElement(String elementId) {
        return graph.getNode(elementId)
                .filter(node -> name.equals(node.getLayer()))
                .map(node -> Element.fromGraph(node, graph.getEdgesFrom(elementId)));
    }

    public boolean hasElement(String elementId) {
        return getElement(elementId).isPresent();
    }

    public int size() {
        return graph.getNodesByLayer(name).size();
    }

    /**
     * Insert an element and its outgoing relationships. Every relationship target must
     * already exist (a self reference is allowed); nothing is inserted otherwise.
     */
    public void addElement(Element element) {
        if (element.getLayer() != null && !name.equals(element.getLayer())) {
            throw new IllegalArgumentException(String.format(
                    "Element %s belongs to layer '%s', not '%s'", element.getId(), element.getLayer(), name));
        }
        if (graph.hasNode(element.getId())) {
            throw new DuplicateElementException(element.getId());
        }
        checkRelationshipTargets(element);

        GraphNode node = element.toGraphNode();
        node.setLayer(name);
        graph.addNode(node);
        addRelationships(element);
        log.debug("Added element {} to layer {}", element.getId(), name);
    }

    /**
     * Merge an update state into an element. Persists every mutable facet: name, type,
     * description, properties, references and outgoing relationships.
     *
     * @return the element as it is after the update
     */
    public Element updateElement(String elementId, Map<String, Object> patch) {
        Element current = getElement(elementId)
                .orElseThrow(() -> new NotFoundException("Element not found in layer " + name + ": " + elementId));

        Element merged = ElementStates.merge(current, patch);
        boolean relationshipsChanged = patch != null && patch.get(ElementStates.RELATIONSHIPS) instanceof List<?>;
        if (relationshipsChanged) {
            checkRelationshipTargets(merged);
        }

        GraphNode node = merged.toGraphNode();
        node.setLayer(name);
        graph.addNode(node, true);

        if (relationshipsChanged) {
            reconcileRelationships(merged);
        }
        return getElement(elementId).orElseThrow();
    }

    /**
     * Remove an element; incident relationships go with it.
     */
    public void deleteElement(String elementId) {
        if (!hasElement(elementId)) {
            throw new NotFoundException("Element not found in layer " + name + ": " + elementId);
        }
        graph.removeNode(elementId);
        log.debug("Deleted element {} from layer {}", elementId, name);
    }

    private void checkRelationshipTargets(Element element) {
        if (element.getRelationships() == null) {
            return;
        }
        for (ElementRelationship rel : element.getRelationships()) {
            String target = rel.getTarget();
            if (!element.getId().equals(target) && !graph.hasNode(target)) {
                throw new ReferenceException("destination", target,
                        element.getId() + " -[" + rel.getPredicate() + "]-> " + target);
            }
        }
    }

    private void addRelationships(Element element) {
        for (ElementRelationship rel : distinct(element).values()) {
            graph.addEdge(toEdge(element.getId(), rel));
        }
    }

    private void reconcileRelationships(Element element) {
        for (GraphEdge existing : graph.getEdgesFrom(element.getId())) {
            graph.removeEdge(existing.getId());
        }
        addRelationships(element);
    }

    // later entries win when the same predicate/target pair is listed twice
    private static Map<String, ElementRelationship> distinct(Element element) {
        Map<String, ElementRelationship> byEdgeId = new LinkedHashMap<>();
        if (element.getRelationships() != null) {
            for (ElementRelationship rel : element.getRelationships()) {
                byEdgeId.put(GraphEdge.canonicalId(element.getId(), rel.getPredicate(), rel.getTarget()), rel);
            }
        }
        return byEdgeId;
    }

    private static GraphEdge toEdge(String sourceId, ElementRelationship rel) {
        return GraphEdge.builder()
                .id(GraphEdge.canonicalId(sourceId, rel.getPredicate(), rel.getTarget()))
                .source(sourceId)
                .destination(rel.getTarget())
                .predicate(rel.getPredicate())
                .properties(GraphValues.copyMap(rel.getProperties()))
                .build();
    }
}
