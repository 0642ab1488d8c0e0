package com.architecture.memory.archstage.model.graph;

import com.architecture.memory.archstage.exception.DuplicateElementException;
import com.architecture.memory.archstage.exception.ReferenceException;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.function.Consumer;

/**
 * In-memory node/edge store with layer, type, source, destination and predicate indices.
 * This is the single source of truth for committed model state.
 *
 * Index discipline: every mutation removes the stale index entries of a node or edge
 * before inserting the new ones, so an index never points at a removed object.
 * Read accessors tolerate stale ids and return empty collections instead of failing.
 */
@Slf4j
public class GraphModel {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, GraphEdge> edges = new LinkedHashMap<>();

    private final Map<String, Set<String>> nodesByLayer = new HashMap<>();
    private final Map<String, Set<String>> nodesByType = new HashMap<>();
    private final Map<String, Set<String>> edgesBySource = new HashMap<>();
    private final Map<String, Set<String>> edgesByDestination = new HashMap<>();
    private final Map<String, Set<String>> edgesByPredicate = new HashMap<>();

    private long version;

    // ========================= NODES =========================

    public void addNode(GraphNode node) {
        addNode(node, false);
    }

    /**
     * Insert a node. Fails with {@link DuplicateElementException} when the id is taken,
     * unless {@code replace} is set, in which case the old node's index entries are
     * dropped before the new node is indexed. Edges of a replaced node are kept.
     */
    public void addNode(GraphNode node, boolean replace) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(node.getId(), "node id");

        GraphNode existing = nodes.get(node.getId());
        if (existing != null) {
            if (!replace) {
                throw new DuplicateElementException(node.getId());
            }
            unindexNode(existing);
        }

        nodes.put(node.getId(), node);
        indexNode(node);
        version++;
    }

    /**
     * Apply an in-place change to a node, re-indexing it if its layer or type changed.
     *
     * @return false when no node has that id
     */
    public boolean updateNode(String nodeId, Consumer<GraphNode> updater) {
        GraphNode node = nodes.get(nodeId);
        if (node == null) {
            return false;
        }
        unindexNode(node);
        try {
            updater.accept(node);
            if (!nodeId.equals(node.getId())) {
                throw new IllegalArgumentException("Node id cannot change on update: " + nodeId + " -> " + node.getId());
            }
        } finally {
            node.setId(nodeId);
            indexNode(node);
            version++;
        }
        return true;
    }

    /**
     * Remove a node and every edge incident to it.
     *
     * @return false when no node has that id
     */
    public boolean removeNode(String nodeId) {
        GraphNode node = nodes.remove(nodeId);
        if (node == null) {
            return false;
        }
        unindexNode(node);

        Set<String> incident = new LinkedHashSet<>();
        incident.addAll(edgesBySource.getOrDefault(nodeId, Collections.emptySet()));
        incident.addAll(edgesByDestination.getOrDefault(nodeId, Collections.emptySet()));
        for (String edgeId : incident) {
            removeEdge(edgeId);
        }

        version++;
        log.debug("Removed node {} and {} incident edge(s)", nodeId, incident.size());
        return true;
    }

    public Optional<GraphNode> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean hasNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    public Collection<GraphNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<GraphNode> getNodesByLayer(String layer) {
        return resolveNodes(nodesByLayer.get(layer));
    }

    public List<GraphNode> getNodesByType(String type) {
        return resolveNodes(nodesByType.get(type));
    }

    /**
     * Layers that currently hold at least one node, sorted by name.
     */
    public SortedSet<String> getLayerNames() {
        return new TreeSet<>(nodesByLayer.keySet());
    }

    // ========================= EDGES =========================

    /**
     * Insert an edge. Both endpoints must exist; the edge id defaults to
     * {@link GraphEdge#canonicalId(String, String, String)}.
     */
    public void addEdge(GraphEdge edge) {
        Objects.requireNonNull(edge, "edge");
        if (!hasNode(edge.getSource())) {
            throw new ReferenceException("source", edge.getSource(), edge.describe());
        }
        if (!hasNode(edge.getDestination())) {
            throw new ReferenceException("destination", edge.getDestination(), edge.describe());
        }
        if (edge.getId() == null) {
            edge.setId(GraphEdge.canonicalId(edge.getSource(), edge.getPredicate(), edge.getDestination()));
        }
        if (edges.containsKey(edge.getId())) {
            throw new DuplicateElementException(edge.getId());
        }

        edges.put(edge.getId(), edge);
        index(edgesBySource, edge.getSource(), edge.getId());
        index(edgesByDestination, edge.getDestination(), edge.getId());
        index(edgesByPredicate, edge.getPredicate(), edge.getId());
        version++;
    }

    public boolean removeEdge(String edgeId) {
        GraphEdge edge = edges.remove(edgeId);
        if (edge == null) {
            return false;
        }
        unindex(edgesBySource, edge.getSource(), edgeId);
        unindex(edgesByDestination, edge.getDestination(), edgeId);
        unindex(edgesByPredicate, edge.getPredicate(), edgeId);
        version++;
        return true;
    }

    public Optional<GraphEdge> getEdge(String edgeId) {
        return Optional.ofNullable(edges.get(edgeId));
    }

    public Collection<GraphEdge> getEdges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    public List<GraphEdge> getEdgesFrom(String nodeId) {
        return resolveEdges(edgesBySource.get(nodeId), null);
    }

    public List<GraphEdge> getEdgesFrom(String nodeId, String predicate) {
        return resolveEdges(edgesBySource.get(nodeId), predicate);
    }

    public List<GraphEdge> getEdgesTo(String nodeId) {
        return resolveEdges(edgesByDestination.get(nodeId), null);
    }

    public List<GraphEdge> getEdgesTo(String nodeId, String predicate) {
        return resolveEdges(edgesByDestination.get(nodeId), predicate);
    }

    public List<GraphEdge> getEdgesByPredicate(String predicate) {
        return resolveEdges(edgesByPredicate.get(predicate), null);
    }

    public List<GraphEdge> getEdgesBetween(String sourceId, String destinationId, String predicate) {
        List<GraphEdge> result = new ArrayList<>();
        for (GraphEdge edge : getEdgesFrom(sourceId, predicate)) {
            if (edge.getDestination().equals(destinationId)) {
                result.add(edge);
            }
        }
        return result;
    }

    // ========================= TRAVERSAL =========================

    /**
     * Breadth-first walk over outgoing edges, optionally restricted to one predicate.
     * The start node is included at depth 0.
     */
    public List<GraphNode> traverse(String startNodeId, String predicate, int maxDepth) {
        List<GraphNode> result = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        Map<String, Integer> depth = new HashMap<>();

        queue.add(startNodeId);
        depth.put(startNodeId, 0);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            GraphNode node = nodes.get(current);
            if (node != null) {
                result.add(node);
            }
            int currentDepth = depth.get(current);
            if (currentDepth >= maxDepth) {
                continue;
            }
            for (GraphEdge edge : getEdgesFrom(current, predicate)) {
                if (!visited.contains(edge.getDestination())) {
                    depth.putIfAbsent(edge.getDestination(), currentDepth + 1);
                    queue.add(edge.getDestination());
                }
            }
        }
        return result;
    }

    // ========================= UTILITY =========================

    /**
     * Counter incremented on every mutating call. Dependents compare it to detect staleness.
     */
    public long getVersion() {
        return version;
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        return edges.size();
    }

    public void clear() {
        nodes.clear();
        edges.clear();
        nodesByLayer.clear();
        nodesByType.clear();
        edgesBySource.clear();
        edgesByDestination.clear();
        edgesByPredicate.clear();
        version++;
    }

    /**
     * Deep copy of all nodes and edges. Mutating the copy never affects this graph.
     */
    public GraphModel copy() {
        GraphModel copy = new GraphModel();
        copy.copyFrom(this);
        copy.version = this.version;
        return copy;
    }

    /**
     * Replace the whole content of this graph with a deep copy of {@code other}.
     * Used to roll the live graph back to a pre-commit snapshot.
     */
    public void restore(GraphModel other) {
        long nextVersion = Math.max(version, other.version) + 1;
        clear();
        copyFrom(other);
        version = nextVersion;
    }

    private void copyFrom(GraphModel other) {
        for (GraphNode node : other.nodes.values()) {
            nodes.put(node.getId(), node.copy());
            indexNode(node);
        }
        for (GraphEdge edge : other.edges.values()) {
            edges.put(edge.getId(), edge.copy());
            index(edgesBySource, edge.getSource(), edge.getId());
            index(edgesByDestination, edge.getDestination(), edge.getId());
            index(edgesByPredicate, edge.getPredicate(), edge.getId());
        }
    }

    private void indexNode(GraphNode node) {
        index(nodesByLayer, node.getLayer(), node.getId());
        index(nodesByType, node.getType(), node.getId());
    }

    private void unindexNode(GraphNode node) {
        unindex(nodesByLayer, node.getLayer(), node.getId());
        unindex(nodesByType, node.getType(), node.getId());
    }

    private static void index(Map<String, Set<String>> index, String key, String id) {
        if (key == null) {
            return;
        }
        index.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(id);
    }

    private static void unindex(Map<String, Set<String>> index, String key, String id) {
        if (key == null) {
            return;
        }
        Set<String> ids = index.get(key);
        if (ids != null) {
            ids.remove(id);
            if (ids.isEmpty()) {
                index.remove(key);
            }
        }
    }

    private List<GraphNode> resolveNodes(Set<String> ids) {
        if (ids == null) {
            return Collections.emptyList();
        }
        List<GraphNode> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            GraphNode node = nodes.get(id);
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }

    private List<GraphEdge> resolveEdges(Set<String> ids, String predicate) {
        if (ids == null) {
            return Collections.emptyList();
        }
        List<GraphEdge> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            GraphEdge edge = edges.get(id);
            if (edge != null && (predicate == null || predicate.equals(edge.getPredicate()))) {
                result.add(edge);
            }
        }
        return result;
    }
}
