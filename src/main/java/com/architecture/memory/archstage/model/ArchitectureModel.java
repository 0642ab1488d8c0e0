package com.architecture.memory.archstage.model;

import com.architecture.memory.archstage.exception.NotFoundException;
import com.architecture.memory.archstage.model.graph.GraphModel;
import lombok.Getter;

import java.nio.file.Path;
import java.util.*;

/**
 * A model root: the manifest, the committed graph and the layer views over it.
 *
 * Layout under {@link #getRootPath()}:
 * <pre>
 * model/manifest.yaml
 * model/relationships.yaml
 * model/layers/{layer}.yaml
 * changesets/...
 * </pre>
 */
public class ArchitectureModel {

    @Getter
    private final Path rootPath;
    @Getter
    private final GraphModel graph;
    @Getter
    private Manifest manifest;

    private final Map<String, Layer> layers = new HashMap<>();

    public ArchitectureModel(Path rootPath, Manifest manifest, GraphModel graph) {
        this.rootPath = Objects.requireNonNull(rootPath, "rootPath");
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * Layer view for a name; the view exists even when the layer holds no element yet.
     */
    public Layer getLayer(String name) {
        return layers.computeIfAbsent(name, n -> new Layer(n, graph));
    }

    /**
     * Declared layers from the manifest followed by any other layer present in the graph.
     */
    public List<String> getLayerNames() {
        Set<String> names = new LinkedHashSet<>();
        if (manifest.getLayers() != null) {
            names.addAll(manifest.getLayers());
        }
        names.addAll(graph.getLayerNames());
        return new ArrayList<>(names);
    }

    public Optional<Element> findElement(String elementId) {
        return graph.getNode(elementId).flatMap(node -> getLayer(node.getLayer()).getElement(elementId));
    }

    public Element getElement(String elementId) {
        return findElement(elementId)
                .orElseThrow(() -> new NotFoundException("Element not found: " + elementId));
    }

    public ModelSnapshot snapshot() {
        return new ModelSnapshot(manifest.copy(), graph.copy());
    }

    /**
     * Roll the in-memory state back to a snapshot. The graph instance is kept so that
     * existing layer views stay attached to it.
     */
    public void restore(ModelSnapshot snapshot) {
        this.manifest = snapshot.manifest().copy();
        graph.restore(snapshot.graph());
    }
}
