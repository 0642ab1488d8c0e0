package com.architecture.memory.archstage.service.staging;

import com.architecture.memory.archstage.model.ArchitectureModel;
import com.architecture.memory.archstage.model.Element;
import com.architecture.memory.archstage.model.Manifest;
import com.architecture.memory.archstage.model.graph.GraphEdge;
import com.architecture.memory.archstage.model.graph.GraphModel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a model with a change log applied to a private copy.
 * Every accessor returns copies; the base model is never reachable from here.
 */
public class ProjectedModel {

    private final ArchitectureModel model;
    private final String changesetId;
    private final ChangeMerger.MergeResult mergeResult;

    ProjectedModel(ArchitectureModel model, String changesetId, ChangeMerger.MergeResult mergeResult) {
        this.model = model;
        this.changesetId = changesetId;
        this.mergeResult = mergeResult;
    }

    public Optional<String> getChangesetId() {
        return Optional.ofNullable(changesetId);
    }

    public ChangeMerger.MergeResult getMergeResult() {
        return mergeResult;
    }

    public Manifest getManifest() {
        return model.getManifest().copy();
    }

    public List<String> getLayerNames() {
        return model.getLayerNames();
    }

    public Optional<Element> getElement(String elementId) {
        return model.findElement(elementId);
    }

    public boolean hasElement(String elementId) {
        return model.getGraph().hasNode(elementId);
    }

    public List<Element> getLayerElements(String layer) {
        return model.getLayer(layer).listElements();
    }

    public List<Element> getElements() {
        List<Element> elements = new ArrayList<>();
        for (String layer : model.getLayerNames()) {
            elements.addAll(model.getLayer(layer).listElements());
        }
        return elements;
    }

    public List<GraphEdge> getRelationships() {
        List<GraphEdge> edges = new ArrayList<>();
        model.getGraph().getEdges().forEach(e -> edges.add(e.copy()));
        edges.sort(Comparator.comparing(GraphEdge::getId));
        return edges;
    }

    public int getElementCount() {
        return model.getGraph().getNodeCount();
    }

    public int getRelationshipCount() {
        return model.getGraph().getEdgeCount();
    }

    GraphModel graph() {
        return model.getGraph();
    }

    ArchitectureModel model() {
        return model;
    }
}
