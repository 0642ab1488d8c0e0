package com.architecture.memory.archstage.service.staging;

import com.architecture.memory.archstage.dto.DriftReport;
import com.architecture.memory.archstage.exception.ArchStageException;
import com.architecture.memory.archstage.model.ArchitectureModel;
import com.architecture.memory.archstage.model.Manifest;
import com.architecture.memory.archstage.model.changeset.BaseState;
import com.architecture.memory.archstage.model.changeset.Changeset;
import com.architecture.memory.archstage.model.graph.GraphEdge;
import com.architecture.memory.archstage.model.graph.GraphModel;
import com.architecture.memory.archstage.model.graph.GraphNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Content hashes of a model, used to detect that the base model moved after a changeset was created.
 *
 * The snapshot is the SHA-256 of a canonical JSON document: the manifest without its
 * {@code modified} timestamp, every layer's nodes sorted by id, and every edge sorted by
 * (source, destination, predicate, id). Object properties and map keys are written sorted,
 * so equal content always gives the same hash.
 */
@Component
@Slf4j
public class BaseSnapshotManager {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .addModule(new JavaTimeModule())
            .build();

    private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

    private static final Comparator<GraphEdge> EDGE_ORDER = Comparator
            .comparing(GraphEdge::getSource, NULLS_FIRST)
            .thenComparing(GraphEdge::getDestination, NULLS_FIRST)
            .thenComparing(GraphEdge::getPredicate, NULLS_FIRST)
            .thenComparing(GraphEdge::getId, NULLS_FIRST);

    public String captureSnapshot(ArchitectureModel model) {
        return captureSnapshot(model.getManifest(), model.getGraph());
    }

    public String captureSnapshot(Manifest manifest, GraphModel graph) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("manifest", manifestContent(manifest));

        Map<String, List<GraphNode>> layers = new TreeMap<>();
        for (String layer : graph.getLayerNames()) {
            List<GraphNode> nodes = new ArrayList<>(graph.getNodesByLayer(layer));
            nodes.sort(Comparator.comparing(GraphNode::getId));
            layers.put(layer, nodes);
        }
        document.put("layers", layers);

        List<GraphEdge> edges = new ArrayList<>(graph.getEdges());
        edges.sort(EDGE_ORDER);
        document.put("relationships", edges);

        return sha256(document);
    }

    /**
     * Fingerprint every element (node plus its outgoing edges) so drift can be reported per element.
     */
    public BaseState captureState(ArchitectureModel model) {
        GraphModel graph = model.getGraph();
        Map<String, BaseState.ElementFingerprint> elements = new TreeMap<>();
        for (GraphNode node : graph.getNodes()) {
            elements.put(node.getId(), BaseState.ElementFingerprint.builder()
                    .layer(node.getLayer())
                    .hash(fingerprint(node, graph))
                    .build());
        }
        return BaseState.builder()
                .snapshot(captureSnapshot(model))
                .manifestHash(sha256(manifestContent(model.getManifest())))
                .capturedAt(LocalDateTime.now())
                .elements(elements)
                .build();
    }

    // ========================= DRIFT =========================

    /**
     * Hash-only comparison; carries no element detail.
     */
    public DriftReport detectDrift(String expectedSnapshot, ArchitectureModel model) {
        String current = captureSnapshot(model);
        if (current.equals(expectedSnapshot)) {
            return DriftReport.clean(current);
        }
        return DriftReport.builder()
                .drifted(true)
                .baseSnapshot(expectedSnapshot)
                .currentSnapshot(current)
                .build();
    }

    /**
     * Compare the model against the changeset's base. With a recorded base state the report
     * names each added, modified and deleted element and its layer.
     */
    public DriftReport detectDrift(Changeset changeset, BaseState baseState, ArchitectureModel model) {
        DriftReport report = detectDrift(changeset.getBaseSnapshot(), model);
        if (!report.isDrifted()) {
            return report;
        }
        if (baseState == null || !changeset.getBaseSnapshot().equals(baseState.getSnapshot())) {
            report.getWarnings().add("No base state recorded for changeset '" + changeset.getName()
                    + "'; element-level drift detail is unavailable");
            log.warn("Changeset {} has drifted but has no usable base state", changeset.getId());
            return report;
        }

        BaseState current = captureState(model);
        report.setManifestChanged(!Objects.equals(baseState.getManifestHash(), current.getManifestHash()));

        Map<String, BaseState.ElementFingerprint> before = baseState.getElements();
        Map<String, BaseState.ElementFingerprint> after = current.getElements();
        for (Map.Entry<String, BaseState.ElementFingerprint> entry : before.entrySet()) {
            BaseState.ElementFingerprint now = after.get(entry.getKey());
            if (now == null) {
                addDrifted(report, entry.getKey(), entry.getValue().getLayer(), DriftReport.DriftType.DELETED);
            } else if (!now.getHash().equals(entry.getValue().getHash())) {
                addDrifted(report, entry.getKey(), now.getLayer(), DriftReport.DriftType.MODIFIED);
            }
        }
        for (Map.Entry<String, BaseState.ElementFingerprint> entry : after.entrySet()) {
            if (!before.containsKey(entry.getKey())) {
                addDrifted(report, entry.getKey(), entry.getValue().getLayer(), DriftReport.DriftType.ADDED);
            }
        }
        log.debug("Drift for changeset {}: {} element(s) in layers {}",
                changeset.getId(), report.getElements().size(), report.getAffectedLayers());
        return report;
    }

    private static void addDrifted(DriftReport report, String elementId, String layer, DriftReport.DriftType type) {
        report.getElements().add(DriftReport.DriftedElement.builder()
                .elementId(elementId)
                .layerName(layer)
                .driftType(type)
                .build());
        if (layer != null) {
            report.getAffectedLayers().add(layer);
        }
    }

    // ========================= HASHING =========================

    private String fingerprint(GraphNode node, GraphModel graph) {
        List<GraphEdge> outgoing = new ArrayList<>(graph.getEdgesFrom(node.getId()));
        outgoing.sort(EDGE_ORDER);
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("node", node);
        document.put("relationships", outgoing);
        return sha256(document);
    }

    private static Map<String, Object> manifestContent(Manifest manifest) {
        Map<String, Object> content = CANONICAL.convertValue(manifest, new TypeReference<Map<String, Object>>() {
        });
        content.remove("modified");
        return content;
    }

    static String sha256(Object document) {
        try {
            byte[] canonical = CANONICAL.writeValueAsBytes(document);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical));
        } catch (JsonProcessingException e) {
            throw new ArchStageException("Failed to serialize model for hashing", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
