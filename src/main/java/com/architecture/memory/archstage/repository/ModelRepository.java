package com.architecture.memory.archstage.repository;

import com.architecture.memory.archstage.exception.InvalidStateException;
import com.architecture.memory.archstage.exception.NotFoundException;
import com.architecture.memory.archstage.exception.PersistenceException;
import com.architecture.memory.archstage.model.ArchitectureModel;
import com.architecture.memory.archstage.model.Manifest;
import com.architecture.memory.archstage.model.graph.GraphEdge;
import com.architecture.memory.archstage.model.graph.GraphModel;
import com.architecture.memory.archstage.model.graph.GraphNode;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads and writes the committed model:
 * <pre>
 * model/manifest.yaml
 * model/relationships.yaml
 * model/layers/{layer}.yaml
 * </pre>
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class ModelRepository {

    static final String MODEL_DIR = "model";
    static final String LAYERS_DIR = "layers";
    static final String MANIFEST_FILE = "manifest.yaml";
    static final String RELATIONSHIPS_FILE = "relationships.yaml";

    private static final TypeReference<List<GraphEdge>> EDGE_LIST = new TypeReference<>() {
    };

    private final YAMLMapper yamlMapper;
    private final AtomicFileWriter fileWriter;

    // ========================= PATHS =========================

    public static Path manifestPath(Path root) {
        return root.resolve(MODEL_DIR).resolve(MANIFEST_FILE);
    }

    public static Path relationshipsPath(Path root) {
        return root.resolve(MODEL_DIR).resolve(RELATIONSHIPS_FILE);
    }

    public static Path layerPath(Path root, String layer) {
        return root.resolve(MODEL_DIR).resolve(LAYERS_DIR).resolve(layer + ".yaml");
    }

    public boolean exists(Path root) {
        return Files.exists(manifestPath(root));
    }

    // ========================= LOAD =========================

    public ArchitectureModel load(Path root) {
        Path manifestPath = manifestPath(root);
        if (!Files.exists(manifestPath)) {
            throw new NotFoundException("No model found at " + root + " (expected " + manifestPath + ")");
        }
        try {
            Manifest manifest = yamlMapper.readValue(manifestPath.toFile(), Manifest.class);
            GraphModel graph = new GraphModel();

            for (Path layerFile : listLayerFiles(root)) {
                LayerDocument doc = yamlMapper.readValue(layerFile.toFile(), LayerDocument.class);
                String layer = doc.getLayer() != null ? doc.getLayer() : layerName(layerFile);
                for (GraphNode node : doc.getElements()) {
                    node.setLayer(layer);
                    graph.addNode(node);
                }
            }

            Path relationshipsPath = relationshipsPath(root);
            if (Files.exists(relationshipsPath)) {
                List<GraphEdge> edges = yamlMapper.readValue(relationshipsPath.toFile(), EDGE_LIST);
                for (GraphEdge edge : edges == null ? List.<GraphEdge>of() : edges) {
                    if (!graph.hasNode(edge.getSource()) || !graph.hasNode(edge.getDestination())) {
                        log.warn("Skipping relationship {} with a missing endpoint", edge.describe());
                        continue;
                    }
                    graph.addEdge(edge);
                }
            }

            log.info("Loaded model '{}' from {}: {} elements, {} relationships",
                    manifest.getName(), root, graph.getNodeCount(), graph.getEdgeCount());
            return new ArchitectureModel(root, manifest, graph);
        } catch (IOException e) {
            throw new PersistenceException("Failed to load model from " + root, e);
        }
    }

    /**
     * Create an empty model with a fresh manifest.
     */
    public ArchitectureModel init(Path root, String name, String description) {
        if (exists(root)) {
            throw new InvalidStateException("A model already exists at " + root);
        }
        ArchitectureModel model = new ArchitectureModel(root, Manifest.create(name, description), new GraphModel());
        fileWriter.writeAll(prepareDocuments(model, List.of()));
        log.info("Initialized model '{}' at {}", name, root);
        return model;
    }

    public ArchitectureModel loadOrInit(Path root, String name) {
        return exists(root) ? load(root) : init(root, name, null);
    }

    // ========================= SAVE =========================

    public void save(ArchitectureModel model, Collection<String> layers) {
        fileWriter.writeAll(prepareDocuments(model, layers));
    }

    /**
     * Serialize the manifest, all relationships and the given layers. Refreshes the manifest's
     * statistics, declared layers and modified timestamp first.
     */
    public Map<Path, byte[]> prepareDocuments(ArchitectureModel model, Collection<String> layers) {
        Path root = model.getRootPath();
        GraphModel graph = model.getGraph();
        Manifest manifest = model.getManifest();

        layers.forEach(manifest::declareLayer);
        Map<String, Integer> statistics = new LinkedHashMap<>();
        for (String layer : model.getLayerNames()) {
            statistics.put(layer, graph.getNodesByLayer(layer).size());
        }
        manifest.setStatistics(statistics);
        manifest.setModified(LocalDateTime.now());

        try {
            Map<Path, byte[]> documents = new LinkedHashMap<>();
            for (String layer : new TreeSet<>(layers)) {
                List<GraphNode> nodes = new ArrayList<>(graph.getNodesByLayer(layer));
                nodes.sort(Comparator.comparing(GraphNode::getId));
                LayerDocument doc = LayerDocument.builder().layer(layer).elements(nodes).build();
                documents.put(layerPath(root, layer), yamlMapper.writeValueAsBytes(doc));
            }

            List<GraphEdge> edges = new ArrayList<>(graph.getEdges());
            edges.sort(Comparator.comparing(GraphEdge::getId));
            documents.put(relationshipsPath(root), yamlMapper.writeValueAsBytes(edges));
            documents.put(manifestPath(root), yamlMapper.writeValueAsBytes(manifest));
            return documents;
        } catch (IOException e) {
            throw new PersistenceException("Failed to serialize model " + manifest.getName(), e);
        }
    }

    private List<Path> listLayerFiles(Path root) throws IOException {
        Path dir = root.resolve(MODEL_DIR).resolve(LAYERS_DIR);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".yaml"))
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static String layerName(Path layerFile) {
        String file = layerFile.getFileName().toString();
        return file.substring(0, file.length() - ".yaml".length());
    }
}
