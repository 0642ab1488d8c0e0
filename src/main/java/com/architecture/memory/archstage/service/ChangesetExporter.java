package com.architecture.memory.archstage.service;

import com.architecture.memory.archstage.dto.ChangesetExport;
import com.architecture.memory.archstage.dto.CompatibilityReport;
import com.architecture.memory.archstage.dto.ExportFormat;
import com.architecture.memory.archstage.exception.ArchStageException;
import com.architecture.memory.archstage.exception.PersistenceException;
import com.architecture.memory.archstage.model.ArchitectureModel;
import com.architecture.memory.archstage.model.changeset.ChangeRecord;
import com.architecture.memory.archstage.model.changeset.Changeset;
import com.architecture.memory.archstage.repository.AtomicFileWriter;
import com.architecture.memory.archstage.service.staging.BaseSnapshotManager;
import com.architecture.memory.archstage.service.staging.StagingAreaManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Moves changesets between model roots as portable YAML or JSON documents.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChangesetExporter {

    static final String EXPORT_VERSION = "0.1.0";

    private static final ObjectMapper JSON = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private final YAMLMapper yamlMapper;
    private final StagingAreaManager stagingAreaManager;
    private final BaseSnapshotManager snapshotManager;
    private final AtomicFileWriter fileWriter;

    // ========================= EXPORT =========================

    public String export(ArchitectureModel model, String idOrName, ExportFormat format) {
        Changeset changeset = stagingAreaManager.load(model, idOrName);
        ChangesetExport document = toExport(changeset, format);
        try {
            return mapper(format).writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new ArchStageException("Failed to export changeset " + changeset.getId(), e);
        }
    }

    public void exportToFile(ArchitectureModel model, String idOrName, Path target, ExportFormat format) {
        String content = export(model, idOrName, format);
        fileWriter.writeAll(Map.of(target, content.getBytes(StandardCharsets.UTF_8)));
        log.info("Exported changeset {} to {} as {}", idOrName, target, format);
    }

    // ========================= IMPORT =========================

    /**
     * Parse an exported document without applying it. A {@code null} format is detected from the content.
     */
    public ChangesetExport parse(String content, ExportFormat format) {
        ExportFormat effective = format != null ? format : detectFormat(content);
        try {
            return mapper(effective).readValue(content, ChangesetExport.class);
        } catch (IOException e) {
            throw new ArchStageException("Failed to parse changeset export as " + effective + ": " + e.getMessage(), e);
        }
    }

    /**
     * Create a new changeset from an exported document and stage its changes in order.
     * The import is all-or-nothing: if any change cannot be staged the new changeset is removed.
     */
    public Changeset importChangeset(ArchitectureModel model, String content, ExportFormat format) {
        ChangesetExport document = parse(content, format);
        String name = document.getName();
        if (name == null || name.isBlank() || stagingAreaManager.find(model, name).isPresent()) {
            String base = name == null || name.isBlank() ? "imported" : name;
            name = base + "-import-" + UUID.randomUUID().toString().substring(0, 8);
        }

        Changeset created = stagingAreaManager.create(model, name, document.getDescription());
        try {
            for (ChangeRecord change : inLogOrder(document)) {
                stagingAreaManager.stage(model, created.getId(), unsequenced(change));
            }
        } catch (RuntimeException e) {
            log.warn("Import of changeset '{}' failed, removing partial changeset {}: {}",
                    document.getName(), created.getId(), e.getMessage());
            stagingAreaManager.delete(model, created.getId());
            throw e;
        }
        log.info("Imported changeset '{}' as {} with {} change(s)", document.getName(), created.getId(),
                document.getChanges().size());
        return stagingAreaManager.load(model, created.getId());
    }

    public Changeset importFromFile(ArchitectureModel model, Path source) {
        try {
            return importChangeset(model, Files.readString(source, StandardCharsets.UTF_8), null);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read changeset export " + source, e);
        }
    }

    /**
     * Check an exported changeset against the current model: updates need their element,
     * adds must not collide. Deletes of missing elements are only warnings.
     */
    public CompatibilityReport validateCompatibility(ArchitectureModel model, ChangesetExport document) {
        CompatibilityReport report = CompatibilityReport.builder()
                .compatible(true)
                .baseSnapshotMatch(true)
                .build();

        if (document.getBaseSnapshot() != null
                && !document.getBaseSnapshot().equals(snapshotManager.captureSnapshot(model))) {
            report.setBaseSnapshotMatch(false);
            report.getWarnings().add("Base model has changed since changeset was created");
        }

        for (ChangeRecord change : inLogOrder(document)) {
            report.getAffectedLayers().add(change.getLayerName());
            boolean present = model.getLayer(change.getLayerName()).hasElement(change.getElementId());
            switch (change.getType()) {
                case ADD -> {
                    if (present) {
                        report.setCompatible(false);
                        report.getWarnings().add(String.format("Element %s already exists in layer %s",
                                change.getElementId(), change.getLayerName()));
                    }
                }
                case UPDATE -> {
                    if (!present) {
                        report.setCompatible(false);
                        report.getMissingElements().add(change.getElementId());
                        report.getWarnings().add("Cannot update non-existent element " + change.getElementId());
                    }
                }
                case DELETE -> {
                    if (!present) {
                        report.getWarnings().add(String.format("Element %s not found in layer %s",
                                change.getElementId(), change.getLayerName()));
                    }
                }
            }
        }
        return report;
    }

    static ExportFormat detectFormat(String content) {
        String trimmed = content == null ? "" : content.stripLeading();
        return trimmed.startsWith("{") ? ExportFormat.JSON : ExportFormat.YAML;
    }

    private ObjectMapper mapper(ExportFormat format) {
        return format == ExportFormat.JSON ? JSON : yamlMapper;
    }

    private static ChangesetExport toExport(Changeset changeset, ExportFormat format) {
        return ChangesetExport.builder()
                .id(changeset.getId())
                .name(changeset.getName())
                .description(changeset.getDescription())
                .status(changeset.getStatus())
                .baseSnapshot(changeset.getBaseSnapshot())
                .created(changeset.getCreated())
                .modified(changeset.getModified())
                .export(ChangesetExport.ExportInfo.builder()
                        .version(EXPORT_VERSION)
                        .exportedAt(LocalDateTime.now())
                        .format(format)
                        .build())
                .stats(changeset.toMetadata().getStats())
                .changes(changeset.getChanges())
                .build();
    }

    /**
     * Changes sorted by their exported sequence number; the list order in the document is not trusted.
     */
    private static List<ChangeRecord> inLogOrder(ChangesetExport document) {
        List<ChangeRecord> ordered = new ArrayList<>(document.getChanges());
        ordered.sort(Comparator.comparingInt(ChangeRecord::getSequenceNumber));
        return ordered;
    }

    private static ChangeRecord unsequenced(ChangeRecord change) {
        return switch (change.getType()) {
            case ADD -> ChangeRecord.add(change.getElementId(), change.getLayerName(), change.getAfter());
            case UPDATE -> ChangeRecord.update(change.getElementId(), change.getLayerName(), change.getBefore(), change.getAfter());
            case DELETE -> ChangeRecord.delete(change.getElementId(), change.getLayerName(), change.getBefore());
        };
    }
}
