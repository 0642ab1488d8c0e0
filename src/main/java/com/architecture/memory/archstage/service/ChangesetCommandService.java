package com.architecture.memory.archstage.service;

import com.architecture.memory.archstage.config.ArchStageProperties;
import com.architecture.memory.archstage.dto.*;
import com.architecture.memory.archstage.exception.NotFoundException;
import com.architecture.memory.archstage.model.ArchitectureModel;
import com.architecture.memory.archstage.model.Element;
import com.architecture.memory.archstage.model.changeset.Changeset;
import com.architecture.memory.archstage.repository.AtomicFileWriter;
import com.architecture.memory.archstage.repository.ModelRepository;
import com.architecture.memory.archstage.service.staging.MutationHandler;
import com.architecture.memory.archstage.service.staging.ProjectedModel;
import com.architecture.memory.archstage.service.staging.StagingAreaManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Changeset operations for the command layer, over the model at {@code archstage.model-root}.
 * Every operation returns a structured result; rendering it is the caller's job.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChangesetCommandService {

    private static final Duration STALE_TEMP_AGE = Duration.ofHours(1);

    private final ArchStageProperties properties;
    private final ModelRepository modelRepository;
    private final StagingAreaManager stagingAreaManager;
    private final MutationHandler mutationHandler;
    private final ChangesetExporter exporter;
    private final AtomicFileWriter fileWriter;

    private ArchitectureModel model;

    public synchronized ArchitectureModel getModel() {
        if (model == null) {
            model = modelRepository.loadOrInit(modelRoot(), properties.getModelName());
        }
        return model;
    }

    /**
     * Drop the in-memory model so the next call reads it from disk again.
     */
    public synchronized void reload() {
        model = null;
    }

    // ========================= CHANGESETS =========================

    public ChangesetResponse create(String name, String description) {
        Changeset changeset = stagingAreaManager.create(getModel(), name, description);
        return toResponse(changeset);
    }

    public List<ChangesetResponse> list() {
        return stagingAreaManager.list(getModel()).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    /**
     * Status of a changeset, or of the active one when {@code idOrName} is null.
     */
    public ChangesetStatusResponse status(String idOrName) {
        ArchitectureModel current = getModel();
        Changeset changeset = idOrName != null
                ? stagingAreaManager.load(current, idOrName)
                : stagingAreaManager.getActive(current)
                        .orElseThrow(() -> new NotFoundException("No active changeset"));
        return ChangesetStatusResponse.builder()
                .changeset(toResponse(changeset))
                .changes(changeset.getChanges())
                .drift(changeset.isActiveStatus() ? stagingAreaManager.detectDrift(current, changeset.getId()) : null)
                .build();
    }

    public ChangesetResponse activate(String idOrName) {
        return toResponse(stagingAreaManager.setActive(getModel(), idOrName));
    }

    public void deactivate() {
        stagingAreaManager.clearActive(getModel());
    }

    public ChangesetResponse discard(String idOrName) {
        return toResponse(stagingAreaManager.discard(getModel(), idOrName));
    }

    public void delete(String idOrName) {
        stagingAreaManager.delete(getModel(), idOrName);
    }

    // ========================= ELEMENT EDITS =========================

    public MutationResult addElement(Element element) {
        return mutationHandler.executeAdd(getModel(), element, null);
    }

    public MutationResult updateElement(String elementId, Consumer<Element> mutator) {
        return mutationHandler.executeUpdate(getModel(), elementId, mutator);
    }

    public MutationResult deleteElement(String elementId) {
        return mutationHandler.executeDelete(getModel(), elementId);
    }

    public ChangesetResponse unstage(String elementId) {
        return toResponse(stagingAreaManager.unstage(getModel(), elementId));
    }

    // ========================= PREVIEW / COMMIT =========================

    public PreviewResponse preview(String idOrName) {
        ArchitectureModel current = getModel();
        Changeset changeset = resolve(current, idOrName);
        ProjectedModel projected = stagingAreaManager.preview(current, changeset.getId());

        Map<String, List<Element>> layers = new LinkedHashMap<>();
        for (String layer : projected.getLayerNames()) {
            layers.put(layer, projected.getLayerElements(layer));
        }
        return PreviewResponse.builder()
                .changesetId(changeset.getId())
                .changesetName(changeset.getName())
                .changeCount(changeset.getChangeCount())
                .layers(layers)
                .elementCount(projected.getElementCount())
                .relationshipCount(projected.getRelationshipCount())
                .build();
    }

    public ChangesetDiff diff(String idOrName) {
        ArchitectureModel current = getModel();
        return stagingAreaManager.diff(current, resolve(current, idOrName).getId());
    }

    public CommitResult commit(String idOrName, CommitOptions options) {
        ArchitectureModel current = getModel();
        return stagingAreaManager.commit(current, resolve(current, idOrName).getId(), options);
    }

    // ========================= EXPORT / IMPORT =========================

    public String export(String idOrName, ExportFormat format) {
        return exporter.export(getModel(), idOrName, format);
    }

    public void exportToFile(String idOrName, Path target, ExportFormat format) {
        exporter.exportToFile(getModel(), idOrName, target, format);
    }

    public ChangesetResponse importChangeset(String content, ExportFormat format) {
        return toResponse(exporter.importChangeset(getModel(), content, format));
    }

    public ChangesetResponse importFromFile(Path source) {
        return toResponse(exporter.importFromFile(getModel(), source));
    }

    public CompatibilityReport checkCompatibility(String content, ExportFormat format) {
        return exporter.validateCompatibility(getModel(), exporter.parse(content, format));
    }

    // ========================= MAINTENANCE =========================

    /**
     * Purge expired discarded changesets and stale temp files. Does nothing when no model exists yet.
     *
     * @return number of changesets and files removed
     */
    public int cleanup() {
        Path root = modelRoot();
        if (!modelRepository.exists(root)) {
            return 0;
        }
        int purged = stagingAreaManager.purgeDiscarded(getModel(), properties.getChangesetRetention());
        int temps = fileWriter.removeStaleTempFiles(root, STALE_TEMP_AGE);
        if (purged > 0 || temps > 0) {
            log.info("Cleanup removed {} discarded changeset(s) and {} stale temp file(s)", purged, temps);
        }
        return purged + temps;
    }

    private Changeset resolve(ArchitectureModel current, String idOrName) {
        if (idOrName != null) {
            return stagingAreaManager.load(current, idOrName);
        }
        return stagingAreaManager.getActive(current)
                .orElseThrow(() -> new NotFoundException("No active changeset"));
    }

    private ChangesetResponse toResponse(Changeset changeset) {
        Optional<Changeset> active = stagingAreaManager.getActive(getModel());
        boolean isActive = active.map(a -> a.getId().equals(changeset.getId())).orElse(false);
        return ChangesetResponse.from(changeset, isActive);
    }

    private Path modelRoot() {
        return Paths.get(properties.getModelRoot());
    }
}
