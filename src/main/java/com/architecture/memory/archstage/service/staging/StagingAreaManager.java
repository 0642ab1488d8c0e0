package com.architecture.memory.archstage.service.staging;

import com.architecture.memory.archstage.dto.ChangesetDiff;
import com.architecture.memory.archstage.dto.CommitOptions;
import com.architecture.memory.archstage.dto.CommitResult;
import com.architecture.memory.archstage.dto.DriftReport;
import com.architecture.memory.archstage.exception.*;
import com.architecture.memory.archstage.model.ArchitectureModel;
import com.architecture.memory.archstage.model.ChangesetHistoryEntry;
import com.architecture.memory.archstage.model.ElementStates;
import com.architecture.memory.archstage.model.changeset.*;
import com.architecture.memory.archstage.repository.ChangesetRepository;
import com.architecture.memory.archstage.service.ModelPersistenceService;
import com.architecture.memory.archstage.service.validation.ValidationFinding;
import com.architecture.memory.archstage.service.validation.ValidationPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Lifecycle of changesets for one model root: create, activate, stage, commit, discard.
 *
 * Changesets are read from disk on every call, so a failed operation never leaves a
 * half-updated changeset in memory. At most one changeset is active per model root; the
 * pointer lives in {@code changesets/.active}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StagingAreaManager {

    private final ChangesetRepository changesetRepository;
    private final BaseSnapshotManager snapshotManager;
    private final VirtualProjectionEngine projectionEngine;
    private final ChangeMerger changeMerger;
    private final ModelPersistenceService persistenceService;
    private final ValidationPipeline validationPipeline;

    // ========================= LIFECYCLE =========================

    public synchronized Changeset create(ArchitectureModel model, String name, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Changeset name is required");
        }
        Path root = model.getRootPath();
        boolean taken = changesetRepository.findAll(root).stream().anyMatch(c -> c.getName().equals(name));
        if (taken) {
            throw new ConflictException(name, "A changeset named '" + name + "' already exists");
        }

        String id = "cs-" + UUID.randomUUID().toString().substring(0, 8);
        BaseState baseState = snapshotManager.captureState(model);
        Changeset changeset = Changeset.create(id, name, description, baseState.getSnapshot());
        changesetRepository.create(root, changeset, baseState);

        log.info("Created changeset {} ('{}') at base {}", id, name, shortHash(changeset.getBaseSnapshot()));
        return changeset;
    }

    public Changeset load(ArchitectureModel model, String idOrName) {
        return find(model, idOrName)
                .orElseThrow(() -> new NotFoundException("Changeset not found: " + idOrName));
    }

    public Optional<Changeset> find(ArchitectureModel model, String idOrName) {
        Path root = model.getRootPath();
        Optional<Changeset> byId = changesetRepository.findById(root, idOrName);
        if (byId.isPresent()) {
            return byId;
        }
        return changesetRepository.findAll(root).stream()
                .filter(c -> c.getName().equals(idOrName))
                .findFirst();
    }

    public List<Changeset> list(ArchitectureModel model) {
        return changesetRepository.findAll(model.getRootPath());
    }

    public synchronized void delete(ArchitectureModel model, String idOrName) {
        Changeset changeset = load(model, idOrName);
        Path root = model.getRootPath();
        if (changesetRepository.readActive(root).filter(changeset.getId()::equals).isPresent()) {
            throw new InvalidStateException("Cannot delete the active changeset '" + changeset.getName()
                    + "'; deactivate it first");
        }
        changesetRepository.delete(root, changeset.getId());
        projectionEngine.invalidate(changeset.getId());
        log.info("Deleted changeset {} ('{}')", changeset.getId(), changeset.getName());
    }

    // ========================= ACTIVE POINTER =========================

    /**
     * Make a changeset the active one. A draft becomes staged on activation.
     */
    public synchronized Changeset setActive(ArchitectureModel model, String idOrName) {
        Changeset changeset = load(model, idOrName);
        if (changeset.getStatus().isTerminal()) {
            throw new InvalidStateException(String.format(
                    "Cannot activate changeset '%s' with status %s", changeset.getName(), changeset.getStatus()));
        }
        Path root = model.getRootPath();
        if (changeset.getStatus() == ChangesetStatus.DRAFT) {
            changeset.markStaged();
            changesetRepository.save(root, changeset);
        }
        changesetRepository.writeActive(root, changeset.getId());
        log.info("Activated changeset {} ('{}')", changeset.getId(), changeset.getName());
        return changeset;
    }

    /**
     * The active changeset. A pointer to a missing or finished changeset is cleared.
     */
    public synchronized Optional<Changeset> getActive(ArchitectureModel model) {
        Path root = model.getRootPath();
        Optional<String> pointer = changesetRepository.readActive(root);
        if (pointer.isEmpty()) {
            return Optional.empty();
        }
        Optional<Changeset> changeset = changesetRepository.findById(root, pointer.get());
        if (changeset.isEmpty() || !changeset.get().isActiveStatus()) {
            log.warn("Active changeset pointer {} is stale, clearing it", pointer.get());
            changesetRepository.clearActive(root);
            return Optional.empty();
        }
        return changeset;
    }

    public synchronized void clearActive(ArchitectureModel model) {
        changesetRepository.clearActive(model.getRootPath());
        log.info("Cleared active changeset for {}", model.getRootPath());
    }

    // ========================= STAGING =========================

    /**
     * Stage a record into the active changeset.
     */
    public synchronized ChangeRecord stage(ArchitectureModel model, ChangeRecord record) {
        Changeset active = getActive(model)
                .orElseThrow(() -> new InvalidStateException("No active changeset to stage into"));
        return stage(model, active.getId(), record);
    }

    /**
     * Append a record to a changeset. The extended log is replayed against the base model
     * first; a contradictory or unresolvable record is rejected and nothing is written.
     */
    public synchronized ChangeRecord stage(ArchitectureModel model, String changesetId, ChangeRecord record) {
        Changeset changeset = load(model, changesetId);
        if (changeset.getStatus().isTerminal()) {
            throw new InvalidStateException(String.format(
                    "Cannot stage changes on changeset '%s' with status %s", changeset.getName(), changeset.getStatus()));
        }
        changeMerger.verifyAppend(model, changeset, record);

        ChangeRecord sequenced = changeset.append(record);
        if (changeset.getStatus() == ChangesetStatus.DRAFT) {
            changeset.markStaged();
        }
        changesetRepository.save(model.getRootPath(), changeset);
        projectionEngine.invalidate(changeset.getId());

        log.info("Staged {} of {} into changeset {} as #{}",
                record.getType(), record.getElementId(), changeset.getId(), sequenced.getSequenceNumber());
        return sequenced;
    }

    public synchronized Changeset unstage(ArchitectureModel model, String elementId) {
        Changeset active = getActive(model)
                .orElseThrow(() -> new InvalidStateException("No active changeset to unstage from"));
        return unstage(model, active.getId(), elementId);
    }

    /**
     * Remove every record for an element and renumber the rest. Refused when a remaining
     * record no longer replays without it.
     */
    public synchronized Changeset unstage(ArchitectureModel model, String changesetId, String elementId) {
        Changeset changeset = load(model, changesetId);
        int removed = changeset.removeChangesFor(elementId);
        if (removed == 0) {
            throw new NotFoundException(String.format(
                    "No staged changes for element %s in changeset '%s'", elementId, changeset.getName()));
        }
        try {
            changeMerger.apply(ChangeMerger.copyOf(model), changeset.getChanges());
        } catch (ArchStageException e) {
            throw new ConflictException(elementId, String.format(
                    "Cannot unstage %s from changeset '%s': later changes depend on it (%s)",
                    elementId, changeset.getName(), String.join(", ", dependentsOf(changeset, elementId, e))));
        }
        changesetRepository.save(model.getRootPath(), changeset);
        projectionEngine.invalidate(changeset.getId());
        log.info("Unstaged {} change(s) for {} from changeset {}", removed, elementId, changeset.getId());
        return changeset;
    }

    private static List<String> dependentsOf(Changeset changeset, String elementId, ArchStageException failure) {
        List<String> dependents = changeset.getChanges().stream()
                .filter(change -> targets(change.getAfter(), elementId))
                .map(ChangeRecord::getElementId)
                .distinct()
                .collect(Collectors.toList());
        return dependents.isEmpty() ? List.of(failure.getMessage()) : dependents;
    }

    private static boolean targets(Map<String, Object> state, String elementId) {
        if (state == null) {
            return false;
        }
        for (String key : List.of(ElementStates.RELATIONSHIPS, ElementStates.REFERENCES)) {
            if (state.get(key) instanceof List<?> edges) {
                for (Object edge : edges) {
                    if (edge instanceof Map<?, ?> m && elementId.equals(m.get("target"))) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    /**
     * Drop a changeset's pending changes. The base model is not touched.
     */
    public synchronized Changeset discard(ArchitectureModel model, String idOrName) {
        Changeset changeset = load(model, idOrName);
        changeset.markDiscarded();
        Path root = model.getRootPath();
        changesetRepository.save(root, changeset);
        if (changesetRepository.readActive(root).filter(changeset.getId()::equals).isPresent()) {
            changesetRepository.clearActive(root);
        }
        projectionEngine.invalidate(changeset.getId());
        log.info("Discarded changeset {} ('{}')", changeset.getId(), changeset.getName());
        return changeset;
    }

    // ========================= INSPECTION =========================

    public DriftReport detectDrift(ArchitectureModel model, String idOrName) {
        Changeset changeset = load(model, idOrName);
        BaseState baseState = changesetRepository.findBaseState(model.getRootPath(), changeset.getId()).orElse(null);
        return snapshotManager.detectDrift(changeset, baseState, model);
    }

    public ProjectedModel preview(ArchitectureModel model, String idOrName) {
        return projectionEngine.projectChangeset(model, load(model, idOrName));
    }

    public ChangesetDiff diff(ArchitectureModel model, String idOrName) {
        return projectionEngine.computeDiff(model, load(model, idOrName));
    }

    // ========================= COMMIT =========================

    /**
     * Apply a staged changeset to the model.
     *
     * Steps:
     * 1. Load; the changeset must be staged
     * 2. Drift check against the recorded base (unless skipped)
     * 3. Validate the projected model (unless skipped); any ERROR blocks the commit
     * 4. Stop here for a dry run
     * 5. Merge the log into the live graph and write layers, relationships, manifest and the
     *    committed changeset metadata as one unit; on failure the graph is rolled back and the
     *    changeset stays staged
     * 6. Mark committed and clear the active pointer if it pointed here
     */
    public synchronized CommitResult commit(ArchitectureModel model, String idOrName, CommitOptions options) {
        CommitOptions opts = options != null ? options : CommitOptions.defaults();
        Path root = model.getRootPath();

        Changeset changeset = load(model, idOrName);
        if (changeset.getStatus() != ChangesetStatus.STAGED) {
            throw new InvalidStateException(String.format(
                    "Cannot commit changeset '%s': status is %s, expected STAGED",
                    changeset.getName(), changeset.getStatus()));
        }

        if (!opts.isSkipDriftCheck()) {
            BaseState baseState = changesetRepository.findBaseState(root, changeset.getId()).orElse(null);
            DriftReport drift = snapshotManager.detectDrift(changeset, baseState, model);
            if (drift.isDrifted()) {
                log.warn("Commit of changeset {} blocked by drift in layers {}", changeset.getId(), drift.getAffectedLayers());
                throw new DriftException(changeset.getName(), drift);
            }
        }

        List<ValidationFinding> warnings = new ArrayList<>();
        if (!opts.isSkipValidation()) {
            List<ValidationFinding> findings = validationPipeline.validate(projectionEngine.projectChangeset(model, changeset));
            List<ValidationFinding> errors = ValidationPipeline.errors(findings);
            if (!errors.isEmpty()) {
                log.warn("Commit of changeset {} blocked by {} validation error(s)", changeset.getId(), errors.size());
                throw new ValidationException(changeset.getName(), errors);
            }
            warnings = findings.stream().filter(f -> !f.isError()).collect(Collectors.toList());
        }

        String previousSnapshot = snapshotManager.captureSnapshot(model);
        CommitResult.CommitResultBuilder result = CommitResult.builder()
                .changesetId(changeset.getId())
                .changesetName(changeset.getName())
                .additions(changeset.getStats().getAdditions())
                .modifications(changeset.getStats().getModifications())
                .deletions(changeset.getStats().getDeletions())
                .affectedLayers(changeset.getAffectedLayers())
                .warnings(warnings)
                .previousSnapshot(previousSnapshot);

        if (opts.isDryRun()) {
            log.info("Dry run of changeset {}: {} change(s) would be applied", changeset.getId(), changeset.getChangeCount());
            return result.dryRun(true).build();
        }

        LocalDateTime committedAt = LocalDateTime.now();
        ChangesetMetadata committedMetadata = changeset.toMetadata().toBuilder()
                .status(ChangesetStatus.COMMITTED)
                .modified(committedAt)
                .build();

        try {
            persistenceService.applyAndPersist(model, writes -> {
                ChangeMerger.MergeResult merge = changeMerger.apply(model, changeset.getChanges());
                model.getManifest().getChangesetHistory().add(ChangesetHistoryEntry.builder()
                        .changesetId(changeset.getId())
                        .name(changeset.getName())
                        .action("committed")
                        .appliedAt(committedAt)
                        .additions(merge.getAdditions())
                        .modifications(merge.getModifications())
                        .deletions(merge.getDeletions())
                        .build());
                writes.layers(merge.getAffectedLayers());
                writes.documents(changesetRepository.documents(root, committedMetadata, changeset.getChanges()));
                return merge;
            });
        } catch (ArchStageException e) {
            log.error("Commit of changeset {} failed, model left at its previous state", changeset.getId(), e);
            throw e;
        }

        changeset.markCommitted();
        if (changesetRepository.readActive(root).filter(changeset.getId()::equals).isPresent()) {
            changesetRepository.clearActive(root);
        }
        projectionEngine.invalidate(changeset.getId());

        String newSnapshot = snapshotManager.captureSnapshot(model);
        log.info("Committed changeset {} ('{}'): {} change(s), base {} -> {}", changeset.getId(), changeset.getName(),
                changeset.getChangeCount(), shortHash(previousSnapshot), shortHash(newSnapshot));
        return result.newSnapshot(newSnapshot).committedAt(committedAt).build();
    }

    // ========================= MAINTENANCE =========================

    /**
     * Delete discarded changesets last modified before {@code now - retention}.
     *
     * @return number of changesets removed
     */
    public synchronized int purgeDiscarded(ArchitectureModel model, Duration retention) {
        LocalDateTime cutoff = LocalDateTime.now().minus(retention);
        int purged = 0;
        for (Changeset changeset : changesetRepository.findAll(model.getRootPath())) {
            if (changeset.getStatus() == ChangesetStatus.DISCARDED
                    && changeset.getModified() != null
                    && changeset.getModified().isBefore(cutoff)) {
                changesetRepository.delete(model.getRootPath(), changeset.getId());
                projectionEngine.invalidate(changeset.getId());
                purged++;
            }
        }
        return purged;
    }

    private static String shortHash(String hash) {
        return hash == null || hash.length() < 12 ? hash : hash.substring(0, 12);
    }
}
