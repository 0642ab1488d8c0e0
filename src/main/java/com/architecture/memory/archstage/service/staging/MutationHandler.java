package com.architecture.memory.archstage.service.staging;

import com.architecture.memory.archstage.dto.MutationResult;
import com.architecture.memory.archstage.exception.ConflictException;
import com.architecture.memory.archstage.exception.NotFoundException;
import com.architecture.memory.archstage.model.ArchitectureModel;
import com.architecture.memory.archstage.model.Element;
import com.architecture.memory.archstage.model.ElementStates;
import com.architecture.memory.archstage.model.changeset.ChangeRecord;
import com.architecture.memory.archstage.model.changeset.ChangeType;
import com.architecture.memory.archstage.model.changeset.Changeset;
import com.architecture.memory.archstage.service.ModelPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Entry point for element edits.
 *
 * With an active changeset the edit is staged as a {@link ChangeRecord} and the base model is
 * left alone. Without one it is applied to the model and persisted through
 * {@link ModelPersistenceService}; a write that fails is rolled back in memory.
 *
 * The mutator runs exactly once, on a working copy. The staged after-state and the applied
 * element both come from that same copy.
 *
 * Edits hold the {@link StagingAreaManager} monitor, so a commit or activation cannot
 * interleave with reading the active changeset and staging into it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MutationHandler {

    private final StagingAreaManager stagingAreaManager;
    private final VirtualProjectionEngine projectionEngine;
    private final ModelPersistenceService persistenceService;

    public MutationResult executeAdd(ArchitectureModel model, Element element, Consumer<Element> mutator) {
        synchronized (stagingAreaManager) {
            return addLocked(model, element, mutator);
        }
    }

    private MutationResult addLocked(ArchitectureModel model, Element element, Consumer<Element> mutator) {
        Element working = element.copy();
        if (mutator != null) {
            mutator.accept(working);
        }
        requireIdentity(working);
        String id = working.getId();
        String layer = working.getLayer();
        Map<String, Object> after = ElementStates.toState(working);

        Optional<Changeset> active = stagingAreaManager.getActive(model);
        if (active.isPresent()) {
            ChangeRecord staged = stagingAreaManager.stage(model, active.get().getId(), ChangeRecord.add(id, layer, after));
            return stagedResult(staged, active.get(), working);
        }

        persistenceService.applyAndPersist(model, writes -> {
            model.getLayer(layer).addElement(working);
            writes.layer(layer);
            return null;
        });
        log.info("Added element {} to layer {}", id, layer);
        return appliedResult(ChangeType.ADD, id, layer, model.findElement(id).orElse(working));
    }

    public MutationResult executeUpdate(ArchitectureModel model, String elementId, Consumer<Element> mutator) {
        synchronized (stagingAreaManager) {
            return updateLocked(model, elementId, mutator);
        }
    }

    private MutationResult updateLocked(ArchitectureModel model, String elementId, Consumer<Element> mutator) {
        Optional<Changeset> active = stagingAreaManager.getActive(model);
        Element current = currentElement(model, active, elementId);

        Element working = current.copy();
        if (mutator != null) {
            mutator.accept(working);
        }
        if (!elementId.equals(working.getId()) || !current.getLayer().equals(working.getLayer())) {
            throw new IllegalArgumentException("An update cannot change the id or layer of element " + elementId);
        }
        String layer = current.getLayer();
        Map<String, Object> after = ElementStates.updateState(current, working);

        if (active.isPresent()) {
            ChangeRecord record = ChangeRecord.update(elementId, layer, ElementStates.toState(current), after);
            ChangeRecord staged = stagingAreaManager.stage(model, active.get().getId(), record);
            return stagedResult(staged, active.get(), working);
        }

        Element updated = persistenceService.applyAndPersist(model, writes -> {
            writes.layer(layer);
            return model.getLayer(layer).updateElement(elementId, after);
        });
        log.info("Updated element {} in layer {}", elementId, layer);
        return appliedResult(ChangeType.UPDATE, elementId, layer, updated);
    }

    public MutationResult executeDelete(ArchitectureModel model, String elementId) {
        synchronized (stagingAreaManager) {
            return deleteLocked(model, elementId);
        }
    }

    private MutationResult deleteLocked(ArchitectureModel model, String elementId) {
        Optional<Changeset> active = stagingAreaManager.getActive(model);
        Element current = currentElement(model, active, elementId);
        String layer = current.getLayer();

        if (active.isPresent()) {
            ChangeRecord record = ChangeRecord.delete(elementId, layer, ElementStates.toState(current));
            ChangeRecord staged = stagingAreaManager.stage(model, active.get().getId(), record);
            return stagedResult(staged, active.get(), null);
        }

        persistenceService.applyAndPersist(model, writes -> {
            model.getLayer(layer).deleteElement(elementId);
            writes.layer(layer);
            return null;
        });
        log.info("Deleted element {} from layer {}", elementId, layer);
        return appliedResult(ChangeType.DELETE, elementId, layer, null);
    }

    /**
     * The element as the editor sees it: the projected state while a changeset is active,
     * the committed state otherwise.
     */
    private Element currentElement(ArchitectureModel model, Optional<Changeset> active, String elementId) {
        if (active.isEmpty()) {
            return model.getElement(elementId);
        }
        Changeset changeset = active.get();
        boolean deletedInChangeset = changeset.lastChangeFor(elementId)
                .filter(c -> c.getType() == ChangeType.DELETE)
                .isPresent();
        if (deletedInChangeset) {
            throw new ConflictException(elementId, String.format(
                    "Element %s is deleted in changeset '%s'", elementId, changeset.getName()));
        }
        return projectionEngine.projectElement(model, changeset, elementId)
                .orElseThrow(() -> new NotFoundException("Element not found: " + elementId));
    }

    private static void requireIdentity(Element element) {
        if (element.getId() == null || element.getId().isBlank()) {
            throw new IllegalArgumentException("Element id is required");
        }
        if (element.getLayer() == null || element.getLayer().isBlank()) {
            throw new IllegalArgumentException("Layer is required for element " + element.getId());
        }
    }

    private static MutationResult stagedResult(ChangeRecord staged, Changeset changeset, Element element) {
        return MutationResult.builder()
                .changeType(staged.getType())
                .elementId(staged.getElementId())
                .layerName(staged.getLayerName())
                .staged(true)
                .changesetId(changeset.getId())
                .sequenceNumber(staged.getSequenceNumber())
                .element(element)
                .build();
    }

    private static MutationResult appliedResult(ChangeType type, String elementId, String layer, Element element) {
        return MutationResult.builder()
                .changeType(type)
                .elementId(elementId)
                .layerName(layer)
                .staged(false)
                .element(element)
                .build();
    }
}
