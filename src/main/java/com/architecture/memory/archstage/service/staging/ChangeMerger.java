package com.architecture.memory.archstage.service.staging;

import com.architecture.memory.archstage.exception.ConflictException;
import com.architecture.memory.archstage.exception.NotFoundException;
import com.architecture.memory.archstage.model.ArchitectureModel;
import com.architecture.memory.archstage.model.ElementStates;
import com.architecture.memory.archstage.model.Layer;
import com.architecture.memory.archstage.model.changeset.ChangeRecord;
import com.architecture.memory.archstage.model.changeset.ChangeType;
import com.architecture.memory.archstage.model.changeset.Changeset;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Replays a change log onto a model. Projection runs it on a copy, commit on the live model,
 * so both see exactly the same result.
 *
 * Rules:
 * <ul>
 *   <li>records are applied in sequence-number order, which must be strictly increasing</li>
 *   <li>ADD of an element that exists, or was added or updated earlier in the log: conflict</li>
 *   <li>UPDATE or DELETE after a DELETE of the same element: conflict</li>
 *   <li>UPDATE or DELETE of an element the model does not have: not found</li>
 *   <li>ADD after DELETE re-creates the element</li>
 * </ul>
 */
@Component
@Slf4j
public class ChangeMerger {

    public MergeResult apply(ArchitectureModel target, List<ChangeRecord> records) {
        List<ChangeRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparingInt(ChangeRecord::getSequenceNumber));

        Replay replay = new Replay(target);
        int previous = Integer.MIN_VALUE;
        for (ChangeRecord record : ordered) {
            if (record.getSequenceNumber() <= previous) {
                throw new IllegalStateException(String.format(
                        "Change log is not strictly ordered: sequence %d follows %d for element %s",
                        record.getSequenceNumber(), previous, record.getElementId()));
            }
            previous = record.getSequenceNumber();
            replay.apply(record);
        }
        return replay.result();
    }

    /**
     * Check that appending {@code record} keeps the log consistent: first against the log itself,
     * then by replaying the extended log on a copy of {@code base}.
     */
    public void verifyAppend(ArchitectureModel base, Changeset changeset, ChangeRecord record) {
        checkAppend(changeset, record);
        Replay replay = new Replay(copyOf(base));
        changeset.getChanges().forEach(replay::apply);
        replay.apply(record);
    }

    /**
     * Log-only contradiction check, no model needed.
     */
    public void checkAppend(Changeset changeset, ChangeRecord record) {
        Optional<ChangeRecord> last = changeset.lastChangeFor(record.getElementId());
        if (last.isEmpty()) {
            return;
        }
        ChangeType previous = last.get().getType();
        if (previous == ChangeType.DELETE && record.getType() != ChangeType.ADD) {
            throw new ConflictException(record.getElementId(), String.format(
                    "Cannot %s element %s: it is deleted earlier in changeset '%s'",
                    record.getType().name().toLowerCase(), record.getElementId(), changeset.getName()));
        }
        if (previous != ChangeType.DELETE && record.getType() == ChangeType.ADD) {
            throw new ConflictException(record.getElementId(), String.format(
                    "Cannot add element %s: changeset '%s' already %s it",
                    record.getElementId(), changeset.getName(), previous == ChangeType.ADD ? "adds" : "updates"));
        }
    }

    static ArchitectureModel copyOf(ArchitectureModel base) {
        return new ArchitectureModel(base.getRootPath(), base.getManifest().copy(), base.getGraph().copy());
    }

    // ========================= REPLAY =========================

    private static final class Replay {
        private final ArchitectureModel target;
        private final Set<String> deleted = new HashSet<>();
        private final Set<String> written = new HashSet<>();
        private final MergeResult result = new MergeResult();

        Replay(ArchitectureModel target) {
            this.target = target;
        }

        void apply(ChangeRecord record) {
            String id = record.getElementId();
            Layer layer = target.getLayer(record.getLayerName());
            switch (record.getType()) {
                case ADD -> {
                    if (written.contains(id) || target.getGraph().hasNode(id)) {
                        throw new ConflictException(id, "Cannot add element " + id + ": it already exists");
                    }
                    layer.addElement(ElementStates.toElement(id, record.getLayerName(), record.getAfter()));
                    target.getManifest().declareLayer(record.getLayerName());
                    deleted.remove(id);
                    written.add(id);
                    result.additions++;
                }
                case UPDATE -> {
                    requirePresent(record, layer);
                    layer.updateElement(id, record.getAfter());
                    written.add(id);
                    result.modifications++;
                }
                case DELETE -> {
                    requirePresent(record, layer);
                    layer.deleteElement(id);
                    deleted.add(id);
                    written.remove(id);
                    result.deletions++;
                }
            }
            result.affectedLayers.add(record.getLayerName());
            result.elementIds.add(id);
        }

        private void requirePresent(ChangeRecord record, Layer layer) {
            String id = record.getElementId();
            if (deleted.contains(id)) {
                throw new ConflictException(id, String.format(
                        "Cannot %s element %s: it was deleted earlier in the change log",
                        record.getType().name().toLowerCase(), id));
            }
            if (!layer.hasElement(id)) {
                throw new NotFoundException(String.format(
                        "Cannot %s element %s: not found in layer %s",
                        record.getType().name().toLowerCase(), id, record.getLayerName()));
            }
        }

        MergeResult result() {
            return result;
        }
    }

    @Getter
    public static class MergeResult {
        private int additions;
        private int modifications;
        private int deletions;
        private final SortedSet<String> affectedLayers = new TreeSet<>();
        private final Set<String> elementIds = new LinkedHashSet<>();

        public int total() {
            return additions + modifications + deletions;
        }
    }
}
