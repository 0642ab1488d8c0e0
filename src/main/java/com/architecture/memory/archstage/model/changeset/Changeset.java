package com.architecture.memory.archstage.model.changeset;

import com.architecture.memory.archstage.exception.InvalidStateException;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * A named, ordered batch of pending changes plus the hash of the base model it branched from.
 *
 * The change log is append-only through {@link #append(ChangeRecord)}, which is the only place
 * a sequence number is assigned; numbers are gapless and start at 0. Stats are recomputed from
 * the log after every change and never incremented on their own.
 */
@Getter
public class Changeset {

    private final String id;
    private final String name;
    private final String description;
    private final String baseSnapshot;
    private final LocalDateTime created;

    private ChangesetStatus status;
    private LocalDateTime modified;
    private ChangesetStats stats = new ChangesetStats();

    private final List<ChangeRecord> changes = new ArrayList<>();

    private Changeset(String id, String name, String description, String baseSnapshot,
                      ChangesetStatus status, LocalDateTime created, LocalDateTime modified) {
        this.id = Objects.requireNonNull(id, "changeset id");
        this.name = Objects.requireNonNull(name, "changeset name");
        this.description = description;
        this.baseSnapshot = Objects.requireNonNull(baseSnapshot, "base snapshot");
        this.status = status;
        this.created = created;
        this.modified = modified;
    }

    public static Changeset create(String id, String name, String description, String baseSnapshot) {
        LocalDateTime now = LocalDateTime.now();
        return new Changeset(id, name, description, baseSnapshot, ChangesetStatus.DRAFT, now, now);
    }

    /**
     * Rebuild a changeset from its persisted metadata and log.
     *
     * @throws IllegalStateException when the log's sequence numbers are not 0..n-1
     */
    public static Changeset restore(ChangesetMetadata metadata, List<ChangeRecord> log) {
        Changeset changeset = new Changeset(metadata.getId(), metadata.getName(), metadata.getDescription(),
                metadata.getBaseSnapshot(), metadata.getStatus(), metadata.getCreated(), metadata.getModified());
        List<ChangeRecord> ordered = new ArrayList<>(log == null ? List.of() : log);
        ordered.sort(Comparator.comparingInt(ChangeRecord::getSequenceNumber));
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).getSequenceNumber() != i) {
                throw new IllegalStateException(String.format(
                        "Change log of changeset %s is corrupt: expected sequence %d but found %d",
                        metadata.getId(), i, ordered.get(i).getSequenceNumber()));
            }
        }
        changeset.changes.addAll(ordered);
        changeset.updateStats();
        return changeset;
    }

    public ChangesetMetadata toMetadata() {
        return ChangesetMetadata.builder()
                .id(id)
                .name(name)
                .description(description)
                .status(status)
                .baseSnapshot(baseSnapshot)
                .stats(ChangesetStats.builder()
                        .additions(stats.getAdditions())
                        .modifications(stats.getModifications())
                        .deletions(stats.getDeletions())
                        .build())
                .changeCount(changes.size())
                .created(created)
                .modified(modified)
                .build();
    }

    // ========================= CHANGE LOG =========================

    /**
     * Ordered by sequence number.
     */
    public List<ChangeRecord> getChanges() {
        return Collections.unmodifiableList(changes);
    }

    /**
     * Append an unsequenced record, giving it the next sequence number.
     */
    public ChangeRecord append(ChangeRecord record) {
        if (status.isTerminal()) {
            throw new InvalidStateException(String.format(
                    "Cannot stage changes on changeset '%s' with status %s", name, status));
        }
        if (record.isSequenced()) {
            throw new IllegalArgumentException("Sequence numbers are assigned by staging, got " + record.getSequenceNumber());
        }
        ChangeRecord sequenced = record.withSequenceNumber(changes.size());
        changes.add(sequenced);
        updateStats();
        touch();
        return sequenced;
    }

    /**
     * Drop every record for an element and close the gaps in the remaining sequence.
     *
     * @return number of records removed
     */
    public int removeChangesFor(String elementId) {
        if (status.isTerminal()) {
            throw new InvalidStateException(String.format(
                    "Cannot unstage changes on changeset '%s' with status %s", name, status));
        }
        List<ChangeRecord> remaining = new ArrayList<>();
        int removed = 0;
        for (ChangeRecord record : changes) {
            if (record.getElementId().equals(elementId)) {
                removed++;
            } else {
                remaining.add(record.withSequenceNumber(remaining.size()));
            }
        }
        if (removed > 0) {
            changes.clear();
            changes.addAll(remaining);
            updateStats();
            touch();
        }
        return removed;
    }

    public List<ChangeRecord> getChangesFor(String elementId) {
        return changes.stream()
                .filter(c -> c.getElementId().equals(elementId))
                .collect(Collectors.toList());
    }

    public Optional<ChangeRecord> lastChangeFor(String elementId) {
        for (int i = changes.size() - 1; i >= 0; i--) {
            if (changes.get(i).getElementId().equals(elementId)) {
                return Optional.of(changes.get(i));
            }
        }
        return Optional.empty();
    }

    public List<ChangeRecord> getChangesByType(ChangeType type) {
        return changes.stream().filter(c -> c.getType() == type).collect(Collectors.toList());
    }

    public int getChangeCount() {
        return changes.size();
    }

    public SortedSet<String> getAffectedLayers() {
        return changes.stream().map(ChangeRecord::getLayerName).collect(Collectors.toCollection(TreeSet::new));
    }

    public void updateStats() {
        this.stats = ChangesetStats.builder()
                .additions(getChangesByType(ChangeType.ADD).size())
                .modifications(getChangesByType(ChangeType.UPDATE).size())
                .deletions(getChangesByType(ChangeType.DELETE).size())
                .build();
    }

    // ========================= STATUS =========================

    public void markStaged() {
        requireStatus("stage", ChangesetStatus.DRAFT);
        status = ChangesetStatus.STAGED;
        touch();
    }

    public void markCommitted() {
        requireStatus("commit", ChangesetStatus.STAGED);
        status = ChangesetStatus.COMMITTED;
        touch();
    }

    /**
     * Discarding drops the pending changes; the base model is never touched.
     */
    public void markDiscarded() {
        requireStatus("discard", ChangesetStatus.DRAFT, ChangesetStatus.STAGED);
        status = ChangesetStatus.DISCARDED;
        changes.clear();
        updateStats();
        touch();
    }

    public boolean isActiveStatus() {
        return !status.isTerminal();
    }

    private void requireStatus(String operation, ChangesetStatus... allowed) {
        for (ChangesetStatus s : allowed) {
            if (status == s) {
                return;
            }
        }
        throw new InvalidStateException(String.format(
                "Cannot %s changeset '%s': status is %s, expected %s", operation, name, status, Arrays.toString(allowed)));
    }

    private void touch() {
        modified = LocalDateTime.now();
    }
}
