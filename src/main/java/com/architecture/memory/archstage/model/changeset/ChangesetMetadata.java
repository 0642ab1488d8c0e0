package com.architecture.memory.archstage.model.changeset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persisted form of a changeset's header (changesets/{id}/metadata.yaml).
 * The change log lives in a separate document.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChangesetMetadata {
    private String id;
    private String name;
    private String description;
    private ChangesetStatus status;
    private String baseSnapshot;
    private ChangesetStats stats;
    private int changeCount;
    private LocalDateTime created;
    private LocalDateTime modified;
}
