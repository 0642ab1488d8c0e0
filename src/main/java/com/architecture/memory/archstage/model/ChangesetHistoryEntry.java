package com.architecture.memory.archstage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only record in the manifest of a changeset that was committed to the model.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChangesetHistoryEntry {
    private String changesetId;
    private String name;
    private String action;          // committed
    private LocalDateTime appliedAt;
    private int additions;
    private int modifications;
    private int deletions;
}
