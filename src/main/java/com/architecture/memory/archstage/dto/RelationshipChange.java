package com.architecture.memory.archstage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A relationship present on only one side of a diff.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipChange {

    public enum ChangeKind {
        ADDED,
        REMOVED
    }

    private ChangeKind changeKind;
    private String relationshipId;
    private String predicate;
    private String sourceId;
    private String destinationId;
}
