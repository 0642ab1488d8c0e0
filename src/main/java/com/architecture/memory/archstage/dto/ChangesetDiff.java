package com.architecture.memory.archstage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Differences between the committed model and the model a changeset would produce.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangesetDiff {

    private String changesetId;
    private String changesetName;
    private String baseSnapshot;
    private LocalDateTime computedAt;

    @Builder.Default
    private List<ElementChange> additions = new ArrayList<>();
    @Builder.Default
    private List<ElementChange> modifications = new ArrayList<>();
    @Builder.Default
    private List<ElementChange> deletions = new ArrayList<>();
    @Builder.Default
    private List<RelationshipChange> relationshipChanges = new ArrayList<>();

    private DiffSummary summary;

    public boolean isEmpty() {
        return additions.isEmpty() && modifications.isEmpty() && deletions.isEmpty() && relationshipChanges.isEmpty();
    }
}
