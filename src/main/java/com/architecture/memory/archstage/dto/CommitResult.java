package com.architecture.memory.archstage.dto;

import com.architecture.memory.archstage.service.validation.ValidationFinding;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of a commit or a dry run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitResult {
    private String changesetId;
    private String changesetName;
    private boolean dryRun;
    private int additions;
    private int modifications;
    private int deletions;

    @Builder.Default
    private SortedSet<String> affectedLayers = new TreeSet<>();

    // Non-blocking findings (warnings) reported by validation
    @Builder.Default
    private List<ValidationFinding> warnings = new ArrayList<>();

    private String previousSnapshot;
    // Hash of the model after the commit; null for a dry run
    private String newSnapshot;
    private LocalDateTime committedAt;
}
