package com.architecture.memory.archstage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Whether an exported changeset can be applied to the current model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompatibilityReport {
    private boolean compatible;
    private boolean baseSnapshotMatch;

    @Builder.Default
    private List<String> missingElements = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    @Builder.Default
    private SortedSet<String> affectedLayers = new TreeSet<>();
}
