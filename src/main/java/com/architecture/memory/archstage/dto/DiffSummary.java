package com.architecture.memory.archstage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Summary statistics for a changeset diff.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiffSummary {
    private int totalChanges;
    private int elementsAdded;
    private int elementsModified;
    private int elementsRemoved;
    private int relationshipsAdded;
    private int relationshipsRemoved;

    // Breakdown by layer: e.g., {"business": 2, "application": 1}
    private Map<String, Integer> changesByLayer;
}
