package com.architecture.memory.archstage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Result of comparing a changeset's recorded base state with the current model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriftReport {

    public enum DriftType {
        ADDED,
        MODIFIED,
        DELETED
    }

    private boolean drifted;
    private String baseSnapshot;
    private String currentSnapshot;

    // True when manifest content (outside the element data) changed
    private boolean manifestChanged;

    @Builder.Default
    private List<DriftedElement> elements = new ArrayList<>();

    @Builder.Default
    private SortedSet<String> affectedLayers = new TreeSet<>();

    // Set when no per-element base state was available and only the hash could be compared
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public static DriftReport clean(String snapshot) {
        return DriftReport.builder()
                .drifted(false)
                .baseSnapshot(snapshot)
                .currentSnapshot(snapshot)
                .build();
    }

    public List<String> getAffectedElementIds() {
        return elements.stream().map(DriftedElement::getElementId).collect(Collectors.toList());
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DriftedElement {
        private String elementId;
        private String layerName;
        private DriftType driftType;
    }
}
