package com.architecture.memory.archstage.model.changeset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-element fingerprints of the model a changeset branched from (changesets/{id}/base-state.yaml).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaseState {

    private String snapshot;
    private String manifestHash;
    private LocalDateTime capturedAt;

    // element id -> fingerprint
    @Builder.Default
    private Map<String, ElementFingerprint> elements = new TreeMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ElementFingerprint {
        private String layer;
        private String hash;
    }
}
