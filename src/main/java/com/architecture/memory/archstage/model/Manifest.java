package com.architecture.memory.archstage.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model-wide metadata document (model/manifest.yaml).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Manifest {

    private String name;
    private String description;
    private String version;
    private String specVersion;
    private LocalDateTime created;
    private LocalDateTime modified;

    // Declared layers, in display order
    @Builder.Default
    private List<String> layers = new ArrayList<>();

    // Element count per layer, refreshed on every save
    @Builder.Default
    private Map<String, Integer> statistics = new LinkedHashMap<>();

    @Builder.Default
    private List<ChangesetHistoryEntry> changesetHistory = new ArrayList<>();

    public static Manifest create(String name, String description) {
        LocalDateTime now = LocalDateTime.now();
        return Manifest.builder()
                .name(name)
                .description(description)
                .version("1.0.0")
                .specVersion("1.0.0")
                .created(now)
                .modified(now)
                .build();
    }

    public Manifest copy() {
        List<ChangesetHistoryEntry> history = new ArrayList<>();
        if (changesetHistory != null) {
            changesetHistory.forEach(h -> history.add(h.toBuilder().build()));
        }
        return toBuilder()
                .layers(layers == null ? new ArrayList<>() : new ArrayList<>(layers))
                .statistics(statistics == null ? new LinkedHashMap<>() : new LinkedHashMap<>(statistics))
                .changesetHistory(history)
                .build();
    }

    public void declareLayer(String layer) {
        if (layers == null) {
            layers = new ArrayList<>();
        }
        if (!layers.contains(layer)) {
            layers.add(layer);
        }
    }
}
