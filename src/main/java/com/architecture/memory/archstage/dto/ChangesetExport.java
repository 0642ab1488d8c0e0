package com.architecture.memory.archstage.dto;

import com.architecture.memory.archstage.model.changeset.ChangeRecord;
import com.architecture.memory.archstage.model.changeset.ChangesetStats;
import com.architecture.memory.archstage.model.changeset.ChangesetStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Portable form of a changeset, written by export and read by import.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangesetExport {

    private String id;
    private String name;
    private String description;
    private ChangesetStatus status;
    private String baseSnapshot;
    private LocalDateTime created;
    private LocalDateTime modified;
    private ExportInfo export;
    private ChangesetStats stats;

    @Builder.Default
    private List<ChangeRecord> changes = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExportInfo {
        private String version;
        private LocalDateTime exportedAt;
        private ExportFormat format;
    }
}
