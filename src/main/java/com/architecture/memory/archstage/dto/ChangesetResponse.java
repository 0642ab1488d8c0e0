package com.architecture.memory.archstage.dto;

import com.architecture.memory.archstage.model.changeset.Changeset;
import com.architecture.memory.archstage.model.changeset.ChangesetStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangesetResponse {
    private String id;
    private String name;
    private String description;
    private ChangesetStatus status;
    private String baseSnapshot;
    private int additions;
    private int modifications;
    private int deletions;
    private int changeCount;
    private boolean active;
    private LocalDateTime created;
    private LocalDateTime modified;

    public static ChangesetResponse from(Changeset changeset, boolean active) {
        return ChangesetResponse.builder()
                .id(changeset.getId())
                .name(changeset.getName())
                .description(changeset.getDescription())
                .status(changeset.getStatus())
                .baseSnapshot(changeset.getBaseSnapshot())
                .additions(changeset.getStats().getAdditions())
                .modifications(changeset.getStats().getModifications())
                .deletions(changeset.getStats().getDeletions())
                .changeCount(changeset.getChangeCount())
                .active(active)
                .created(changeset.getCreated())
                .modified(changeset.getModified())
                .build();
    }
}
