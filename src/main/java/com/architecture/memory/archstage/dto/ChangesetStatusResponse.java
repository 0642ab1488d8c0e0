package com.architecture.memory.archstage.dto;

import com.architecture.memory.archstage.model.changeset.ChangeRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The active (or requested) changeset with its change log and drift state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangesetStatusResponse {
    private ChangesetResponse changeset;

    @Builder.Default
    private List<ChangeRecord> changes = new ArrayList<>();

    private DriftReport drift;
}
