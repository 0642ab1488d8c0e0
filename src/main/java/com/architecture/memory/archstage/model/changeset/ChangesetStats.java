package com.architecture.memory.archstage.model.changeset;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Change counts, always derived from the change log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangesetStats {
    private int additions;
    private int modifications;
    private int deletions;

    public int total() {
        return additions + modifications + deletions;
    }
}
