package com.architecture.memory.archstage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitOptions {
    private boolean skipValidation;
    private boolean skipDriftCheck;
    // Run drift and validation checks but write nothing
    private boolean dryRun;

    public static CommitOptions defaults() {
        return new CommitOptions();
    }
}
