package com.architecture.memory.archstage.model.changeset;

/**
 * Lifecycle: DRAFT -> STAGED -> {COMMITTED | DISCARDED}. DRAFT may also be discarded directly.
 */
public enum ChangesetStatus {
    DRAFT,
    STAGED,
    COMMITTED,
    DISCARDED;

    public boolean isTerminal() {
        return this == COMMITTED || this == DISCARDED;
    }
}
