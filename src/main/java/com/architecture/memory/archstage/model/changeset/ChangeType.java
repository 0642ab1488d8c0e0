package com.architecture.memory.archstage.model.changeset;

public enum ChangeType {
    ADD,
    UPDATE,
    DELETE
}
