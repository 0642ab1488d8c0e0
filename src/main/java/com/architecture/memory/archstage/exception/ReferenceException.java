package com.architecture.memory.archstage.exception;

import lombok.Getter;

/**
 * Raised when an edge would point at a node that does not exist.
 */
@Getter
public class ReferenceException extends ArchStageException {

    private final String endpoint;      // "source" or "destination"
    private final String missingNodeId;

    public ReferenceException(String endpoint, String missingNodeId, String edgeDescription) {
        super(String.format("Cannot add relationship %s: %s node '%s' does not exist",
                edgeDescription, endpoint, missingNodeId));
        this.endpoint = endpoint;
        this.missingNodeId = missingNodeId;
    }
}
