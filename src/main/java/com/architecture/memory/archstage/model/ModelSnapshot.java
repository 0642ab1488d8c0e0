package com.architecture.memory.archstage.model;

import com.architecture.memory.archstage.model.graph.GraphModel;

/**
 * Deep copy of a model's in-memory state, taken before a write so it can be restored.
 */
public record ModelSnapshot(Manifest manifest, GraphModel graph) {
}
