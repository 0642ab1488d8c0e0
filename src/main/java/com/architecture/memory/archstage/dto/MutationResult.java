package com.architecture.memory.archstage.dto;

import com.architecture.memory.archstage.model.Element;
import com.architecture.memory.archstage.model.changeset.ChangeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of an element edit: either staged into the active changeset or written to the model.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MutationResult {
    private ChangeType changeType;
    private String elementId;
    private String layerName;
    private boolean staged;
    // Set when staged
    private String changesetId;
    private Integer sequenceNumber;
    // Element after the change; null for a delete
    private Element element;
}
