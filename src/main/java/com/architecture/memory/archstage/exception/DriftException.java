package com.architecture.memory.archstage.exception;

import com.architecture.memory.archstage.dto.DriftReport;
import lombok.Getter;

/**
 * The base model changed since the changeset was created. Carries the layers and
 * elements that differ from the recorded base state.
 */
@Getter
public class DriftException extends ArchStageException {

    private final transient DriftReport report;

    public DriftException(String changesetName, DriftReport report) {
        super(String.format("Base model has drifted since changeset '%s' was created. Affected layers: %s, affected elements: %s",
                changesetName, report.getAffectedLayers(), report.getAffectedElementIds()));
        this.report = report;
    }
}
