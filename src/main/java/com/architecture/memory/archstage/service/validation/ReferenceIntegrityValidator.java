package com.architecture.memory.archstage.service.validation;

import com.architecture.memory.archstage.model.Element;
import com.architecture.memory.archstage.model.graph.ElementReference;
import com.architecture.memory.archstage.model.graph.GraphEdge;
import com.architecture.memory.archstage.service.staging.ProjectedModel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Relationship endpoints and cross-layer references must resolve; elements should carry a name.
 */
@Component
public class ReferenceIntegrityValidator implements ModelValidator {

    @Override
    public String getName() {
        return "reference-integrity";
    }

    @Override
    public List<ValidationFinding> validate(ProjectedModel model) {
        List<ValidationFinding> findings = new ArrayList<>();

        for (Element element : model.getElements()) {
            if (element.getName() == null || element.getName().isBlank()) {
                findings.add(finding(Severity.WARNING, element, "Element has no name"));
            }
            if (element.getReferences() == null) {
                continue;
            }
            for (ElementReference ref : element.getReferences()) {
                if (ref.getTarget() == null || !model.hasElement(ref.getTarget())) {
                    findings.add(finding(Severity.ERROR, element,
                            String.format("Reference %s -> %s does not resolve", ref.getType(), ref.getTarget())));
                }
            }
        }

        for (GraphEdge edge : model.getRelationships()) {
            if (!model.hasElement(edge.getSource()) || !model.hasElement(edge.getDestination())) {
                findings.add(ValidationFinding.builder()
                        .severity(Severity.ERROR)
                        .elementId(edge.getSource())
                        .message("Relationship " + edge.describe() + " has a missing endpoint")
                        .build());
            }
        }
        return findings;
    }

    private static ValidationFinding finding(Severity severity, Element element, String message) {
        return ValidationFinding.builder()
                .severity(severity)
                .layer(element.getLayer())
                .elementId(element.getId())
                .message(message)
                .build();
    }
}
