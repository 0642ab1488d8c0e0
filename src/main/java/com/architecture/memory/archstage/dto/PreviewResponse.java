package com.architecture.memory.archstage.dto;

import com.architecture.memory.archstage.model.Element;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projected model content: the model as it would be with the changeset applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreviewResponse {
    private String changesetId;
    private String changesetName;
    private int changeCount;

    // Element views per layer, layers in model order
    @Builder.Default
    private Map<String, List<Element>> layers = new LinkedHashMap<>();

    private int elementCount;
    private int relationshipCount;
}
