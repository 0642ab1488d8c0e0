package com.architecture.memory.archstage.repository;

import com.architecture.memory.archstage.model.graph.GraphNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk form of one layer (model/layers/{layer}.yaml).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayerDocument {

    private String layer;

    @Builder.Default
    private List<GraphNode> elements = new ArrayList<>();
}
