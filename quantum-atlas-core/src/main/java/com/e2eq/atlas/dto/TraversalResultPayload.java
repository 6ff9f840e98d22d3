package com.e2eq.atlas.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Plain nested view of a traversal result for consumers across a process or language boundary.
 * Carries ids, type labels and relation labels only; entity data is not embedded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraversalResultPayload(
        List<Node> nodes,
        List<Edge> relationships,
        @JsonProperty("depth_map") Map<Integer, List<String>> depthMap,
        Map<String, Integer> statistics
) {

    public TraversalResultPayload {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        depthMap = depthMap == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(depthMap));
        statistics = statistics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Node(
            @JsonProperty("entity_id") String entityId,
            @JsonProperty("entity_type") String entityType,
            int depth,
            List<String> path,
            @JsonProperty("parent_id") String parentId,
            @JsonProperty("parent_type") String parentType
    ) {
        public Node {
            path = path == null ? List.of() : List.copyOf(path);
        }
    }

    public record Edge(
            @JsonProperty("source_id") String sourceId,
            @JsonProperty("source_type") String sourceType,
            String relation,
            @JsonProperty("target_id") String targetId,
            @JsonProperty("target_type") String targetType
    ) {
    }
}
