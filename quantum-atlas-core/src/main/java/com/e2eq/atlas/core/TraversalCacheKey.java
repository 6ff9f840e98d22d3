package com.e2eq.atlas.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.*;

/**
 * Identity of one traversal query: start point plus every policy field that changes the result.
 * <p>
 * Equality is value equality of start id, start type and policy, so node filters compare with
 * the same {@code equals} used when matching nodes ({@code 3} and {@code 3L} are different keys).
 * {@code cacheEnabled} is normalized away since it only decides whether the cache is consulted.
 * </p>
 * <p>
 * {@link #digest()} renders the key as SHA-256 hex over canonical, sorted JSON in which every
 * filter value is tagged with its Java type.
 * </p>
 */
public record TraversalCacheKey(String startId, EntityType startType, TraversalPolicy policy) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public TraversalCacheKey {
        Objects.requireNonNull(policy, "policy");
        if (!policy.cacheEnabled()) {
            policy = policy.toBuilder().cacheEnabled(true).build();
        }
    }

    public static TraversalCacheKey of(String startId, EntityType startType, TraversalPolicy policy) {
        return new TraversalCacheKey(startId, startType, policy);
    }

    public String digest() {
        try {
            String json = MAPPER.writeValueAsString(canonicalize(startId, startType, policy));
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return bytesToHex(md.digest(json.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to compute traversal cache digest for " + startType + ":" + startId, e);
        }
    }

    static Map<String, Object> canonicalize(String startId, EntityType startType, TraversalPolicy policy) {
        Map<String, Object> result = new TreeMap<>();
        result.put("start_id", startId);
        result.put("start_type", startType == null ? null : startType.label());
        result.put("max_depth", policy.maxDepth());
        result.put("included_relationships", relationLabels(policy.includedRelationships()));
        result.put("excluded_relationships", relationLabels(policy.excludedRelationships()));
        result.put("included_entity_types", typeLabels(policy.includedEntityTypes()));
        result.put("excluded_entity_types", typeLabels(policy.excludedEntityTypes()));
        Map<String, Object> filters = new TreeMap<>();
        policy.nodePropertyFilters().forEach((k, v) -> filters.put(k, typed(v)));
        result.put("node_property_filters", filters);
        result.put("follow_bidirectional", policy.followBidirectional());
        result.put("deduplicate_results", policy.deduplicateResults());
        result.put("max_results", policy.maxResults().isPresent() ? policy.maxResults().getAsInt() : null);
        return result;
    }

    /**
     * {@code {type, value}} pair. Collections and maps are tagged element by element; values
     * without a plain JSON form are written as their string form.
     */
    static Map<String, Object> typed(Object value) {
        Map<String, Object> m = new TreeMap<>();
        m.put("type", value == null ? null : value.getClass().getName());
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            m.put("value", value);
        } else if (value instanceof Enum<?> e) {
            m.put("value", e.name());
        } else if (value instanceof Map<?, ?> map) {
            Map<String, Object> entries = new TreeMap<>();
            map.forEach((k, v) -> entries.put(String.valueOf(k), typed(v)));
            m.put("value", entries);
        } else if (value instanceof Collection<?> values) {
            List<Object> items = new ArrayList<>(values.size());
            for (Object v : values) {
                items.add(typed(v));
            }
            m.put("value", items);
        } else {
            m.put("value", String.valueOf(value));
        }
        return m;
    }

    private static List<String> relationLabels(Set<RelationType> relations) {
        List<String> labels = new ArrayList<>(relations.size());
        for (RelationType r : relations) {
            labels.add(r.label());
        }
        Collections.sort(labels);
        return labels;
    }

    private static List<String> typeLabels(Set<EntityType> types) {
        List<String> labels = new ArrayList<>(types.size());
        for (EntityType t : types) {
            labels.add(t.label());
        }
        Collections.sort(labels);
        return labels;
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
