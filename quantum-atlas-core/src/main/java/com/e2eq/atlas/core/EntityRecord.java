package com.e2eq.atlas.core;

import java.util.*;

/**
 * A typed, identified record of the knowledge graph.
 * <p>
 * The type tag is assigned once when the record is loaded and travels with every
 * reference to the record. Attributes keep their source order; some of them hold
 * relationship targets (a single id or a list of ids), the rest is plain data.
 * </p>
 */
public record EntityRecord(EntityType type, String id, Map<String, Object> attributes) {

    public static final String ATTR_ID = "id";
    public static final String ATTR_NAME = "name";
    public static final String ATTR_TAG = "tag";
    public static final String ATTR_TAXONOMY = "isDefinedByTaxonomy";

    public EntityRecord {
        Objects.requireNonNull(type, "type");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entity id must be provided for type " + type.label());
        }
        attributes = attributes == null ? Map.of() : immutableMap(attributes);
    }

    // null values are legal at every level
    private static Map<String, Object> immutableMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(String.valueOf(k), immutableValue(v)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object immutableValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return immutableMap(map);
        }
        if (value instanceof Set<?> values) {
            Set<Object> copy = new LinkedHashSet<>();
            for (Object v : values) {
                copy.add(immutableValue(v));
            }
            return Collections.unmodifiableSet(copy);
        }
        if (value instanceof Collection<?> values) {
            List<Object> copy = new ArrayList<>(values.size());
            for (Object v : values) {
                copy.add(immutableValue(v));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public static EntityRecord of(EntityType type, String id) {
        return new EntityRecord(type, id, Map.of());
    }

    public NodeKey key() {
        return new NodeKey(type, id);
    }

    /**
     * Raw attribute value. {@code "id"} resolves to the record id.
     *
     * @return the value, or {@code null} when the attribute is absent
     */
    public Object attribute(String name) {
        if (ATTR_ID.equals(name)) {
            return id;
        }
        return attributes.get(name);
    }

    public boolean hasAttribute(String name) {
        return ATTR_ID.equals(name) || attributes.containsKey(name);
    }

    public Optional<String> stringAttribute(String name) {
        Object value = attribute(name);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    public Optional<String> name() {
        return stringAttribute(ATTR_NAME);
    }

    public Optional<String> taxonomy() {
        return stringAttribute(ATTR_TAXONOMY);
    }

    /**
     * Reads a relationship-valued attribute as an ordered list of ids.
     * A single id and a list of ids are both accepted. Numeric and boolean ids are read as
     * their string form, matching how record ids are loaded; missing or empty values and
     * nested structures yield no id.
     */
    public List<String> referenceIds(String name) {
        Object value = attributes.get(name);
        if (value instanceof Collection<?> values) {
            List<String> ids = new ArrayList<>(values.size());
            for (Object v : values) {
                String id = scalarId(v);
                if (id != null) {
                    ids.add(id);
                }
            }
            return ids;
        }
        String id = scalarId(value);
        return id == null ? List.of() : List.of(id);
    }

    private static String scalarId(Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            String id = String.valueOf(value);
            return id.isEmpty() ? null : id;
        }
        return null;
    }

    @Override
    public String toString() {
        return type.label() + ":" + id;
    }
}
