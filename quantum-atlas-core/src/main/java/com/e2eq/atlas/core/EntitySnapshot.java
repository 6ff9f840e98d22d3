package com.e2eq.atlas.core;

import java.util.*;

/**
 * Read-only, already merged view of the loaded graph: for each entity type the ordered
 * collection of its records.
 */
public record EntitySnapshot(Map<EntityType, List<EntityRecord>> collections) {

    public EntitySnapshot {
        Map<EntityType, List<EntityRecord>> copy = new EnumMap<>(EntityType.class);
        if (collections != null) {
            collections.forEach((type, records) -> {
                List<EntityRecord> list = records == null ? List.of() : List.copyOf(records);
                for (EntityRecord r : list) {
                    if (r.type() != type) {
                        throw new IllegalArgumentException("Record " + r + " filed under collection of type " + type.label());
                    }
                }
                copy.put(type, list);
            });
        }
        collections = Collections.unmodifiableMap(copy);
    }

    public static EntitySnapshot empty() {
        return new EntitySnapshot(Map.of());
    }

    public List<EntityRecord> collection(EntityType type) {
        return collections.getOrDefault(type, List.of());
    }

    public int size() {
        return collections.values().stream().mapToInt(List::size).sum();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<EntityType, List<EntityRecord>> collections = new EnumMap<>(EntityType.class);

        private Builder() {}

        public Builder add(EntityRecord record) {
            collections.computeIfAbsent(record.type(), k -> new ArrayList<>()).add(record);
            return this;
        }

        public Builder add(EntityType type, String id, Map<String, Object> attributes) {
            return add(new EntityRecord(type, id, attributes));
        }

        public Builder addAll(Collection<EntityRecord> records) {
            records.forEach(this::add);
            return this;
        }

        public EntitySnapshot build() {
            return new EntitySnapshot(collections);
        }
    }
}
