package com.e2eq.atlas.core;

import io.quarkus.logging.Log;

import java.util.*;

/**
 * Per-type id lookup over an {@link EntitySnapshot}. Built once, read-only afterwards.
 * <p>
 * A missing id is not an error: callers treat it as a dangling reference.
 * When a type holds the same id twice, the first record in collection order wins.
 * </p>
 */
public final class EntityIndex {

    private final EntitySnapshot snapshot;
    private final Map<EntityType, Map<String, EntityRecord>> byType;

    private EntityIndex(EntitySnapshot snapshot) {
        this.snapshot = snapshot;
        Map<EntityType, Map<String, EntityRecord>> index = new EnumMap<>(EntityType.class);
        snapshot.collections().forEach((type, records) -> {
            Map<String, EntityRecord> ids = new HashMap<>(Math.max(16, records.size() * 2));
            for (EntityRecord r : records) {
                EntityRecord previous = ids.putIfAbsent(r.id(), r);
                if (previous != null) {
                    Log.warnf("Duplicate %s id '%s' in snapshot; keeping the first record", type.label(), r.id());
                }
            }
            index.put(type, ids);
        });
        this.byType = index;
    }

    public static EntityIndex of(EntitySnapshot snapshot) {
        return new EntityIndex(Objects.requireNonNull(snapshot, "snapshot"));
    }

    public Optional<EntityRecord> lookup(EntityType type, String id) {
        if (type == null || id == null) {
            return Optional.empty();
        }
        Map<String, EntityRecord> ids = byType.get(type);
        return ids == null ? Optional.empty() : Optional.ofNullable(ids.get(id));
    }

    public Optional<EntityRecord> lookup(NodeKey key) {
        return lookup(key.type(), key.id());
    }

    public boolean contains(EntityType type, String id) {
        return lookup(type, id).isPresent();
    }

    /** Records of one type, in snapshot order. */
    public List<EntityRecord> entities(EntityType type) {
        return snapshot.collection(type);
    }

    public EntitySnapshot snapshot() {
        return snapshot;
    }

    /** Number of distinct (type, id) entries. */
    public int size() {
        return byType.values().stream().mapToInt(Map::size).sum();
    }
}
