package com.e2eq.atlas.explorer;

import com.e2eq.atlas.core.EntityRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Criteria locating an entity within one collection. Every criterion that is set must hold;
 * a match with no criterion set matches nothing.
 */
public record EntityMatch(String id, String tag, String name, String taxonomy) {

    public static EntityMatch byId(String id) {
        return new EntityMatch(id, null, null, null);
    }

    public static EntityMatch byTag(String tag) {
        return new EntityMatch(null, tag, null, null);
    }

    public static EntityMatch byName(String name) {
        return new EntityMatch(null, null, name, null);
    }

    public static EntityMatch of(EntityRecord entity) {
        return byId(entity.id());
    }

    public EntityMatch withTaxonomy(String taxonomy) {
        return new EntityMatch(id, tag, name, taxonomy);
    }

    public boolean isEmpty() {
        return isUnset(id) && isUnset(tag) && isUnset(name) && isUnset(taxonomy);
    }

    public boolean matches(EntityRecord entity) {
        if (entity == null || isEmpty()) {
            return false;
        }
        return test(id, Optional.of(entity.id()))
                && test(tag, entity.stringAttribute(EntityRecord.ATTR_TAG))
                && test(name, entity.name())
                && test(taxonomy, entity.taxonomy());
    }

    private static boolean test(String expected, Optional<String> actual) {
        return isUnset(expected) || actual.map(a -> Objects.equals(a, expected)).orElse(false);
    }

    private static boolean isUnset(String s) {
        return s == null || s.isEmpty();
    }
}
