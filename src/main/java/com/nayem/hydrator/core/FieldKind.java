package com.nayem.hydrator.core;

import java.util.Collection;
import java.util.Map;

/**
 * Container shape of a hydratable field or of a resolved value.
 */
public enum FieldKind {

    /** A single object reference. */
    REFERENCE,

    /** A {@link Collection}, typically a {@link java.util.List}. */
    SEQUENCE,

    /** An array. */
    ARRAY;

    /**
     * @return the kind of a field declared with {@code type}, or {@code null}
     *         when such a field cannot be hydrated
     */
    public static FieldKind ofType(Class<?> type) {
        if (type.isPrimitive() || Map.class.isAssignableFrom(type)) {
            return null;
        }
        if (type.isArray()) {
            return ARRAY;
        }
        if (Collection.class.isAssignableFrom(type)) {
            return SEQUENCE;
        }
        return REFERENCE;
    }

    public static FieldKind ofValue(Object value) {
        if (value.getClass().isArray()) {
            return ARRAY;
        }
        if (value instanceof Collection) {
            return SEQUENCE;
        }
        return REFERENCE;
    }
}
