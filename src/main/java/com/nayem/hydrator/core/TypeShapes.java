package com.nayem.hydrator.core;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

public final class TypeShapes {

    private TypeShapes() {
    }

    /**
     * Whether instances of {@code type} are application objects that may carry
     * directives. JDK types, enums, arrays and containers never do.
     */
    public static boolean isRecordLike(Class<?> type) {
        if (type.isPrimitive() || type.isArray() || type.isAnnotation() || Enum.class.isAssignableFrom(type)) {
            return false;
        }
        if (Collection.class.isAssignableFrom(type) || Map.class.isAssignableFrom(type)
                || Optional.class.equals(type)) {
            return false;
        }
        String name = type.getName();
        return !(name.startsWith("java.") || name.startsWith("javax.") || name.startsWith("jdk.")
                || name.startsWith("sun."));
    }
}
