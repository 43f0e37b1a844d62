package com.nayem.hydrator.core;

/**
 * Hydrating a resolved value failed. The path names the field, suffixed with
 * {@code [i]} for an element of a list or array.
 */
public class NestedHydrationException extends HydrationException {

    private final String path;

    public NestedHydrationException(Class<?> objectType, String fieldName, String path, HydrationException cause) {
        super("Nested hydration of " + objectType.getName() + "." + path + " failed: " + cause.getMessage(),
                objectType, fieldName, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
