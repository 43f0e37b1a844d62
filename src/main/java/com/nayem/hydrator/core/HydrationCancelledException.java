package com.nayem.hydrator.core;

/**
 * A field task observed a cancelled or expired {@link HydrationContext}, or was
 * interrupted, before its resolver ran.
 */
public class HydrationCancelledException extends HydrationException {

    public HydrationCancelledException(Class<?> objectType, String fieldName) {
        this(objectType, fieldName, null);
    }

    public HydrationCancelledException(Class<?> objectType, String fieldName, Throwable cause) {
        super("Hydration of " + objectType.getName() + "." + fieldName + " was cancelled", objectType, fieldName,
                cause);
    }
}
