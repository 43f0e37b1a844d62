package com.nayem.hydrator.core;

/**
 * A resolver or directive method failed. Any value it produced is discarded.
 */
public class ResolverException extends HydrationException {

    public ResolverException(Class<?> objectType, String fieldName, String message, Throwable cause) {
        super("Failed to resolve " + objectType.getName() + "." + fieldName + ": " + message,
                objectType, fieldName, cause);
    }
}
