package com.nayem.hydrator.core;

/**
 * The object handed to {@link Hydrator#hydrate(Object)} is not a hydratable
 * object: {@code null}, a JDK value type, an enum, an array or a collection.
 */
public class InvalidRootException extends HydrationException {

    public InvalidRootException(Object root) {
        super("Cannot hydrate " + (root == null ? "null" : "instance of " + root.getClass().getName()),
                root == null ? null : root.getClass(), null);
    }
}
