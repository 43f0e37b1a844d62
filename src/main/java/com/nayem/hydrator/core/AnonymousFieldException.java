package com.nayem.hydrator.core;

/**
 * A directive sits on a static field, which is not a member of the object's
 * own state. Aborts hydration of the whole object.
 */
public class AnonymousFieldException extends HydrationException {

    public AnonymousFieldException(Class<?> objectType, String fieldName) {
        super("Attempted to hydrate static field " + objectType.getName() + "." + fieldName,
                objectType, fieldName);
    }
}
