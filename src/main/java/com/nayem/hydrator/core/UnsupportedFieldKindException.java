package com.nayem.hydrator.core;

/**
 * A directive sits on a field that is neither a plain reference, a collection
 * nor an array. Aborts hydration of the whole object.
 */
public class UnsupportedFieldKindException extends HydrationException {

    public UnsupportedFieldKindException(Class<?> objectType, String fieldName, Class<?> fieldType) {
        super("Attempted to hydrate " + fieldType.getName() + " field " + objectType.getName() + "." + fieldName,
                objectType, fieldName);
    }
}
