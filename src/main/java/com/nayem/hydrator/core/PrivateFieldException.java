package com.nayem.hydrator.core;

/**
 * A hydrated field cannot be written: it is final, or neither public nor
 * exposed through a public setter.
 */
public class PrivateFieldException extends HydrationException {

    public PrivateFieldException(Class<?> objectType, String fieldName) {
        this(objectType, fieldName, null);
    }

    public PrivateFieldException(Class<?> objectType, String fieldName, Throwable cause) {
        super("Attempted to hydrate a private field " + objectType.getName() + "." + fieldName,
                objectType, fieldName, cause);
    }
}
