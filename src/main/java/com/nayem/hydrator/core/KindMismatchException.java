package com.nayem.hydrator.core;

/**
 * A resolved value does not fit the field: its container shape differs from
 * the field's, or it is not assignable to the declared type.
 */
public class KindMismatchException extends HydrationException {

    private final Class<?> valueType;

    public KindMismatchException(Class<?> objectType, String fieldName, Class<?> fieldType, Class<?> valueType) {
        super("Attempted to hydrate " + objectType.getName() + "." + fieldName + " (" + fieldType.getName()
                + ") with a " + valueType.getName(), objectType, fieldName);
        this.valueType = valueType;
    }

    public Class<?> getValueType() {
        return valueType;
    }
}
