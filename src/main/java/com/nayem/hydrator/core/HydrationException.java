package com.nayem.hydrator.core;

/**
 * Base type of every failure raised while hydrating an object.
 * <p>
 * Carries the type of the object being hydrated and, where the failure is tied
 * to a single field, that field's name.
 * </p>
 */
public class HydrationException extends RuntimeException {

    private final Class<?> objectType;
    private final String fieldName;

    public HydrationException(String message, Class<?> objectType, String fieldName) {
        this(message, objectType, fieldName, null);
    }

    public HydrationException(String message, Class<?> objectType, String fieldName, Throwable cause) {
        super(message, cause);
        this.objectType = objectType;
        this.fieldName = fieldName;
    }

    /**
     * @return the type of the object being hydrated, or {@code null} when the
     *         root itself was unusable
     */
    public Class<?> getObjectType() {
        return objectType;
    }

    /**
     * @return the field the failure relates to, or {@code null} for
     *         object-level failures
     */
    public String getFieldName() {
        return fieldName;
    }
}
