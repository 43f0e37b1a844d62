package com.nayem.hydrator.core;

import java.lang.reflect.Field;

/**
 * How one annotated field of a class is resolved.
 */
public abstract class FieldBinding {

    private final Field field;
    private final FieldKind kind;
    private final String directive;
    private final PropertyAccess.Writer writer;

    FieldBinding(Field field, FieldKind kind, String directive, PropertyAccess.Writer writer) {
        this.field = field;
        this.kind = kind;
        this.directive = directive;
        this.writer = writer;
    }

    public String getName() {
        return field.getName();
    }

    public Class<?> getFieldType() {
        return field.getType();
    }

    public FieldKind getKind() {
        return kind;
    }

    public String getDirective() {
        return directive;
    }

    void write(Object target, Object value) throws ReflectiveOperationException {
        writer.write(target, value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + field.getDeclaringClass().getSimpleName() + "." + getName()
                + " <- " + directive + "]";
    }
}
