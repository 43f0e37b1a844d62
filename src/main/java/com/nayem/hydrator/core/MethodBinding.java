package com.nayem.hydrator.core;

import java.lang.reflect.Field;
import java.lang.reflect.Method;

/**
 * Resolves a field by calling a method of the object being hydrated, passing
 * the object itself as input.
 */
public final class MethodBinding extends FieldBinding {

    private final Method method;
    private final boolean contextAware;

    MethodBinding(Field field, FieldKind kind, String directive, PropertyAccess.Writer writer, Method method) {
        super(field, kind, directive, writer);
        this.method = method;
        this.contextAware = method.getParameterCount() == 2;
    }

    public Method getMethod() {
        return method;
    }

    public boolean isContextAware() {
        return contextAware;
    }

    Object invoke(HydrationContext context, Object target) throws ReflectiveOperationException {
        if (contextAware) {
            return method.invoke(target, context, target);
        }
        return method.invoke(target, target);
    }
}
