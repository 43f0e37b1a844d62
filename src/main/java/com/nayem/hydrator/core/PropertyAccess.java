package com.nayem.hydrator.core;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

/**
 * Reflective readers and writers for bean-style properties.
 * <p>
 * Only public members are used. They are made accessible so that public
 * members of non-public classes can still be reached.
 * </p>
 */
final class PropertyAccess {

    private PropertyAccess() {
    }

    @FunctionalInterface
    interface Reader {
        Object read(Object target) throws ReflectiveOperationException;
    }

    @FunctionalInterface
    interface Writer {
        void write(Object target, Object value) throws ReflectiveOperationException;
    }

    /**
     * @return a writer through the public field itself or its public setter, or
     *         {@code null} when the field cannot be written
     */
    static Writer writer(Field field) {
        int modifiers = field.getModifiers();
        if (Modifier.isFinal(modifiers) || Modifier.isStatic(modifiers)) {
            return null;
        }
        if (Modifier.isPublic(modifiers)) {
            field.trySetAccessible();
            return field::set;
        }
        Method setter = findSetter(field);
        if (setter == null) {
            return null;
        }
        setter.trySetAccessible();
        return (target, value) -> setter.invoke(target, value);
    }

    /**
     * @return a reader for the property {@code name} of {@code type}, through a
     *         public getter or a public field, or {@code null} if neither exists
     */
    static Reader reader(Class<?> type, String name) {
        Method getter = findGetter(type, name);
        if (getter != null) {
            getter.trySetAccessible();
            return target -> getter.invoke(target);
        }
        Field field = findField(type, name);
        if (field != null && Modifier.isPublic(field.getModifiers()) && !Modifier.isStatic(field.getModifiers())) {
            field.trySetAccessible();
            return field::get;
        }
        return null;
    }

    private static Method findSetter(Field field) {
        String name = "set" + capitalize(field.getName());
        for (Method method : field.getDeclaringClass().getMethods()) {
            if (method.getName().equals(name)
                    && method.getParameterCount() == 1
                    && method.getParameterTypes()[0].isAssignableFrom(field.getType())
                    && !Modifier.isStatic(method.getModifiers())) {
                return method;
            }
        }
        return null;
    }

    private static Method findGetter(Class<?> type, String name) {
        String suffix = capitalize(name);
        for (String candidate : new String[] { "get" + suffix, "is" + suffix, name }) {
            for (Method method : type.getMethods()) {
                if (method.getName().equals(candidate)
                        && method.getParameterCount() == 0
                        && method.getReturnType() != void.class
                        && !Modifier.isStatic(method.getModifiers())) {
                    return method;
                }
            }
        }
        return null;
    }

    private static Field findField(Class<?> type, String name) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                if (field.getName().equals(name)) {
                    return field;
                }
            }
        }
        return null;
    }

    private static String capitalize(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
