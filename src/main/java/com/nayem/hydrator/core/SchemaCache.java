package com.nayem.hydrator.core;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.annotation.Annotation;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds {@link HydrationSchema}s by reflection and keeps them per class.
 * <p>
 * Structural problems (a directive on a static field, on a field of an
 * unsupported kind or on a field that cannot be written) surface as exceptions
 * from {@link #get(Class)} and are not cached, so every hydration of such a
 * class fails before any field is dispatched.
 * </p>
 */
class SchemaCache {

    private static final Logger log = LoggerFactory.getLogger(SchemaCache.class);

    private final Class<? extends Annotation> annotation;
    private final Method directiveAccessor;
    private final Cache<Class<?>, HydrationSchema> schemas;

    SchemaCache(Class<? extends Annotation> annotation, long maximumSize) {
        this.annotation = annotation;
        this.directiveAccessor = directiveAccessor(annotation);
        this.schemas = Caffeine.newBuilder()
                .weakKeys()
                .maximumSize(maximumSize)
                .build();
    }

    HydrationSchema get(Class<?> type) {
        return schemas.get(type, this::build);
    }

    long estimatedSize() {
        return schemas.estimatedSize();
    }

    private HydrationSchema build(Class<?> type) {
        List<FieldBinding> bindings = new ArrayList<>();
        for (Field field : fieldsOf(type)) {
            Annotation marker = field.getAnnotation(annotation);
            if (marker == null) {
                continue;
            }
            String directive = directive(marker);
            if (directive == null || directive.isEmpty() || "-".equals(directive)) {
                continue;
            }

            if (Modifier.isStatic(field.getModifiers())) {
                throw new AnonymousFieldException(type, field.getName());
            }
            FieldKind kind = FieldKind.ofType(field.getType());
            if (kind == null) {
                throw new UnsupportedFieldKindException(type, field.getName(), field.getType());
            }
            PropertyAccess.Writer writer = PropertyAccess.writer(field);
            if (writer == null) {
                throw new PrivateFieldException(type, field.getName());
            }

            Method method = directiveMethod(type, directive);
            if (method != null) {
                bindings.add(new MethodBinding(field, kind, directive, writer, method));
            } else {
                bindings.add(new FinderBinding(field, kind, directive, writer,
                        elementType(field, kind), PropertyAccess.reader(type, directive)));
            }
        }

        log.debug("Built hydration schema for {}: {}", type.getName(), bindings);
        return new HydrationSchema(type, bindings);
    }

    private String directive(Annotation marker) {
        try {
            return (String) directiveAccessor.invoke(marker);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot read value() of @" + annotation.getSimpleName(), e);
        }
    }

    /**
     * Superclass fields come first, then each subclass in declaration order.
     */
    private static List<Field> fieldsOf(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                if (!field.isSynthetic()) {
                    fields.add(field);
                }
            }
        }
        return fields;
    }

    /**
     * Finds a public method named {@code name} taking {@code (Object)} or
     * {@code (HydrationContext, Object)} and returning an object. The
     * context-aware form wins when both exist.
     */
    private static Method directiveMethod(Class<?> type, String name) {
        Method plain = null;
        for (Method method : type.getMethods()) {
            if (!method.getName().equals(name)
                    || Modifier.isStatic(method.getModifiers())
                    || method.getReturnType() == void.class
                    || method.getReturnType().isPrimitive()) {
                continue;
            }
            Class<?>[] params = method.getParameterTypes();
            if (params.length == 2 && params[0] == HydrationContext.class && params[1].isAssignableFrom(type)) {
                method.trySetAccessible();
                return method;
            }
            if (params.length == 1 && params[0].isAssignableFrom(type) && plain == null) {
                plain = method;
            }
        }
        if (plain != null) {
            plain.trySetAccessible();
        }
        return plain;
    }

    private static Class<?> elementType(Field field, FieldKind kind) {
        switch (kind) {
            case ARRAY:
                return field.getType().getComponentType();
            case SEQUENCE:
                if (field.getGenericType() instanceof ParameterizedType pt) {
                    return rawClass(pt.getActualTypeArguments()[0]);
                }
                return Object.class;
            default:
                return field.getType();
        }
    }

    private static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> c) {
            return c;
        }
        if (type instanceof ParameterizedType pt) {
            return rawClass(pt.getRawType());
        }
        if (type instanceof WildcardType wt && wt.getUpperBounds().length > 0) {
            return rawClass(wt.getUpperBounds()[0]);
        }
        return Object.class;
    }

    private static Method directiveAccessor(Class<? extends Annotation> annotation) {
        Retention retention = annotation.getAnnotation(Retention.class);
        if (retention == null || retention.value() != RetentionPolicy.RUNTIME) {
            throw new IllegalArgumentException("@" + annotation.getName() + " must be retained at runtime");
        }
        try {
            Method value = annotation.getMethod("value");
            if (value.getReturnType() != String.class) {
                throw new IllegalArgumentException(
                        "@" + annotation.getName() + " must declare a String value() element");
            }
            value.trySetAccessible();
            return value;
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("@" + annotation.getName() + " must declare a String value() element",
                    e);
        }
    }
}
