package com.nayem.hydrator.core;

import java.lang.reflect.Field;

/**
 * Resolves a field through the {@link Resolver} registered for its element
 * type, fed with the value of a sibling property.
 * <p>
 * The registry is consulted on every hydration, so resolvers registered after
 * the binding was built are picked up.
 * </p>
 */
public final class FinderBinding extends FieldBinding {

    private final Class<?> elementType;
    private final PropertyAccess.Reader source;

    FinderBinding(Field field, FieldKind kind, String directive, PropertyAccess.Writer writer,
            Class<?> elementType, PropertyAccess.Reader source) {
        super(field, kind, directive, writer);
        this.elementType = elementType;
        this.source = source;
    }

    public Class<?> getElementType() {
        return elementType;
    }

    public String getElementTypeKey() {
        return ResolverRegistry.typeKey(elementType);
    }

    /**
     * @return whether the directive names a readable property
     */
    public boolean hasSource() {
        return source != null;
    }

    Object readSource(Object target) throws ReflectiveOperationException {
        return source.read(target);
    }
}
