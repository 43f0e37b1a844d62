package com.nayem.hydrator.spring;

import com.nayem.hydrator.core.HydrationContext;

/**
 * Interface that Spring Beans should implement to resolve fields of a given
 * element type. Every such bean is registered with the auto-configured
 * {@link com.nayem.hydrator.core.ResolverRegistry}.
 *
 * @param <T> The element type produced.
 */
public interface FinderHandler<T> {

    /**
     * The element type this handler resolves, i.e. the type of a plain
     * reference field, or the element type of a list or array field.
     */
    Class<T> getTargetType();

    /**
     * Resolve the field value from the value of the property named by the
     * directive.
     */
    Object find(HydrationContext context, Object input) throws Exception;
}
