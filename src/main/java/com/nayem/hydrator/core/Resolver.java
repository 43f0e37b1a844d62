package com.nayem.hydrator.core;

/**
 * Produces the value of a hydrated field from the value of its source
 * property.
 * <p>
 * Resolvers are registered per element type in a {@link ResolverRegistry}.
 * The returned value must have the same container shape as the target field:
 * a single object for a plain reference field, a {@link java.util.List} for a
 * list field, an array for an array field.
 * </p>
 */
@FunctionalInterface
public interface Resolver {

    /**
     * @param context cancellation signal for this hydration
     * @param input   current value of the sibling property named by the
     *                directive, possibly {@code null}
     * @return the resolved value, or {@code null} to leave the field unchanged
     * @throws Exception any failure; it is reported as a
     *                   {@link ResolverException} and the field is left unset
     */
    Object resolve(HydrationContext context, Object input) throws Exception;
}
