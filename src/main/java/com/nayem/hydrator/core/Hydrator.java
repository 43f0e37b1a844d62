package com.nayem.hydrator.core;

import java.util.concurrent.CompletableFuture;

/**
 * Populates the annotated fields of an object, recursively.
 */
public interface Hydrator {

    /**
     * Hydrates {@code root} with a context that is never cancelled.
     *
     * @throws HydrationException if the root cannot be hydrated or any field
     *                            failed
     */
    default void hydrate(Object root) {
        hydrate(HydrationContext.background(), root);
    }

    /**
     * Hydrates {@code root}, returning once every field and every nested
     * object reachable through resolved values has been processed.
     *
     * @throws InvalidRootException      if {@code root} is not a hydratable
     *                                   object
     * @throws AnonymousFieldException   if a directive sits on a static field
     * @throws UnsupportedFieldKindException if a directive sits on a primitive
     *                                   or map field
     * @throws PrivateFieldException     if a directive sits on a field that
     *                                   cannot be written
     * @throws HydrationFailedException  if one or more fields failed while
     *                                   resolving or applying values
     */
    void hydrate(HydrationContext context, Object root);

    default CompletableFuture<Void> hydrateAsync(Object root) {
        return hydrateAsync(HydrationContext.background(), root);
    }

    /**
     * Asynchronous form of {@link #hydrate(HydrationContext, Object)}. The
     * returned future completes exceptionally with the same exceptions.
     */
    CompletableFuture<Void> hydrateAsync(HydrationContext context, Object root);
}
