package com.nayem.hydrator.core;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolver bindings keyed by the fully-qualified name of the element type they
 * produce.
 * <p>
 * Registration and lookup are safe to interleave from any thread. Racing
 * registrations for the same type resolve to whichever write lands last.
 * </p>
 */
public class ResolverRegistry {

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ResolverRegistry.class);

    private final Map<String, Resolver> resolvers = new ConcurrentHashMap<>();

    public void register(Class<?> elementType, Resolver resolver) {
        Objects.requireNonNull(elementType, "elementType");
        Objects.requireNonNull(resolver, "resolver");
        Resolver previous = resolvers.put(typeKey(elementType), resolver);
        if (previous != null) {
            log.debug("Replaced resolver for {}", elementType.getName());
        }
    }

    /**
     * Registers {@code resolver} under the runtime class of {@code sample}.
     */
    public void register(Object sample, Resolver resolver) {
        Objects.requireNonNull(sample, "sample");
        register(sample.getClass(), resolver);
    }

    public Optional<Resolver> lookup(String typeKey) {
        return Optional.ofNullable(resolvers.get(typeKey));
    }

    public Optional<Resolver> lookup(Class<?> elementType) {
        return lookup(typeKey(elementType));
    }

    public boolean unregister(Class<?> elementType) {
        return resolvers.remove(typeKey(elementType)) != null;
    }

    public int size() {
        return resolvers.size();
    }

    static String typeKey(Class<?> type) {
        return type.getName();
    }
}
