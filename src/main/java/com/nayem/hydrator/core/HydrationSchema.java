package com.nayem.hydrator.core;

import java.util.List;

/**
 * The resolvable fields of one class, built once by reflection and reused for
 * every instance.
 */
public final class HydrationSchema {

    private final Class<?> type;
    private final List<FieldBinding> bindings;

    HydrationSchema(Class<?> type, List<FieldBinding> bindings) {
        this.type = type;
        this.bindings = List.copyOf(bindings);
    }

    public Class<?> getType() {
        return type;
    }

    public List<FieldBinding> getBindings() {
        return bindings;
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }
}
