package com.nayem.hydrator.core;

/**
 * Outcome of one dispatched field: either a value (possibly {@code null}) or
 * an error.
 */
record FieldResolution(FieldBinding binding, Object value, HydrationException error) {

    static FieldResolution success(FieldBinding binding, Object value) {
        return new FieldResolution(binding, value, null);
    }

    static FieldResolution failure(FieldBinding binding, HydrationException error) {
        return new FieldResolution(binding, null, error);
    }

    boolean failed() {
        return error != null;
    }
}
