package com.nayem.hydrator.core;

import java.util.List;

/**
 * One or more fields of an object failed to hydrate.
 * <p>
 * Every failure observed while applying results is kept, in the order it was
 * observed, and also attached as a suppressed exception. Fields that did not
 * fail are still populated.
 * </p>
 */
public class HydrationFailedException extends HydrationException {

    private final List<HydrationException> errors;

    public HydrationFailedException(Class<?> objectType, List<HydrationException> errors) {
        super(describe(objectType, errors), objectType, null);
        this.errors = List.copyOf(errors);
        for (HydrationException error : this.errors) {
            addSuppressed(error);
        }
    }

    public List<HydrationException> getErrors() {
        return errors;
    }

    private static String describe(Class<?> objectType, List<HydrationException> errors) {
        StringBuilder sb = new StringBuilder()
                .append(errors.size())
                .append(errors.size() == 1 ? " field" : " fields")
                .append(" of ")
                .append(objectType.getName())
                .append(" failed to hydrate");
        for (HydrationException error : errors) {
            sb.append("\n  - ").append(error.getMessage());
        }
        return sb.toString();
    }
}
