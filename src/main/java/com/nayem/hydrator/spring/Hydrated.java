package com.nayem.hydrator.spring;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Hydrates the value returned by a Spring bean method before it reaches the
 * caller.
 * <p>
 * A returned object is hydrated directly; each element of a returned
 * collection or array, and the content of a returned {@link java.util.Optional},
 * is hydrated in turn. {@code null} is returned untouched.
 * </p>
 *
 * <pre>
 * &#64;Service
 * public class OrderService {
 *
 *     &#64;Hydrated
 *     public List&lt;Order&gt; recentOrders(long customerId) {
 *         return repository.findRecent(customerId);
 *     }
 * }
 * </pre>
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Hydrated {

    /**
     * Deadline for the whole hydration in milliseconds, signalled to resolvers
     * through the context. Zero means no deadline.
     */
    long timeoutMillis() default 0;
}
