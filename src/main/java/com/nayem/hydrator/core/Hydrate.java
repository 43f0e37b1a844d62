package com.nayem.hydrator.core;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field to be populated by a {@link Hydrator}.
 * <p>
 * The value is a directive, interpreted in this order:
 * </p>
 * <ol>
 * <li>If the declaring object exposes a public method with this name taking
 * {@code (Object)} or {@code (HydrationContext, Object)}, the method is
 * invoked with the whole object as input.</li>
 * <li>Otherwise the value names a sibling property whose current value is
 * passed to the {@link Resolver} registered for the field's element
 * type. Without a registered resolver the field is left alone.</li>
 * </ol>
 * An empty value or {@code "-"} disables hydration for the field.
 *
 * <h3>Usage Example</h3>
 *
 * <pre>
 * public class Order {
 *     private long customerId;
 *
 *     &#64;Hydrate("customerId")
 *     private Customer customer;
 *
 *     &#64;Hydrate("loadLines")
 *     private List&lt;OrderLine&gt; lines;
 *
 *     public Object loadLines(Object self) { ... }
 * }
 * </pre>
 */
@Documented
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Hydrate {

    /**
     * The method name or sibling property name that resolves this field.
     */
    String value();
}
