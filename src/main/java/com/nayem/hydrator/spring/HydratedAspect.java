package com.nayem.hydrator.spring;

import com.nayem.hydrator.core.HydrationContext;
import com.nayem.hydrator.core.Hydrator;
import com.nayem.hydrator.core.TypeShapes;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

@Aspect
public class HydratedAspect {

    private final Hydrator hydrator;

    public HydratedAspect(Hydrator hydrator) {
        this.hydrator = hydrator;
    }

    @Around(value = "@annotation(hydrated)", argNames = "joinPoint,hydrated")
    public Object hydrateResult(ProceedingJoinPoint joinPoint, Hydrated hydrated) throws Throwable {
        Object result = joinPoint.proceed();
        if (result == null) {
            return null;
        }

        HydrationContext context = hydrated.timeoutMillis() > 0
                ? HydrationContext.cancellable().withTimeout(Duration.ofMillis(hydrated.timeoutMillis()))
                : HydrationContext.background();
        hydrateValue(context, result);
        return result;
    }

    private void hydrateValue(HydrationContext context, Object value) {
        if (value instanceof Optional<?> optional) {
            optional.ifPresent(v -> hydrateValue(context, v));
        } else if (value instanceof Collection<?> collection) {
            collection.forEach(element -> hydrateObject(context, element));
        } else if (value instanceof Object[] array) {
            for (Object element : array) {
                hydrateObject(context, element);
            }
        } else {
            hydrateObject(context, value);
        }
    }

    // Scalars and JDK values carry no directives.
    private void hydrateObject(HydrationContext context, Object value) {
        if (value != null && TypeShapes.isRecordLike(value.getClass())) {
            hydrator.hydrate(context, value);
        }
    }
}
