package com.nayem.hydrator.spring;

import com.nayem.hydrator.core.Hydrate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.lang.annotation.Annotation;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the hydration engine.
 * <p>
 * These properties can be configured in {@code application.yml} under the
 * {@code hydrator} prefix.
 * </p>
 */
@ConfigurationProperties(prefix = "hydrator")
@Validated
public class HydratorProperties {

    /**
     * Maximum number of resolver and directive method calls running at once,
     * shared by every nested hydration of one engine.
     */
    @Min(1)
    private int concurrencyLimit = 10;

    /**
     * Maximum number of worker threads. Defaults to four times the concurrency
     * limit when unset.
     */
    @Min(1)
    private Integer maxThreads;

    /**
     * Field annotation that carries directives. Must be retained at runtime and
     * declare a {@code String value()} element.
     */
    @NotNull
    private Class<? extends Annotation> annotation = Hydrate.class;

    /**
     * Prefix for worker thread names. Useful for monitoring and debugging.
     */
    private String threadNamePrefix = "hydrator-worker-";

    /**
     * Maximum number of classes whose reflective schema is cached.
     */
    @Min(1)
    private long schemaCacheSize = 1024;

    /**
     * Maximum time to wait for running hydration tasks during application
     * shutdown.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    /**
     * Hydration of values returned from {@link Hydrated} methods.
     */
    @Valid
    private ReturnValues returnValues = new ReturnValues();

    public int getConcurrencyLimit() {
        return concurrencyLimit;
    }

    public void setConcurrencyLimit(int concurrencyLimit) {
        this.concurrencyLimit = concurrencyLimit;
    }

    public Integer getMaxThreads() {
        return maxThreads;
    }

    public void setMaxThreads(Integer maxThreads) {
        this.maxThreads = maxThreads;
    }

    public Class<? extends Annotation> getAnnotation() {
        return annotation;
    }

    public void setAnnotation(Class<? extends Annotation> annotation) {
        this.annotation = annotation;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public void setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
    }

    public long getSchemaCacheSize() {
        return schemaCacheSize;
    }

    public void setSchemaCacheSize(long schemaCacheSize) {
        this.schemaCacheSize = schemaCacheSize;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public ReturnValues getReturnValues() {
        return returnValues;
    }

    public void setReturnValues(ReturnValues returnValues) {
        this.returnValues = returnValues;
    }

    /**
     * Configuration for the {@link HydratedAspect}.
     */
    public static class ReturnValues {
        /**
         * Whether values returned from {@link Hydrated} methods are hydrated.
         */
        private boolean enabled = true;

        /** @return whether return value hydration is enabled */
        public boolean isEnabled() {
            return enabled;
        }

        /** @param enabled whether return value hydration is enabled */
        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
