package com.nayem.hydrator.spring;

import com.nayem.hydrator.core.HydrationEngine;
import com.nayem.hydrator.core.ResolverRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

@Configuration
@EnableAspectJAutoProxy
@EnableConfigurationProperties(HydratorProperties.class)
public class HydratorAutoConfiguration {

    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(HydratorAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ResolverRegistry hydratorResolverRegistry(ObjectProvider<FinderHandler<?>> handlers) {
        ResolverRegistry registry = new ResolverRegistry();
        handlers.orderedStream().forEach(handler -> {
            log.debug("Registering {} as resolver for {}", handler.getClass().getName(),
                    handler.getTargetType().getName());
            registry.register(handler.getTargetType(), handler::find);
        });
        return registry;
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public HydrationEngine hydrationEngine(ResolverRegistry registry,
            HydratorProperties properties,
            ObjectProvider<io.micrometer.core.instrument.MeterRegistry> meterRegistryProvider) {
        HydrationEngine.Builder builder = HydrationEngine.builder()
                .registry(registry)
                .concurrencyLimit(properties.getConcurrencyLimit())
                .annotation(properties.getAnnotation())
                .threadNamePrefix(properties.getThreadNamePrefix())
                .schemaCacheSize(properties.getSchemaCacheSize())
                .shutdownTimeout(properties.getShutdownTimeout())
                .metrics(meterRegistryProvider.getIfAvailable());
        if (properties.getMaxThreads() != null) {
            builder.maxThreads(properties.getMaxThreads());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = "hydrator.return-values.enabled", havingValue = "true", matchIfMissing = true)
    public HydratedAspect hydratedAspect(HydrationEngine engine) {
        return new HydratedAspect(engine);
    }
}
