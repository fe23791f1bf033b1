package com.glimpse.common.idempotency.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glimpse.common.idempotency.IdempotencyKeyGenerator;
import com.glimpse.common.idempotency.IdempotencyKeyValidator;
import com.glimpse.common.idempotency.IdempotencyProperties;
import com.glimpse.common.idempotency.store.IdempotencyStore;
import com.glimpse.common.idempotency.store.KeyValueIdempotencyStore;
import com.glimpse.common.idempotency.web.IdempotencyFilter;
import com.glimpse.common.redis.KeyValueStore;
import com.glimpse.common.redis.RedisConfig;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.task.TaskExecutionAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.core.Ordered;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executor;

@AutoConfiguration(after = {RedisConfig.class, TaskExecutionAutoConfiguration.class})
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnProperty(prefix = "idempotency", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(IdempotencyProperties.class)
public class IdempotencyAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public IdempotencyKeyValidator idempotencyKeyValidator() {
        return new IdempotencyKeyValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public IdempotencyStore idempotencyStore(KeyValueStore store, IdempotencyProperties props) {
        return new KeyValueIdempotencyStore(store, props.getKeyPrefix());
    }

    @Bean
    public FilterRegistrationBean<IdempotencyFilter> idempotencyFilter(
            IdempotencyStore store,
            IdempotencyKeyValidator validator,
            IdempotencyProperties props,
            ObjectProvider<IdempotencyKeyGenerator> keyGenerator,
            @Qualifier("applicationTaskExecutor") ObjectProvider<Executor> taskExecutor,
            ObjectProvider<ObjectMapper> objectMapper,
            ObjectProvider<Clock> clock) {
        IdempotencyFilter filter = new IdempotencyFilter(
                store,
                validator,
                Optional.ofNullable(keyGenerator.getIfAvailable()),
                props.getRequiredPaths(),
                props.getTtl(),
                taskExecutor.getIfAvailable(() -> Runnable::run),
                objectMapper.getIfAvailable(ObjectMapper::new),
                clock.getIfAvailable(Clock::systemUTC));
        FilterRegistrationBean<IdempotencyFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setName("idempotencyFilter");
        registration.addUrlPatterns("/*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 100);
        return registration;
    }
}
