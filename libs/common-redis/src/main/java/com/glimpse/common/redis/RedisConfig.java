package com.glimpse.common.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.glimpse.common.redis.cache.ScopedCache;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.time.Clock;

@AutoConfiguration(after = {RedisAutoConfiguration.class, JacksonAutoConfiguration.class})
@ConditionalOnClass({RedisConnectionFactory.class, StringRedisTemplate.class})
@EnableConfigurationProperties(KeyValueStoreProperties.class)
public class RedisConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonValueCodec jsonValueCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new JsonValueCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ScopedCache scopedCache(KeyValueStore store) {
        return new ScopedCache(store);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "glimpse.kv", name = "mode", havingValue = "redis", matchIfMissing = true)
    static class RedisStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
            return new StringRedisTemplate(factory);
        }

        @Bean
        @ConditionalOnMissingBean
        public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory factory) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(factory);
            return container;
        }

        @Bean
        @ConditionalOnMissingBean(KeyValueStore.class)
        public KeyValueStore redisKeyValueStore(StringRedisTemplate redisTemplate,
                                                RedisMessageListenerContainer container,
                                                JsonValueCodec codec,
                                                KeyValueStoreProperties props) {
            return new RedisKeyValueStore(redisTemplate, container, codec, props.getDefaultTtl());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "glimpse.kv", name = "mode", havingValue = "memory")
    static class InMemoryStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(KeyValueStore.class)
        public KeyValueStore inMemoryKeyValueStore(JsonValueCodec codec,
                                                   Clock clock,
                                                   KeyValueStoreProperties props) {
            return new InMemoryKeyValueStore(codec, clock, props.getDefaultTtl());
        }
    }
}
