package com.glimpse.common.redis;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "glimpse.kv")
public class KeyValueStoreProperties {

    public enum Mode { REDIS, MEMORY }

    private Mode mode = Mode.REDIS;

    // used when a caller passes no ttl
    private Duration defaultTtl = Duration.ofMinutes(5);

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }
}
