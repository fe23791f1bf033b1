package com.glimpse.common.redis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class JsonValueCodec {

    private final ObjectMapper om;

    public JsonValueCodec(ObjectMapper base) {
        this.om = base.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public ObjectMapper mapper() {
        return om;
    }

    public String encode(Object value) {
        try {
            return om.writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to encode value type=" + value.getClass().getName(), e);
        }
    }

    /**
     * Returns {@code null} for undecodable input; the caller decides whether to evict the key.
     */
    public <T> T decode(String raw, Class<T> type) {
        if (raw == null) return null;
        try {
            return om.readValue(raw, type);
        } catch (Exception e) {
            return null;
        }
    }
}
