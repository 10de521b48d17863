package com.grc.riskengine.dedup;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.nio.charset.StandardCharsets;

/**
 * Serializes {@link DedupeRecord} to/from JSON for Redis, without type metadata.
 */
public class DedupeRecordRedisSerializer implements RedisSerializer<DedupeRecord> {

    private final ObjectMapper mapper;

    public DedupeRecordRedisSerializer() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] serialize(DedupeRecord value) throws SerializationException {
        if (value == null) return null;
        try {
            return mapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8);
        } catch (Exception e) {
            throw new SerializationException("Could not serialize DedupeRecord", e);
        }
    }

    @Override
    public DedupeRecord deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) return null;
        try {
            return mapper.readValue(new String(bytes, StandardCharsets.UTF_8), DedupeRecord.class);
        } catch (Exception e) {
            throw new SerializationException("Could not deserialize DedupeRecord", e);
        }
    }
}
