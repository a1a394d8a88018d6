package com.hcltech.causal.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.causal.common.errorsor.ErrorsOr;

import java.util.Objects;

/** JSON codec for a single concrete type. The base mapper is copied, so callers may keep configuring theirs. */
public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper;
    private final Class<T> klass;

    public JacksonTypedJsonCodec(Class<T> klass) {
        this(new ObjectMapper(), klass);
    }

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, Class<T> klass) {
        this.mapper = Objects.requireNonNull(baseMapper).copy();
        this.mapper.findAndRegisterModules();
        this.klass = Objects.requireNonNull(klass);
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        try {
            return ErrorsOr.lift(mapper.writeValueAsString(value));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode " + klass.getSimpleName() + " to JSON: " + e.getMessage());
        }
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        if (json == null || json.isBlank()) return ErrorsOr.error("Cannot decode " + klass.getSimpleName() + " from empty JSON");
        try {
            return ErrorsOr.lift(mapper.readValue(json, klass));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode " + klass.getSimpleName() + " from JSON: " + e.getMessage());
        }
    }
}
