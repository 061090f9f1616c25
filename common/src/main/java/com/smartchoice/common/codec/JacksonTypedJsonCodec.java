package com.smartchoice.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartchoice.common.errorsor.ErrorsOr;

import java.util.Objects;

/** JSON codec for one target type; works on a private copy of the supplied mapper. */
public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper;
    private final Class<T> klass;

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, Class<T> klass) {
        this.mapper = Objects.requireNonNull(baseMapper).copy();
        this.klass = Objects.requireNonNull(klass);
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        try {
            return ErrorsOr.lift(mapper.writeValueAsString(value));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode to JSON: " + e.getMessage());
        }
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        try {
            return ErrorsOr.lift(mapper.readValue(json, klass));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode from JSON: " + e.getMessage());
        }
    }
}
