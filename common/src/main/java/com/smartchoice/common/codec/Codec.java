package com.smartchoice.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartchoice.common.errorsor.ErrorsOr;

public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    static <T> Codec<T, String> clazzCodec(ObjectMapper mapper, Class<T> klass) {
        return new JacksonTypedJsonCodec<>(mapper, klass);
    }
}
