package com.hcltech.causal.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.causal.common.errorsor.ErrorsOr;

public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    static <T> Codec<T, String> clazzCodec(Class<T> klass) {
        return new JacksonTypedJsonCodec<>(klass);
    }

    static <T> Codec<T, String> clazzCodec(ObjectMapper baseMapper, Class<T> klass) {
        return new JacksonTypedJsonCodec<>(baseMapper, klass);
    }
}
