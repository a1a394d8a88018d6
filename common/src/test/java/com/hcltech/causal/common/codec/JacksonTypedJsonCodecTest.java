package com.hcltech.causal.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JacksonTypedJsonCodecTest {

    record Pair(String left, int right) {}

    static class BadBean {
        public String getExplode() {
            throw new RuntimeException("boom-write");
        }
    }

    @Test
    void encode_thenDecode_record() {
        Codec<Pair, String> codec = Codec.clazzCodec(Pair.class);
        String json = codec.encode(new Pair("a", 1)).valueOrThrow();
        assertEquals(new Pair("a", 1), codec.decode(json).valueOrThrow());
    }

    @Test
    void decode_blank_isError() {
        Codec<Pair, String> codec = Codec.clazzCodec(Pair.class);
        assertEquals(List.of("Cannot decode Pair from empty JSON"), codec.decode("  ").getErrors());
    }

    @Test
    void decode_malformed_isError() {
        var errors = Codec.clazzCodec(Pair.class).decode("{not json").getErrors();
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).startsWith("Failed to decode Pair from JSON: "));
    }

    @Test
    void encode_failure_isError() {
        var errors = Codec.clazzCodec(BadBean.class).encode(new BadBean()).getErrors();
        assertTrue(errors.get(0).startsWith("Failed to encode BadBean to JSON: "));
    }

    @Test
    void baseMapper_isCopied() {
        ObjectMapper base = new ObjectMapper();
        Codec<Pair, String> codec = Codec.clazzCodec(base, Pair.class);
        base.configure(com.fasterxml.jackson.databind.SerializationFeature.INDENT_OUTPUT, true);
        assertFalse(codec.encode(new Pair("a", 1)).valueOrThrow().contains("\n"));
    }
}
