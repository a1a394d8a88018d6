package com.hcltech.causal.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IEnvGetterTest {

    static IEnvGetter env(Map<String, String> kv) {
        Map<String, String> copy = new HashMap<>(kv);
        return copy::get;
    }

    @Nested
    @DisplayName("getIntOr")
    class GetIntOr {
        @Test
        void parsesTrimmedValue() {
            assertEquals(7, IEnvGetter.getIntOr(env(Map.of("N", " 7 ")), "N", 1));
        }

        @Test
        void defaultsWhenMissingOrBlank() {
            assertEquals(1, IEnvGetter.getIntOr(env(Map.of()), "N", 1));
            assertEquals(1, IEnvGetter.getIntOr(env(Map.of("N", "  ")), "N", 1));
        }

        @Test
        void throwsOnGarbage() {
            var ex = assertThrows(IllegalStateException.class, () -> IEnvGetter.getIntOr(env(Map.of("N", "seven")), "N", 1));
            assertTrue(ex.getMessage().contains("N"));
        }
    }
}
