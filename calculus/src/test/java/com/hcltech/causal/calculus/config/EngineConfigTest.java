package com.hcltech.causal.calculus.config;

import com.hcltech.causal.common.IEnvGetter;
import com.hcltech.causal.graph.PathFinder;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    private static IEnvGetter env(Map<String, String> kv) {
        return kv::get;
    }

    @Test
    void defaults() {
        EngineConfig c = EngineConfig.defaults();
        assertEquals(0, c.maxPathLength());
        assertEquals(5, c.maxAdjustmentSetSize());
        assertEquals(5, c.maxSeparatorSize());
        assertEquals(3, c.maxConditioningSetSize());
        assertEquals(PathFinder.UNBOUNDED, c.pathLimit());
    }

    @Test
    void fromEnv_overridesWhatIsSet() {
        EngineConfig c = EngineConfig.fromEnv(env(Map.of(
                EngineConfig.MAX_PATH_LENGTH_ENV, "8",
                EngineConfig.MAX_ADJUSTMENT_SET_SIZE_ENV, "2")));
        assertEquals(new EngineConfig(8, 2, 5, 3), c);
        assertEquals(8, c.pathLimit());
    }

    @Test
    void fromEnv_emptyEnvironment_isDefaults() {
        assertEquals(EngineConfig.defaults(), EngineConfig.fromEnv(env(Map.of())));
    }

    @Test
    void fromEnv_rejectsGarbage() {
        assertThrows(IllegalStateException.class,
                () -> EngineConfig.fromEnv(env(Map.of(EngineConfig.MAX_SEPARATOR_SIZE_ENV, "lots"))));
    }

    @Test
    void rejectsNegativeLimits() {
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(-1, 5, 5, 3));
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(0, -1, 5, 3));
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromEnv(env(Map.of(EngineConfig.MAX_CONDITIONING_SET_SIZE_ENV, "-2"))));
    }
}
