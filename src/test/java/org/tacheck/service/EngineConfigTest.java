package org.tacheck.service;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class EngineConfigTest {

    private static final String[] KEYS = {
            "tacheck.maxStates", "tacheck.timeoutMillis", "tacheck.workerThreads",
            "tacheck.concretizeWitnesses", "tacheck.reduceClocks"
    };

    @AfterEach
    void clearProperties() {
        for (String key : KEYS) {
            System.clearProperty(key);
        }
    }

    @Test
    @DisplayName("未设置系统属性时取默认值")
    void testFromSystemProperties_WhenUnset_ShouldUseDefaults() {
        EngineConfig config = EngineConfig.fromSystemProperties();

        assertAll(
                () -> assertEquals(1_000_000, config.getMaxStates()),
                () -> assertEquals(0L, config.getTimeoutMillis()),
                () -> assertTrue(config.isConcretizeWitnesses()),
                () -> assertTrue(config.isReduceClocks()),
                () -> assertTrue(config.getWorkerThreads() > 0)
        );
    }

    @Test
    @DisplayName("读取 tacheck.* 系统属性")
    void testFromSystemProperties_ShouldReadProperties() {
        System.setProperty("tacheck.maxStates", " 500 ");
        System.setProperty("tacheck.timeoutMillis", "2000");
        System.setProperty("tacheck.workerThreads", "3");
        System.setProperty("tacheck.concretizeWitnesses", "false");
        System.setProperty("tacheck.reduceClocks", "false");

        EngineConfig config = EngineConfig.fromSystemProperties();

        assertAll(
                () -> assertEquals(500, config.getMaxStates()),
                () -> assertEquals(2000L, config.getTimeoutMillis()),
                () -> assertEquals(3, config.getWorkerThreads()),
                () -> assertFalse(config.isConcretizeWitnesses()),
                () -> assertFalse(config.isReduceClocks()),
                () -> assertEquals(500, config.newLimits().getMaxStates())
        );
    }

    @Test
    @DisplayName("不是数字的属性值")
    void testFromSystemProperties_WhenNotNumber_ShouldThrow() {
        System.setProperty("tacheck.maxStates", "many");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, EngineConfig::fromSystemProperties);
        assertTrue(e.getMessage().contains("tacheck.maxStates"));
    }
}
