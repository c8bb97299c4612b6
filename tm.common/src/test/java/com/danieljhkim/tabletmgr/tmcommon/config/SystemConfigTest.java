package com.danieljhkim.tabletmgr.tmcommon.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SystemConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty("tabletmgr.tablet.port");
    }

    @Test
    void load_readsClasspathFileUnderPrefix() {
        SystemConfig config = SystemConfig.load("config-test");

        assertEquals("zone1-0000000042", config.getProperty("tablet.alias"));
        assertEquals(16000, config.getInt("tablet.port", 15000));
        assertEquals(Duration.ofMillis(1500), config.getMillis("tablet.lockTimeoutMs", 30_000));
    }

    @Test
    void missingKeys_fallBackToDefaults() {
        SystemConfig config = SystemConfig.of(new Properties());

        assertEquals(20, config.getInt("health.checkIntervalSeconds", 20));
        assertEquals(Duration.ofSeconds(30), config.getMillis("tablet.lockTimeoutMs", 30_000));
        assertEquals("fallback", config.getProperty("tablet.hostname", "fallback"));
        assertNull(config.getProperty("tablet.hostname"));
    }

    @Test
    void systemProperty_overridesFile() {
        System.setProperty("tabletmgr.tablet.port", "17000");

        SystemConfig config = SystemConfig.load("config-test");

        assertEquals(17000, config.getInt("tablet.port", 15000));
    }

    @Test
    void getInt_rejectsNonNumericValue() {
        SystemConfig config = SystemConfig.load("config-test");

        assertThrows(IllegalArgumentException.class, () -> config.getInt("health.historyLength", 16));
    }

    @Test
    void getAllPropertyNames_filtersByPrefix() {
        Properties props = new Properties();
        props.setProperty("tablet.port", "1");
        props.setProperty("tablet.alias", "a-1");
        props.setProperty("mysql.url", "jdbc:mysql://x");
        SystemConfig config = SystemConfig.of(props);

        assertEquals(2, config.getAllPropertyNames("tablet.").size());
        assertEquals(3, config.getAllPropertyNames().size());
    }
}
