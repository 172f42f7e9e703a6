package com.tandemsystems.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ChannelConfigTest {

    @Test
    void testDefaults() {
        ChannelConfig config = new ChannelConfig();

        assertEquals(ConcurrencyMode.GUARDED, config.getConcurrencyMode());
        assertEquals(Duration.ofSeconds(1), config.getPollInterval());
        assertTrue(config.isGuarded());
    }

    @Test
    void testFluentSetters() {
        ChannelConfig config = new ChannelConfig()
                .setConcurrencyMode(ConcurrencyMode.UNSYNCHRONIZED)
                .setPollInterval(Duration.ofMillis(5));

        assertEquals(ConcurrencyMode.UNSYNCHRONIZED, config.getConcurrencyMode());
        assertEquals(Duration.ofMillis(5), config.getPollInterval());
        assertFalse(config.isGuarded());
    }

    @Test
    void testRejectsNonPositivePollInterval() {
        ChannelConfig config = new ChannelConfig();

        assertThrows(IllegalArgumentException.class, () -> config.setPollInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> config.setPollInterval(Duration.ofMillis(-1)));
        assertThrows(NullPointerException.class, () -> config.setPollInterval(null));
    }

    @Test
    void testRejectsNullMode() {
        assertThrows(NullPointerException.class, () -> new ChannelConfig().setConcurrencyMode(null));
    }

    @Test
    void testToStringNamesSettings() {
        String text = new ChannelConfig().toString();
        assertTrue(text.contains("GUARDED"), text);
        assertTrue(text.contains("pollInterval"), text);
    }
}
