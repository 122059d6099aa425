package com.dfdscan.config;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScannerConfigTest {

    @Test
    void loadsClasspathConfig() {
        ScannerConfig config = ScannerConfig.load();
        assertSame(config, ScannerConfig.load());
        assertEquals("threat-patterns.yaml", config.getLibrary().getResource());
        assertEquals(Set.of("http", "ftp", "telnet", "smtp"), config.getValidation().insecureProtocolSet());
        assertEquals("Medium", config.getGenerator().getElementLikelihood());
        assertEquals("High", config.getGenerator().getDataflowLikelihood());
    }

    @Test
    void partialConfigGetsDefaults() {
        ScannerConfig config = ScannerConfig.fromResource("test-scanner-config.yaml");
        assertEquals(Set.of("gopher"), config.getValidation().insecureProtocolSet());
        assertEquals(2, config.getGenerator().getParallelThreads());
        assertEquals("Medium", config.getGenerator().getElementLikelihood());
        assertEquals("threat-patterns.yaml", config.getLibrary().getResource());
        assertEquals("Threat Model Report: ", config.getReport().getTitlePrefix());
    }

    @Test
    void missingResourceFails() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> ScannerConfig.fromResource("no-such-config.yaml"));
        assertTrue(e.getMessage().contains("no-such-config.yaml"));
    }

    @Test
    void defaultsWithoutFile() {
        ScannerConfig config = ScannerConfig.defaults();
        assertEquals(4, config.getGenerator().getParallelThreads());
        assertTrue(config.getValidation().insecureProtocolSet().contains("telnet"));
    }
}
