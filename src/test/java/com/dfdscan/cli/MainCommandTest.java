package com.dfdscan.cli;

import com.dfdscan.TestDfds;
import com.dfdscan.integration.CICDIntegration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для CLI: коды возврата и артефакты
 */
class MainCommandTest {

    @TempDir
    Path outputDir;

    private ByteArrayOutputStream buffer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        return new CommandLine(new MainCommand(out)).execute(args);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void fullRunWritesAllArtifacts() {
        int code = run(TestDfds.path("ecommerce.json").toString(), "-o", outputDir.toString());

        assertEquals(CICDIntegration.EXIT_OK, code);
        assertTrue(Files.exists(outputDir.resolve("dfd-validation.json")));
        assertTrue(Files.exists(outputDir.resolve("dfd.json")));
        assertTrue(Files.exists(outputDir.resolve("threat-model.json")));
        assertTrue(Files.exists(outputDir.resolve("threat-report.json")));
        assertTrue(output().contains("Total: 25 threats"));
    }

    @Test
    void failOnCriticalReturnsThreatsCode() {
        int code = run(TestDfds.path("http-sensitive.json").toString(), "-o", outputDir.toString(),
            "--fail-on-critical");
        assertEquals(CICDIntegration.EXIT_THREATS, code);
        assertTrue(output().contains("CRITICAL: 9"));
    }

    @Test
    void dedupFlagIsApplied() {
        int code = run(TestDfds.path("http-sensitive.json").toString(), "-o", outputDir.toString(), "--dedup");
        assertEquals(CICDIntegration.EXIT_OK, code);
        assertTrue(output().contains("Total: 12 threats"));
    }

    @Test
    void invalidDfdIsRejectedWithoutThreatModel() {
        int code = run(TestDfds.path("missing-endpoint.json").toString(), "-o", outputDir.toString());

        assertEquals(CICDIntegration.EXIT_INVALID_DFD, code);
        assertTrue(Files.exists(outputDir.resolve("dfd-validation.json")));
        assertFalse(Files.exists(outputDir.resolve("threat-model.json")));
        assertTrue(output().contains("destination element 'ghost' not found"));
    }

    @Test
    void validateOnlySkipsGeneration() {
        int code = run(TestDfds.path("batch-pipeline.yaml").toString(), "-o", outputDir.toString(),
            "--validate-only");

        assertEquals(CICDIntegration.EXIT_OK, code);
        assertTrue(Files.exists(outputDir.resolve("dfd-validation.json")));
        assertFalse(Files.exists(outputDir.resolve("threat-report.json")));
    }

    @Test
    void unreadableDocumentReturnsInvalidCode() {
        assertEquals(CICDIntegration.EXIT_INVALID_DFD,
            run(TestDfds.path("truncated.json").toString(), "-o", outputDir.toString()));
        assertEquals(CICDIntegration.EXIT_INVALID_DFD,
            run(outputDir.resolve("absent.json").toString(), "-o", outputDir.toString()));
    }

    @Test
    void missingPathReturnsInvalidCode() {
        assertEquals(CICDIntegration.EXIT_INVALID_DFD, run());
    }

    @Test
    void libraryInfo() {
        assertEquals(CICDIntegration.EXIT_OK, run("--library-info"));
        assertTrue(output().contains("\"totalPatterns\" : 15"));
        assertTrue(output().contains("OWASP Threat Model Library"));
    }

    @Test
    void patternsForType() {
        assertEquals(CICDIntegration.EXIT_OK, run("--patterns", "database"));
        assertTrue(output().contains("DS01"));
        assertFalse(output().contains("PROC01"));
    }
}
