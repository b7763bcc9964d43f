package io.github.sparkrew.varhistory.flow_slicer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the command line.
 */
class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void testSliceCommandWritesFlowAndStats() throws IOException {
        Path trace = tempDir.resolve("trace.json");
        Files.writeString(trace, TraceReaderTest.FRAMES_TRACE);
        Path output = tempDir.resolve("out.json");
        Path stats = tempDir.resolve("stats.json");

        int exitCode = new CommandLine(new Main.CLIEntryPoint()).execute(
                "slice", "--trace", trace.toString(), "--output", output.toString(), "--stats", stats.toString());

        assertEquals(0, exitCode);
        JsonNode nodes = new ObjectMapper().readTree(output.toFile());
        assertEquals(3, nodes.size());
        assertTrue(Files.exists(stats));
    }

    @Test
    void testMissingTraceFails() {
        int exitCode = new CommandLine(new Main.CLIEntryPoint()).execute(
                "slice", "--trace", tempDir.resolve("missing.json").toString(),
                "--output", tempDir.resolve("out.json").toString());

        assertEquals(1, exitCode);
    }

    @Test
    void testInconsistentTraceFails() throws IOException {
        Path trace = tempDir.resolve("trace.json");
        Files.writeString(trace, """
                {"frames": {"0": [{"kind": "LINE", "statement": "int a = 1;", "vars": {}}]}}
                """);

        int exitCode = new CommandLine(new Main.CLIEntryPoint()).execute(
                "slice", "--trace", trace.toString(), "--output", tempDir.resolve("out.json").toString());

        assertEquals(2, exitCode);
    }

    @Test
    void testMissingSourceRootFails() throws IOException {
        Path trace = tempDir.resolve("trace.json");
        Files.writeString(trace, TraceReaderTest.FRAMES_TRACE);

        int exitCode = new CommandLine(new Main.CLIEntryPoint()).execute(
                "slice", "--trace", trace.toString(), "--output", tempDir.resolve("out.json").toString(),
                "--source-root", tempDir.resolve("no-such-dir").toString());

        assertEquals(1, exitCode);
        assertFalse(Files.exists(tempDir.resolve("out.json")));
    }

    @Test
    void testUnwritableStatsFileFails() throws IOException {
        Path trace = tempDir.resolve("trace.json");
        Files.writeString(trace, TraceReaderTest.FRAMES_TRACE);

        int exitCode = new CommandLine(new Main.CLIEntryPoint()).execute(
                "slice", "--trace", trace.toString(), "--output", tempDir.resolve("out.json").toString(),
                "--stats", tempDir.resolve("missing").resolve("stats.json").toString());

        assertEquals(1, exitCode);
    }

    @Test
    void testTraceOptionIsRequired() {
        int exitCode = new CommandLine(new Main.CLIEntryPoint()).execute("slice");

        assertNotEquals(0, exitCode);
    }
}
