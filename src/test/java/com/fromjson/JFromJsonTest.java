package com.fromjson;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class JFromJsonTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    private int run(String stdin, String... args) {
        JFromJson app = new JFromJson();
        app.setStdin(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));

        CommandLine cmd = new CommandLine(app);
        out = new StringWriter();
        err = new StringWriter();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private List<String> outLines() {
        return out.toString().lines().collect(Collectors.toList());
    }

    @Test
    public void testCompressedObjectFromStdin() {
        int exitCode = run("{\"b\":1,\"a\":[1,2]}", "-c");

        assertEquals(0, exitCode);
        assertEquals(List.of("{\"b\":1,\"a\":[1,2]}"), outLines());
    }

    @Test
    public void testTopLevelArrayPrintsOneItemPerLine() {
        int exitCode = run("[1, null, \"x\"]", "--compress");

        assertEquals(0, exitCode);
        assertEquals(List.of("1", "null", "\"x\""), outLines());
    }

    @Test
    public void testNoEnumerateKeepsArray() {
        int exitCode = run("[1,2]", "-c", "--no-enumerate");

        assertEquals(0, exitCode);
        assertEquals(List.of("[1,2]"), outLines());
    }

    @Test
    public void testPrettyOutputIsDefault() {
        int exitCode = run("{\"a\":1}", "--as-hashtable");

        assertEquals(0, exitCode);
        assertEquals(List.of("{", "  \"a\": 1", "}"), outLines());
    }

    @Test
    public void testMultiLineDocumentFromFile() throws IOException {
        Path file = tempDir.resolve("doc.json");
        Files.writeString(file, "{\n  \"$id\": \"1\",\n  \"values\": [\n    1.5,\n    2\n  ]\n}\n");

        int exitCode = run("", "-c", file.toString());

        assertEquals(0, exitCode);
        assertEquals(List.of("{\"$id\":\"1\",\"values\":[1.5,2]}"), outLines());
    }

    @Test
    public void testJsonLinesFromFiles() throws IOException {
        Path first = tempDir.resolve("a.jsonl");
        Path second = tempDir.resolve("b.jsonl");
        Files.writeString(first, "{\"n\":1}\n{\"n\":2}\n");
        Files.writeString(second, "{\"n\":3}\n");

        int exitCode = run("", "-c", first.toString(), second.toString());

        assertEquals(0, exitCode);
        assertEquals(List.of("{\"n\":1}", "{\"n\":2}", "{\"n\":3}"), outLines());
    }

    @Test
    public void testMalformedInputExitCode() {
        int exitCode = run("{\"a\":", "-c");

        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("Error: "));
        assertTrue(out.toString().isEmpty());
    }

    @Test
    public void testDepthExceededExitCode() {
        int exitCode = run("[[[1]]]", "-c", "--depth", "2");

        assertEquals(3, exitCode);
        assertTrue(err.toString().contains("maximum depth"));
        assertTrue(out.toString().isEmpty());
    }

    @Test
    public void testDepthAtLimitSucceeds() {
        int exitCode = run("[[[1]]]", "-c", "-d", "3");

        assertEquals(0, exitCode);
        assertEquals(List.of("[[1]]"), outLines());
    }

    @Test
    public void testInvalidDepthExitCode() {
        int exitCode = run("1", "--depth", "0");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Depth must be between 1 and 2048"));
    }

    @Test
    public void testMissingFileExitCode() {
        int exitCode = run("", tempDir.resolve("missing.json").toString());

        assertEquals(JFromJson.EXIT_IO_ERROR, exitCode);
        assertTrue(err.toString().startsWith("Error: "));
    }

    @Test
    public void testEmptyInputPrintsNothing() {
        int exitCode = run("");

        assertEquals(0, exitCode);
        assertTrue(out.toString().isEmpty());
    }

    @Test
    public void testHelp() {
        int exitCode = run("", "--help");

        assertEquals(0, exitCode);
        assertTrue(out.toString().contains("--no-enumerate"));
        assertTrue(out.toString().contains("--as-hashtable"));
    }
}
