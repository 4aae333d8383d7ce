package com.rbparser.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class GarnetCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        return GarnetCli.run(args, dir,
            new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private Path file(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void formatsStandardInput() {
        assertEquals(GarnetCli.EXIT_OK, run("x=1\n"));
        assertEquals("x = 1\n", stdout());
    }

    @Test
    void formatsFilesInArgumentOrder() throws IOException {
        Path a = file("a.rb", "a=1\n");
        Path b = file("b.rb", "b  =  2\n");
        assertEquals(GarnetCli.EXIT_OK, run("", "format", a.toString(), b.toString()));
        assertEquals("a = 1\nb = 2\n", stdout());
    }

    @Test
    void checkFailsOnUnformattedFile() throws IOException {
        Path clean = file("clean.rb", "x = 1\n");
        Path dirty = file("dirty.rb", "x=1\n");
        assertEquals(GarnetCli.EXIT_FAILURE, run("", "check", clean.toString(), dirty.toString()));
        assertTrue(stderr().contains("dirty.rb"));
        assertFalse(stderr().contains("clean.rb"));
    }

    @Test
    void checkPassesOnFormattedFile() throws IOException {
        Path clean = file("clean.rb", "x = 1\n");
        assertEquals(GarnetCli.EXIT_OK, run("", "check", clean.toString()));
        assertEquals("", stdout());
    }

    @Test
    void writeRewritesInPlace() throws IOException {
        Path file = file("w.rb", "foo(1,2)\n");
        assertEquals(GarnetCli.EXIT_OK, run("", "write", file.toString()));
        assertEquals("foo(1, 2)\n", Files.readString(file));
    }

    @Test
    void writeKeepsMagicCommentEncoding() throws IOException {
        Path file = dir.resolve("latin.rb");
        Files.write(file, "# encoding: iso-8859-1\nx=\"caf\u00e9\"\n".getBytes(StandardCharsets.ISO_8859_1));
        assertEquals(GarnetCli.EXIT_OK, run("", "write", file.toString()));
        assertArrayEquals("# encoding: iso-8859-1\nx = \"caf\u00e9\"\n".getBytes(StandardCharsets.ISO_8859_1),
            Files.readAllBytes(file));
    }

    @Test
    void writeNeedsFiles() {
        assertEquals(GarnetCli.EXIT_USAGE, run("x = 1\n", "write"));
    }

    @Test
    void parseErrorFailsThatFileOnly() throws IOException {
        Path broken = file("broken.rb", "def\n");
        Path fine = file("fine.rb", "y=2\n");
        assertEquals(GarnetCli.EXIT_FAILURE, run("", broken.toString(), fine.toString()));
        assertEquals("y = 2\n", stdout());
        assertTrue(stderr().contains("broken.rb"));
    }

    @Test
    void missingFileFails() {
        assertEquals(GarnetCli.EXIT_FAILURE, run("", dir.resolve("nope.rb").toString()));
        assertTrue(stderr().contains("nope.rb"));
    }

    @Test
    void astPrintsSexp() {
        assertEquals(GarnetCli.EXIT_OK, run("x = 1", "ast"));
        assertEquals("(program (statements ((assign (var_field (ident \"x\")) (int \"1\")))))\n", stdout());
    }

    @Test
    void jsonPrintsTree() {
        assertEquals(GarnetCli.EXIT_OK, run("x = 1", "json"));
        assertTrue(stdout().contains("\"type\" : \"program\""));
    }

    @Test
    void debugAcceptsStableOutput() {
        assertEquals(GarnetCli.EXIT_OK, run("def foo\n  bar\nend\n", "debug"));
    }

    @Test
    void unknownOptionIsUsageError() {
        assertEquals(GarnetCli.EXIT_USAGE, run("", "--frobnicate"));
        assertTrue(stderr().contains("Unknown option: --frobnicate"));
    }

    @Test
    void helpPrintsUsage() {
        assertEquals(GarnetCli.EXIT_OK, run("", "--help"));
        assertTrue(stdout().startsWith("Usage: garnet"));
    }

    @Test
    void quoteOptionApplies() {
        assertEquals(GarnetCli.EXIT_OK, run("x = \"a\"\n", "--quote=single"));
        assertEquals("x = 'a'\n", stdout());
    }

    @Test
    void rcFileOptionsComeFirst() throws IOException {
        file(GarnetCli.RC_FILE, "# defaults\n--print-width=10\n\n");
        assertEquals(GarnetCli.EXIT_OK, run("foo(aaaa, bbbb)\n"));
        assertEquals("foo(\n  aaaa,\n  bbbb\n)\n", stdout());
    }

    @Test
    void configParsing() {
        GarnetCli.Config config = GarnetCli.Config.parse(
            new String[] {"check", "--print-width=100", "--trailing-comma", "--threads=2", "a.rb", "check"});
        assertEquals(GarnetCli.Command.CHECK, config.command());
        assertEquals(100, config.options().printWidth());
        assertTrue(config.options().trailingComma());
        assertEquals(2, config.threads());
        assertEquals(2, config.files().size());
        assertEquals(Path.of("check"), config.files().get(1));
    }

    @Test
    void badNumbersAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> GarnetCli.Config.parse(new String[] {"--print-width=wide"}));
        assertThrows(IllegalArgumentException.class,
            () -> GarnetCli.Config.parse(new String[] {"--threads=0"}));
    }
}
