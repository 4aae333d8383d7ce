package com.rbparser;

import com.rbparser.ast.Node;
import com.rbparser.ast.Program;
import com.rbparser.format.FormatOptions;
import com.rbparser.format.Formatter;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry points: parse Ruby source into a syntax tree, format it back to
 * source, and dump trees.
 */
public final class SyntaxTree {

    private static final Logger LOG = Logger.getLogger(SyntaxTree.class.getName());

    private static final Pattern MAGIC_ENCODING =
        Pattern.compile("^#.*?\\b(?:en)?coding\\s*[:=]\\s*([\\w.-]+)");

    private SyntaxTree() {
    }

    public static Program parse(String source) {
        long start = System.nanoTime();
        Program program = new Parser(source).parse();
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("parsed %d chars in %.2f ms", source.length(), millisSince(start)));
        }
        return program;
    }

    public static String format(String source) {
        return format(source, FormatOptions.DEFAULT);
    }

    public static String format(String source, FormatOptions options) {
        Program program = parse(source);
        long start = System.nanoTime();
        String formatted = Formatter.format(source, program, options);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(String.format("formatted %d chars in %.2f ms", source.length(), millisSince(start)));
        }
        return formatted;
    }

    /**
     * Reads a source file in the encoding named by its magic comment, on the
     * first line or on the second after a shebang. Defaults to UTF-8.
     */
    public static String read(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        return new String(bytes, detectEncoding(bytes));
    }

    /**
     * The charset named by a magic encoding comment in {@code bytes}, or UTF-8.
     */
    public static Charset detectEncoding(byte[] bytes) {
        String head = new String(bytes, 0, Math.min(bytes.length, 512), StandardCharsets.ISO_8859_1);
        String[] lines = head.split("\n", 3);
        String line = lines[0];
        if (line.startsWith("#!") && lines.length > 1) {
            line = lines[1];
        }
        Matcher matcher = MAGIC_ENCODING.matcher(line);
        if (!matcher.find()) {
            return StandardCharsets.UTF_8;
        }
        String name = matcher.group(1);
        try {
            return Charset.forName(name);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            LOG.fine(() -> "unknown magic encoding " + name + ", reading as UTF-8");
            return StandardCharsets.UTF_8;
        }
    }

    public static String sexp(Node node) {
        return SexpPrinter.print(node);
    }

    private static double millisSince(long start) {
        return (System.nanoTime() - start) / 1_000_000.0;
    }
}
