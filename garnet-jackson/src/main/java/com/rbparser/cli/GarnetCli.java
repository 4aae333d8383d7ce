package com.rbparser.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rbparser.ParseException;
import com.rbparser.SyntaxTree;
import com.rbparser.ast.Program;
import com.rbparser.format.FormatOptions;
import com.rbparser.jackson.GarnetJackson;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line client for the formatter.
 *
 * Usage:
 *   garnet [command] [options] [files...]
 *
 * Commands:
 *   format    Print the formatted source (default)
 *   check     Exit with 1 when a file is not already formatted
 *   write     Rewrite files in place
 *   ast       Print the syntax tree as an S-expression
 *   json      Print the syntax tree as JSON
 *   debug     Check that formatting the output again changes nothing
 *
 * Options are also read from a .garnetrc file in the working directory, one per
 * line, ahead of the command line ones. Without files the source is read from
 * standard input. Files are processed in parallel; results print in argument
 * order.
 */
public class GarnetCli {

    private static final Logger LOG = Logger.getLogger(GarnetCli.class.getName());

    public static final String RC_FILE = ".garnetrc";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final ObjectMapper mapper = GarnetJackson.createObjectMapper();

    private final Config config;
    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        System.exit(run(args, Path.of(""), System.in, System.out, System.err));
    }

    /**
     * Runs one invocation and returns its exit code. {@code workingDir} is where
     * the rc file is looked up.
     */
    public static int run(String[] args, Path workingDir, InputStream in, PrintStream out, PrintStream err) {
        Config config;
        try {
            config = Config.parse(withRcFile(args, workingDir.resolve(RC_FILE)));
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("Error: cannot read " + RC_FILE + ": " + e.getMessage());
            return EXIT_USAGE;
        }
        if (config == null) {
            printUsage(out);
            return EXIT_OK;
        }

        GarnetCli cli = new GarnetCli(config, out, err);
        if (config.files.isEmpty()) {
            return cli.runStandardInput(in);
        }
        return cli.runFiles();
    }

    public GarnetCli(Config config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    static String[] withRcFile(String[] args, Path rcFile) throws IOException {
        if (!Files.isRegularFile(rcFile)) {
            return args;
        }
        List<String> combined = new ArrayList<>();
        for (String line : Files.readAllLines(rcFile, StandardCharsets.UTF_8)) {
            String option = line.strip();
            if (!option.isEmpty() && !option.startsWith("#")) {
                combined.add(option);
            }
        }
        combined.addAll(List.of(args));
        return combined.toArray(new String[0]);
    }

    private int runStandardInput(InputStream in) {
        if (config.command == Command.WRITE) {
            err.println("Error: write needs files");
            return EXIT_USAGE;
        }
        byte[] bytes;
        try {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            err.println("Error: cannot read standard input: " + e.getMessage());
            return EXIT_FAILURE;
        }
        Charset encoding = SyntaxTree.detectEncoding(bytes);
        Result result = process("-", new String(bytes, encoding), null, encoding);
        report(result);
        return result.failed() ? EXIT_FAILURE : EXIT_OK;
    }

    private int runFiles() {
        ExecutorService executor = Executors.newFixedThreadPool(config.threads);
        try {
            List<Future<Result>> futures = new ArrayList<>();
            for (Path file : config.files) {
                futures.add(executor.submit(() -> processFile(file)));
            }

            boolean failed = false;
            for (int i = 0; i < futures.size(); i++) {
                Result result;
                try {
                    result = futures.get(i).get();
                } catch (ExecutionException e) {
                    result = Result.failure(config.files.get(i).toString(), e.getCause().toString());
                    LOG.log(Level.WARNING, "Unexpected failure on " + config.files.get(i), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return EXIT_FAILURE;
                }
                report(result);
                failed |= result.failed();
            }
            return failed ? EXIT_FAILURE : EXIT_OK;
        } finally {
            executor.shutdown();
            try {
                executor.awaitTermination(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private Result processFile(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            LOG.warning(() -> "Cannot read " + file + ": " + e.getMessage());
            return Result.failure(file.toString(), "cannot read file: " + e.getMessage());
        }
        Charset encoding = SyntaxTree.detectEncoding(bytes);
        return process(file.toString(), new String(bytes, encoding), file, encoding);
    }

    /**
     * Runs the command on one source. Parse errors become failed results; every
     * other exception propagates. {@code write} saves in the charset the source
     * was read with.
     */
    Result process(String name, String source, Path file, Charset encoding) {
        FormatOptions options = config.options;
        try {
            switch (config.command) {
                case FORMAT:
                    return Result.output(name, SyntaxTree.format(source, options));
                case CHECK: {
                    String formatted = SyntaxTree.format(source, options);
                    if (formatted.equals(source)) {
                        return Result.output(name, null);
                    }
                    return Result.failure(name, "not formatted");
                }
                case WRITE: {
                    String formatted = SyntaxTree.format(source, options);
                    if (!formatted.equals(source)) {
                        Files.writeString(file, formatted, encoding);
                    }
                    return Result.output(name, null);
                }
                case AST:
                    return Result.output(name, SyntaxTree.sexp(SyntaxTree.parse(source)) + "\n");
                case JSON: {
                    Program program = SyntaxTree.parse(source);
                    return Result.output(name, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(program) + "\n");
                }
                case DEBUG: {
                    String once = SyntaxTree.format(source, options);
                    String twice = SyntaxTree.format(once, options);
                    if (once.equals(twice)) {
                        return Result.output(name, null);
                    }
                    return Result.failure(name, "formatting is not idempotent");
                }
                default:
                    throw new IllegalStateException("Unknown command " + config.command);
            }
        } catch (ParseException e) {
            LOG.warning(() -> "Parse error in " + name + ": " + e.getMessage());
            return Result.failure(name, e.getMessage());
        } catch (IOException e) {
            LOG.warning(() -> "Cannot process " + name + ": " + e.getMessage());
            return Result.failure(name, e.getMessage());
        }
    }

    private void report(Result result) {
        if (result.output() != null) {
            out.print(result.output());
        }
        if (result.failed()) {
            err.println("[" + config.command.name().toLowerCase() + "] " + result.name() + ": " + result.message());
        }
        out.flush();
    }

    static void printUsage(PrintStream stream) {
        stream.println("Usage: garnet [command] [options] [files...]");
        stream.println();
        stream.println("Commands:");
        stream.println("  format                  Print the formatted source (default)");
        stream.println("  check                   Exit with 1 when a file is not formatted");
        stream.println("  write                   Rewrite files in place");
        stream.println("  ast                     Print the syntax tree as an S-expression");
        stream.println("  json                    Print the syntax tree as JSON");
        stream.println("  debug                   Check that formatting is idempotent");
        stream.println();
        stream.println("Options:");
        stream.println("  --print-width=N         Maximum line width (default: 80)");
        stream.println("  --quote=single|double   Preferred string quote (default: double)");
        stream.println("  --trailing-comma        Add trailing commas to broken lists");
        stream.println("  --disable-auto-ternary  Keep if/else blocks as written");
        stream.println("  --threads=N             Number of worker threads (default: CPU count)");
        stream.println("  --help                  Show this help");
        stream.println();
        stream.println("Options in " + RC_FILE + " apply before those on the command line.");
    }

    // ========== Inner classes ==========

    public enum Command {
        FORMAT, CHECK, WRITE, AST, JSON, DEBUG
    }

    /**
     * What one source produced: text to print, or a failure message.
     */
    public record Result(String name, String output, String message) {

        static Result output(String name, String output) {
            return new Result(name, output, null);
        }

        static Result failure(String name, String message) {
            return new Result(name, null, message);
        }

        public boolean failed() {
            return message != null;
        }
    }

    public static class Config {
        Command command = Command.FORMAT;
        FormatOptions options = FormatOptions.DEFAULT;
        int threads = Runtime.getRuntime().availableProcessors();
        List<Path> files = new ArrayList<>();

        /**
         * Returns null when help was asked for.
         *
         * @throws IllegalArgumentException on an unknown command or a bad option
         */
        public static Config parse(String[] args) {
            Config config = new Config();
            boolean commandSeen = false;

            for (String arg : args) {
                if (arg.equals("--help") || arg.equals("-h")) {
                    return null;
                } else if (arg.startsWith("--print-width=")) {
                    config.options = config.options.withPrintWidth(parseNumber(arg, arg.substring(14)));
                } else if (arg.startsWith("--quote=")) {
                    String quote = arg.substring(8);
                    if (quote.equals("single")) {
                        config.options = config.options.withQuote("'");
                    } else if (quote.equals("double")) {
                        config.options = config.options.withQuote("\"");
                    } else {
                        throw new IllegalArgumentException("Invalid quote: " + quote);
                    }
                } else if (arg.equals("--trailing-comma")) {
                    config.options = config.options.withTrailingComma(true);
                } else if (arg.equals("--disable-auto-ternary")) {
                    config.options = config.options.withDisableAutoTernary(true);
                } else if (arg.startsWith("--threads=")) {
                    config.threads = parseNumber(arg, arg.substring(10));
                    if (config.threads < 1) {
                        throw new IllegalArgumentException("Invalid thread count: " + config.threads);
                    }
                } else if (arg.startsWith("-")) {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                } else if (!commandSeen && config.files.isEmpty() && isCommand(arg)) {
                    config.command = Command.valueOf(arg.toUpperCase());
                    commandSeen = true;
                } else {
                    config.files.add(Path.of(arg));
                }
            }
            return config;
        }

        private static boolean isCommand(String arg) {
            for (Command command : Command.values()) {
                if (command.name().equalsIgnoreCase(arg)) {
                    return true;
                }
            }
            return false;
        }

        private static int parseNumber(String arg, String value) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number in " + arg, e);
            }
        }

        public Command command() {
            return command;
        }

        public FormatOptions options() {
            return options;
        }

        public int threads() {
            return threads;
        }

        public List<Path> files() {
            return files;
        }
    }
}
