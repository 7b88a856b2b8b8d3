package com.flowexpr.batch;

import com.flowexpr.ExpressionParser;
import com.flowexpr.FlowExprException;
import com.flowexpr.IndentMode;
import com.flowexpr.ParserOptions;
import com.flowexpr.Unparser;
import com.flowexpr.ast.Node;
import com.flowexpr.json.AstJsonException;
import com.flowexpr.json.AstJsonProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Parses every expression in a set of files and prints it back.
 *
 * Each file holds expressions separated by blank lines; lines starting with
 * {@code //} are comments. Expressions are parsed independently on a worker
 * pool, so one bad expression is reported without affecting the others.
 *
 * Usage:
 *   java -jar flowexpr-jackson.jar [options] &lt;files...&gt;
 *
 * Options:
 *   --mode=compact|indented|json|tree   Output format (default: compact)
 *   --threads=N                         Number of worker threads (default: available processors)
 *   --indent=N                          Indent width for indented mode (default: 4)
 *   --max-depth=N                       Maximum nesting depth (default: 128)
 *   --strict                            Reject input after the first complete expression
 *   --verbose                           Log every expression
 *
 * Exit code is 0 when everything parsed, 1 when some expression failed, 2 on bad usage.
 */
public class BatchRunner {
    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final Config config;
    private final PrintStream out;
    private final Unparser unparser;
    private final ParserOptions parserOptions;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            System.exit(2);
        }

        try {
            System.exit(new BatchRunner(config, System.out).run());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted");
            System.exit(1);
        }
    }

    public BatchRunner(Config config, PrintStream out) {
        this.config = config;
        this.out = out;
        this.unparser = new Unparser(config.indentWidth);
        this.parserOptions = new ParserOptions(config.maxDepth, config.strict);
    }

    /**
     * Processes all configured files and prints results in input order.
     *
     * @return the process exit code
     */
    public int run() throws InterruptedException {
        List<BatchInput> inputs = new ArrayList<>();
        int unreadable = 0;
        for (Path file : config.files) {
            try {
                inputs.addAll(BatchInput.split(file, Files.readString(file)));
            } catch (IOException e) {
                unreadable++;
                log.warn("Cannot read {}: {}", file, e.getMessage());
                out.println("!! " + file + ": cannot read (" + e.getMessage() + ")");
            }
        }
        log.info("Processing {} expressions from {} files with {} threads",
            inputs.size(), config.files.size(), config.threads);

        AstJsonProvider json = config.mode == Mode.JSON ? AstJsonProvider.getProvider() : null;

        ExecutorService executor = Executors.newFixedThreadPool(config.threads);
        List<Future<Result>> futures = new ArrayList<>();
        try {
            for (BatchInput input : inputs) {
                futures.add(executor.submit(() -> process(input, json)));
            }

            int failed = 0;
            for (int i = 0; i < futures.size(); i++) {
                Result result;
                try {
                    result = futures.get(i).get();
                } catch (ExecutionException e) {
                    log.error("[FAIL] {}", inputs.get(i).label(), e.getCause());
                    result = new Result(inputs.get(i), null, "worker failed: " + e.getCause());
                }
                if (result.error() != null) {
                    failed++;
                    out.println("!! " + result.input().label() + ": " + result.error());
                } else {
                    out.println("== " + result.input().label());
                    out.println(result.output());
                }
            }

            log.info("Parsed {} of {} expressions, {} failed", inputs.size() - failed, inputs.size(), failed);
            out.println("Parsed " + (inputs.size() - failed) + " of " + inputs.size() + " expressions, "
                + failed + " failed");
            return failed > 0 || unreadable > 0 ? 1 : 0;
        } finally {
            executor.shutdown();
            executor.awaitTermination(10, TimeUnit.SECONDS);
        }
    }

    Result process(BatchInput input, AstJsonProvider json) {
        try {
            Node node = ExpressionParser.parse(input.source(), parserOptions);
            if (config.verbose) {
                log.info("[OK] {}", input.label());
            }
            return new Result(input, render(node, json), null);
        } catch (FlowExprException | AstJsonException e) {
            log.debug("[FAIL] {}: {}", input.label(), e.getMessage());
            return new Result(input, null, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("[FAIL] {}", input.label(), e);
            return new Result(input, null, e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (StackOverflowError e) {
            log.warn("[FAIL] {}: stack overflow", input.label());
            return new Result(input, null, "expression too deeply nested to process");
        }
    }

    private String render(Node node, AstJsonProvider json) {
        return switch (config.mode) {
            case COMPACT -> unparser.render(node, IndentMode.COMPACT);
            case INDENTED -> unparser.render(node, IndentMode.INDENTED);
            case JSON -> json.getSerializer().serializePretty(node);
            case TREE -> node.toString();
        };
    }

    private static void printUsage() {
        System.err.println("Usage: BatchRunner [options] <files...>");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --mode=compact|indented|json|tree   Output format (default: compact)");
        System.err.println("  --threads=N                         Worker threads (default: available processors)");
        System.err.println("  --indent=N                          Indent width for indented mode (default: 4)");
        System.err.println("  --max-depth=N                       Maximum nesting depth (default: 128)");
        System.err.println("  --strict                            Reject input after the first complete expression");
        System.err.println("  --verbose                           Log every expression");
    }

    // ==================== Types ====================

    public enum Mode {
        COMPACT,
        INDENTED,
        JSON,
        TREE
    }

    public record Result(BatchInput input, String output, String error) {
    }

    public static class Config {
        Mode mode = Mode.COMPACT;
        int threads = Runtime.getRuntime().availableProcessors();
        int indentWidth = Unparser.DEFAULT_INDENT_WIDTH;
        int maxDepth = ParserOptions.DEFAULT_MAX_DEPTH;
        boolean strict = false;
        boolean verbose = false;
        List<Path> files = new ArrayList<>();

        /**
         * Parses command-line arguments.
         *
         * @return the configuration, or {@code null} when the arguments are invalid or help was requested
         */
        public static Config parse(String[] args) {
            Config config = new Config();

            for (String arg : args) {
                try {
                    if (arg.equals("--help") || arg.equals("-h")) {
                        return null;
                    } else if (arg.startsWith("--mode=")) {
                        config.mode = Mode.valueOf(arg.substring(7).toUpperCase(Locale.ROOT));
                    } else if (arg.startsWith("--threads=")) {
                        config.threads = positive(arg, arg.substring(10));
                    } else if (arg.startsWith("--indent=")) {
                        config.indentWidth = positive(arg, arg.substring(9));
                    } else if (arg.startsWith("--max-depth=")) {
                        config.maxDepth = positive(arg, arg.substring(12));
                    } else if (arg.equals("--strict")) {
                        config.strict = true;
                    } else if (arg.equals("--verbose") || arg.equals("-v")) {
                        config.verbose = true;
                    } else if (!arg.startsWith("-")) {
                        config.files.add(Path.of(arg));
                    } else {
                        System.err.println("Unknown option: " + arg);
                        return null;
                    }
                } catch (IllegalArgumentException e) {
                    System.err.println("Invalid option " + arg + ": " + e.getMessage());
                    return null;
                }
            }

            if (config.files.isEmpty()) {
                System.err.println("Error: No input files specified");
                return null;
            }

            return config;
        }

        private static int positive(String arg, String value) {
            int n = Integer.parseInt(value);
            if (n < 1) {
                throw new IllegalArgumentException("must be positive");
            }
            return n;
        }

        public Mode mode() {
            return mode;
        }

        public int threads() {
            return threads;
        }

        public List<Path> files() {
            return files;
        }
    }
}
