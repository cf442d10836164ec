package org.manuscript.cli;

import org.manuscript.LintReport;
import org.manuscript.ManuscriptException;
import org.manuscript.ManuscriptLinter;
import org.manuscript.config.LintConfig;
import org.manuscript.config.LintConfigLoader;
import org.manuscript.diagnostic.Diagnostic;
import org.manuscript.diagnostic.DiagnosticCode;
import org.manuscript.format.ManuscriptFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command line front end.
 * <pre>
 *   manuscript check [--fix] [--dry-run] [--strict] [--ignore CODES] [--config FILE] FILE...
 *   manuscript format [--check] FILE...
 * </pre>
 * {@code check} exits with the number of files' errors (capped at 127), {@code format
 * --check} with the number of files that would change. Usage errors exit with 2.
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int USAGE_ERROR = 2;
    static final int MAX_EXIT_STATUS = 127;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  manuscript check [--fix] [--dry-run] [--strict] [--ignore CODES] [--config FILE] FILE...",
            "  manuscript format [--check] FILE...");

    private final PrintStream out;
    private final PrintStream err;
    private final Path workingDirectory;

    Main(PrintStream out, PrintStream err, Path workingDirectory) {
        this.out = out;
        this.err = err;
        this.workingDirectory = workingDirectory;
    }

    public static void main(String[] args) {
        System.exit(new Main(System.out, System.err, Path.of("")).run(args));
    }

    int run(String[] args) {
        if (args.length == 0) {
            err.println(USAGE);
            return USAGE_ERROR;
        }
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            return switch (args[0]) {
                case "check" -> check(rest);
                case "format" -> format(rest);
                case "-h", "--help", "help" -> {
                    out.println(USAGE);
                    yield 0;
                }
                default -> {
                    err.println("Unknown command '" + args[0] + "'");
                    err.println(USAGE);
                    yield USAGE_ERROR;
                }
            };
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return USAGE_ERROR;
        } catch (ManuscriptException e) {
            LOG.debug("Aborting", e);
            err.println("error: " + e.getMessage());
            return USAGE_ERROR;
        }
    }

    // ── check ───────────────────────────────────────────────────

    private int check(List<String> args) {
        boolean fix = false;
        boolean dryRun = false;
        boolean strict = false;
        List<String> ignored = new ArrayList<>();
        Path configPath = null;
        List<Path> files = new ArrayList<>();

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "--fix" -> fix = true;
                case "-n", "--dry-run" -> dryRun = true;
                case "--strict" -> strict = true;
                case "--ignore" -> ignored.addAll(splitCodes(value(args, ++i, arg)));
                case "--config" -> configPath = workingDirectory.resolve(value(args, ++i, arg));
                default -> files.add(file(arg));
            }
        }
        if (files.isEmpty()) {
            throw new UsageException("check: no input files");
        }

        LintConfigLoader loader = new LintConfigLoader();
        LintConfig config = configPath != null ? loader.load(configPath) : loader.loadFromDirectory(workingDirectory);
        config = config.withIgnored(ignored);
        if (strict) {
            config = config.withStrict(true);
        }
        boolean fixWhitespace = fix && config.isFixable(DiagnosticCode.W002.code());
        if (fixWhitespace) {
            // fixed, or reported as fixable by a dry run
            config = config.withIgnored(List.of(DiagnosticCode.W002.code()));
        }
        ManuscriptLinter linter = new ManuscriptLinter(config);

        int errors = 0;
        for (Path file : files) {
            String source;
            try {
                source = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("✗ " + file + ": cannot read (" + e.getMessage() + ")");
                errors++;
                continue;
            }
            if (fixWhitespace) {
                source = fixTrailingWhitespace(file, source, dryRun);
            }
            LintReport report = linter.lint(source);
            print(file, report);
            errors += report.errorCount();
        }
        return Math.min(errors, MAX_EXIT_STATUS);
    }

    private String fixTrailingWhitespace(Path file, String source, boolean dryRun) {
        String fixed = ManuscriptFormatter.stripTrailingWhitespace(source);
        if (fixed.equals(source)) {
            return source;
        }
        if (dryRun) {
            out.println("Would fix trailing whitespace in " + file);
            return source;
        }
        try {
            Files.writeString(file, fixed, StandardCharsets.UTF_8);
            out.println("Fixed trailing whitespace in " + file);
            return fixed;
        } catch (IOException e) {
            err.println("✗ " + file + ": cannot write fix (" + e.getMessage() + ")");
            return source;
        }
    }

    private void print(Path file, LintReport report) {
        if (report.isClean()) {
            out.println("✓ " + file + ": No issues found");
            return;
        }
        out.println("✗ " + file + ": " + report.errorCount() + " error(s), " + report.warningCount() + " warning(s)");
        for (Diagnostic diagnostic : report.diagnostics()) {
            out.println("  " + diagnostic);
        }
    }

    // ── format ──────────────────────────────────────────────────

    private int format(List<String> args) {
        boolean checkOnly = false;
        List<Path> files = new ArrayList<>();
        for (String arg : args) {
            if (arg.equals("--check")) {
                checkOnly = true;
            } else {
                files.add(file(arg));
            }
        }
        if (files.isEmpty()) {
            throw new UsageException("format: no input files");
        }

        ManuscriptFormatter formatter = new ManuscriptFormatter();
        int failures = 0;
        for (Path file : files) {
            try {
                String source = Files.readString(file, StandardCharsets.UTF_8);
                String formatted = formatter.format(source);
                if (formatted.equals(source)) {
                    out.println("Unchanged " + file);
                } else if (checkOnly) {
                    out.println("Would reformat " + file);
                    failures++;
                } else {
                    Files.writeString(file, formatted, StandardCharsets.UTF_8);
                    out.println("Formatted " + file);
                }
            } catch (IOException e) {
                err.println("✗ " + file + ": " + e.getMessage());
                failures++;
            }
        }
        return Math.min(failures, MAX_EXIT_STATUS);
    }

    // ── Arguments ───────────────────────────────────────────────

    private Path file(String arg) {
        if (arg.startsWith("-")) {
            throw new UsageException("Unknown option '" + arg + "'");
        }
        return workingDirectory.resolve(arg);
    }

    private static String value(List<String> args, int index, String option) {
        if (index >= args.size()) {
            throw new UsageException("Option " + option + " requires a value");
        }
        return args.get(index);
    }

    private static List<String> splitCodes(String codes) {
        List<String> result = new ArrayList<>();
        for (String code : codes.split(",")) {
            if (!code.isBlank()) {
                result.add(code.trim());
            }
        }
        return result;
    }

    private static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
