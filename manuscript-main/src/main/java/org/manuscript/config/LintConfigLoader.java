package org.manuscript.config;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.manuscript.ConfigurationException;
import org.manuscript.diagnostic.DiagnosticCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the {@code [lint]} table of a {@value #FILE_NAME} file:
 * <pre>
 * [lint]
 * ignore = ["MS-W010"]
 * strict = true
 * elevate = ["MS-W020"]
 * fixable = []
 * unfixable = ["MS-W002"]
 * max-line-length = 120
 * </pre>
 * Every key is optional. A missing file yields {@link LintConfig#defaults()}.
 * <p>
 * The same table may live in a {@value #PYPROJECT_NAME} as {@code [tool.manuscript.lint]}.
 * Discovery starts in a directory and walks up through its parents; in each directory a
 * {@value #FILE_NAME} wins over a {@value #PYPROJECT_NAME}, and a {@value #PYPROJECT_NAME}
 * only counts when it parses and carries that table.
 */
public final class LintConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(LintConfigLoader.class);

    public static final String FILE_NAME = "manuscript.toml";
    public static final String PYPROJECT_NAME = "pyproject.toml";

    private static final String PYPROJECT_TABLE = "/tool/manuscript/lint";

    private static final TomlMapper MAPPER = new TomlMapper();

    /**
     * Load the configuration found by {@link #findConfigFile(Path)}, or the defaults.
     */
    public LintConfig loadFromDirectory(Path directory) {
        return findConfigFile(directory).map(this::load).orElseGet(() -> {
            LOG.debug("No configuration found from {}, using defaults", directory);
            return LintConfig.defaults();
        });
    }

    /**
     * Nearest configuration file at or above {@code start}.
     */
    public Optional<Path> findConfigFile(Path start) {
        for (Path dir = start.toAbsolutePath().normalize(); dir != null; dir = dir.getParent()) {
            Path dedicated = dir.resolve(FILE_NAME);
            if (Files.isRegularFile(dedicated)) {
                return Optional.of(dedicated);
            }
            Path pyproject = dir.resolve(PYPROJECT_NAME);
            if (Files.isRegularFile(pyproject) && hasLintTable(pyproject)) {
                return Optional.of(pyproject);
            }
        }
        return Optional.empty();
    }

    private static boolean hasLintTable(Path pyproject) {
        try {
            JsonNode root = MAPPER.readTree(pyproject.toFile());
            return root != null && !root.at(PYPROJECT_TABLE).isMissingNode();
        } catch (IOException e) {
            LOG.debug("Skipping unreadable {}: {}", pyproject, e.getMessage());
            return false;
        }
    }

    private static boolean isPyproject(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().equals(PYPROJECT_NAME);
    }

    /**
     * @throws ConfigurationException if the file exists but cannot be read or has the
     *                                wrong shape
     */
    public LintConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            LOG.debug("No configuration at {}, using defaults", path);
            return LintConfig.defaults();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(path.toFile());
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            int line = location != null ? location.getLineNr() : -1;
            int column = location != null ? location.getColumnNr() : -1;
            throw new ConfigurationException("Invalid TOML in " + path + ": " + e.getOriginalMessage(),
                    path, line, column, e);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read " + path, path, -1, -1, e);
        }

        JsonNode lint = null;
        if (root != null) {
            lint = isPyproject(path) ? root.at(PYPROJECT_TABLE) : root.get("lint");
        }
        if (lint == null || lint.isMissingNode() || lint.isNull()) {
            LOG.debug("{} has no [lint] table, using defaults", path);
            return LintConfig.defaults();
        }
        if (!lint.isObject()) {
            throw new ConfigurationException("'lint' in " + path + " must be a table", path, -1, -1);
        }

        LintConfig config = new LintConfig(
                codes(lint, "ignore", path),
                bool(lint, "strict", path),
                codes(lint, "elevate", path),
                codes(lint, "fixable", path),
                codes(lint, "unfixable", path),
                positiveInt(lint, "max-line-length", LintConfig.DEFAULT_MAX_LINE_LENGTH, path));
        LOG.info("Loaded lint configuration from {}", path);
        return config;
    }

    private static Set<String> codes(JsonNode table, String key, Path path) {
        JsonNode node = table.get(key);
        Set<String> codes = new LinkedHashSet<>();
        if (node == null) {
            return codes;
        }
        if (!node.isArray()) {
            throw new ConfigurationException("'lint." + key + "' in " + path + " must be an array of codes",
                    path, -1, -1);
        }
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new ConfigurationException("'lint." + key + "' in " + path + " must contain only strings",
                        path, -1, -1);
            }
            String code = element.asText();
            if (DiagnosticCode.fromCode(code).isEmpty()) {
                LOG.warn("Unknown diagnostic code '{}' in lint.{} of {}", code, key, path);
            }
            codes.add(code);
        }
        return codes;
    }

    private static boolean bool(JsonNode table, String key, Path path) {
        JsonNode node = table.get(key);
        if (node == null) {
            return false;
        }
        if (!node.isBoolean()) {
            throw new ConfigurationException("'lint." + key + "' in " + path + " must be true or false",
                    path, -1, -1);
        }
        return node.booleanValue();
    }

    private static int positiveInt(JsonNode table, String key, int fallback, Path path) {
        JsonNode node = table.get(key);
        if (node == null) {
            return fallback;
        }
        if (!node.canConvertToInt() || !node.isIntegralNumber() || node.intValue() < 1) {
            throw new ConfigurationException("'lint." + key + "' in " + path + " must be a positive integer",
                    path, -1, -1);
        }
        return node.intValue();
    }
}
