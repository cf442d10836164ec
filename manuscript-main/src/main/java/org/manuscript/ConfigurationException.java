package org.manuscript;

import java.nio.file.Path;

/**
 * A configuration file could not be read or does not have the expected shape.
 * Line and column are {@code -1} when the underlying parser did not report a location.
 */
public class ConfigurationException extends ManuscriptException {

    private final Path path;
    private final int line;
    private final int column;

    public ConfigurationException(String message, Path path, int line, int column) {
        super(message);
        this.path = path;
        this.line = line;
        this.column = column;
    }

    public ConfigurationException(String message, Path path, int line, int column, Throwable cause) {
        super(message, cause);
        this.path = path;
        this.line = line;
        this.column = column;
    }

    public Path getPath() {
        return path;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
