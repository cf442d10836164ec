package org.manuscript;

/**
 * Root of the exceptions thrown by the linter and formatter.
 * <p>
 * Malformed plugin source never ends up here: problems in the analysed text are
 * reported as {@link org.manuscript.diagnostic.Diagnostic}s. These exceptions are
 * reserved for the environment the tool runs in (configuration, bundled data).
 */
public class ManuscriptException extends RuntimeException {

    public ManuscriptException(String message) {
        super(message);
    }

    public ManuscriptException(String message, Throwable cause) {
        super(message, cause);
    }

    public ManuscriptException(Throwable cause) {
        super(cause);
    }
}
