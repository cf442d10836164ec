package org.manuscript;

public class LanguageDataException extends ManuscriptException {

    private final String resource;

    public LanguageDataException(String resource, Throwable cause) {
        super("Unable to load language data '" + resource + "'", cause);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
