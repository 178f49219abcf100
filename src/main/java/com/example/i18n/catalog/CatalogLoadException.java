package com.example.i18n.catalog;

public class CatalogLoadException extends CatalogException {

    private final String sourceName;

    public CatalogLoadException(String sourceName, String message) {
        super("Failed to load language source " + sourceName + ": " + message);
        this.sourceName = sourceName;
    }

    public CatalogLoadException(String sourceName, String message, Throwable cause) {
        super("Failed to load language source " + sourceName + ": " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
