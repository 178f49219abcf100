package com.example.i18n.catalog;

/**
 * Base class for failures while building a {@link MessageCatalog}.
 * Always fatal to initialization.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
