package com.example.i18n.catalog;

public class EmptyCatalogException extends CatalogException {

    public EmptyCatalogException(String location) {
        super("No language files found in " + location);
    }
}
