package com.example.i18n.catalog;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * One language worth of messages. The name minus its extension is the
 * language id, the body a flat JSON object of code to template.
 */
public interface CatalogSource {

    String name();

    String read() throws IOException;

    /**
     * Language id derived from {@link #name()}: the last path segment with
     * its final extension removed, so {@code lang/en-US.json} becomes {@code en-US}.
     */
    default String languageId() {
        String fileName = name();
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        if (slash >= 0) {
            fileName = fileName.substring(slash + 1);
        }
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(0, dot) : fileName;
    }

    static CatalogSource of(String name, String body) {
        return new CatalogSource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public String read() {
                return body;
            }
        };
    }

    static CatalogSource of(Path file) {
        return new CatalogSource() {
            @Override
            public String name() {
                return file.getFileName().toString();
            }

            @Override
            public String read() throws IOException {
                return Files.readString(file, StandardCharsets.UTF_8);
            }

            @Override
            public String toString() {
                return file.toString();
            }
        };
    }
}
