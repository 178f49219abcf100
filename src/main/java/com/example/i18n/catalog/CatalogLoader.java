package com.example.i18n.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds catalog sources on the file system. Every regular file below the
 * language directory, at any depth, is one source.
 */
public final class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    private CatalogLoader() {
    }

    public static List<CatalogSource> scan(Path langDir) {
        if (!Files.isDirectory(langDir)) {
            throw new CatalogLoadException(langDir.toString(), "not a readable directory");
        }
        try (Stream<Path> paths = Files.walk(langDir)) {
            List<CatalogSource> sources = paths
                    .filter(Files::isRegularFile)
                    .sorted()
                    .map(CatalogSource::of)
                    .collect(Collectors.toList());
            log.debug("Found {} language files in {}", sources.size(), langDir);
            return sources;
        } catch (IOException | UncheckedIOException ex) {
            throw new CatalogLoadException(langDir.toString(), ex.getMessage(), ex);
        }
    }

    /**
     * Scans {@code langDir} and builds a catalog from what it finds.
     *
     * @throws CatalogLoadException  if the directory or a file cannot be read or parsed
     * @throws EmptyCatalogException if the directory holds no files
     */
    public static MessageCatalog load(Path langDir) {
        List<CatalogSource> sources = scan(langDir);
        if (sources.isEmpty()) {
            throw new EmptyCatalogException(langDir.toString());
        }
        MessageCatalog catalog = MessageCatalog.build(sources);
        log.info("Loaded {} languages from {}: {}", catalog.size(), langDir, catalog.languages());
        return catalog;
    }
}
