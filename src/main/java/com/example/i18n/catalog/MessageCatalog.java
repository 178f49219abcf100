package com.example.i18n.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable language id to (message code to template) mapping.
 * Never mutated after {@link #build(List)}, so it can be shared by any
 * number of request threads without locking.
 */
public final class MessageCatalog {

    private static final Logger log = LoggerFactory.getLogger(MessageCatalog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, Map<String, String>> languages;

    private MessageCatalog(Map<String, Map<String, String>> languages) {
        this.languages = languages;
    }

    /**
     * Parses every source into a flat string map keyed by the source's language id.
     * All-or-nothing: the first bad source aborts the build.
     *
     * @throws CatalogLoadException  if a source cannot be read, is not a JSON object,
     *                               or has a non-string value
     * @throws EmptyCatalogException if {@code sources} is empty
     */
    public static MessageCatalog build(List<? extends CatalogSource> sources) {
        if (sources == null || sources.isEmpty()) {
            throw new EmptyCatalogException("the given source list");
        }

        Map<String, Map<String, String>> languages = new LinkedHashMap<>();
        for (CatalogSource source : sources) {
            String lang = source.languageId();
            Map<String, String> messages = parse(source);
            if (languages.put(lang, messages) != null) {
                log.warn("Language {} defined more than once, {} replaces the earlier definition",
                        lang, source.name());
            }
            log.debug("Parsed language {} from {}: {} messages", lang, source.name(), messages.size());
        }
        return new MessageCatalog(Collections.unmodifiableMap(languages));
    }

    private static Map<String, String> parse(CatalogSource source) {
        String body;
        try {
            body = source.read();
        } catch (IOException ex) {
            throw new CatalogLoadException(source.name(), "cannot read: " + ex.getMessage(), ex);
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(body == null ? "" : body);
        } catch (JsonProcessingException ex) {
            throw new CatalogLoadException(source.name(), "invalid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new CatalogLoadException(source.name(), "expected a JSON object of code to message");
        }

        Map<String, String> messages = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new CatalogLoadException(source.name(),
                        "value of \"" + field.getKey() + "\" is not a string");
            }
            messages.put(field.getKey(), field.getValue().textValue());
        }
        return Collections.unmodifiableMap(messages);
    }

    public Optional<Map<String, String>> get(String lang) {
        return Optional.ofNullable(languages.get(lang));
    }

    public boolean contains(String lang) {
        return languages.containsKey(lang);
    }

    public int size() {
        return languages.size();
    }

    /** Loaded language ids in sorted order, without the empty id. */
    public List<String> languages() {
        List<String> list = new ArrayList<>();
        for (String lang : languages.keySet()) {
            if (!lang.isEmpty()) {
                list.add(lang);
            }
        }
        Collections.sort(list);
        return list;
    }
}
