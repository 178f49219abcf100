package com.example.i18n.resolve;

import com.example.i18n.catalog.MessageCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns a language and message code into display text.
 *
 * <p>Lookups never fail. An unknown language falls back to the default
 * language, and a code with no template comes back as the code itself.
 *
 * <p>The default language is the only mutable state. A change made with
 * {@link #setDefaultLanguage(String)} is visible to every later lookup;
 * lookups running at the same moment may still see the previous value.
 */
public class MessageResolver {

    private static final Logger log = LoggerFactory.getLogger(MessageResolver.class);

    private final MessageCatalog catalog;
    private final AtomicReference<String> defaultLang;

    public MessageResolver(MessageCatalog catalog, String defaultLang) {
        this.catalog = catalog;
        this.defaultLang = new AtomicReference<>(defaultLang);
    }

    /**
     * Resolves {@code code} in {@code lang}.
     *
     * @param lang   requested language, may be unknown to the catalog
     * @param code   message code; {@code null} resolves to an empty string
     * @param params values substituted positionally into the template with
     *               {@link String#format}; ignored when empty
     * @return the formatted template, the raw template if the params do not
     *         fit it, or {@code code} when no template exists
     */
    public String resolve(String lang, String code, List<String> params) {
        if (code == null) {
            return "";
        }
        Map<String, String> messages = catalog.get(lang)
                .or(() -> {
                    log.debug("Language {} not loaded, falling back to {}", lang, defaultLang.get());
                    return catalog.get(defaultLang.get());
                })
                .orElse(Map.of());

        String template = messages.get(code);
        if (template == null) {
            return code;
        }
        if (params == null || params.isEmpty()) {
            return template;
        }
        try {
            return String.format(Locale.ROOT, template, params.toArray());
        } catch (IllegalFormatException ex) {
            log.warn("Template for code {} in {} does not accept params {}: {}",
                    code, lang, params, ex.getMessage());
            return template;
        }
    }

    public String resolve(String lang, String code, String... params) {
        return resolve(lang, code, Arrays.asList(params));
    }

    public String selectLanguage(RequestSignals signals) {
        return LanguageSelector.select(signals, defaultLang.get());
    }

    public String getDefaultLanguage() {
        return defaultLang.get();
    }

    /** Changes the default language. An empty value keeps the current one. */
    public void setDefaultLanguage(String lang) {
        if (lang == null || lang.isEmpty()) {
            return;
        }
        String previous = defaultLang.getAndSet(lang);
        log.info("Switching default language from {} to {}", previous, lang);
    }

    public int count() {
        return catalog.size();
    }

    public List<String> languages() {
        return catalog.languages();
    }

    public boolean languageExists(String lang) {
        return catalog.contains(lang);
    }
}
