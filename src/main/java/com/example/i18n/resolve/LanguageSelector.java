package com.example.i18n.resolve;

import java.util.Optional;

/**
 * Picks the language for a request. First match wins:
 * <ol>
 *   <li>the explicit language header, verbatim</li>
 *   <li>a {@code lang=} token in the user agent</li>
 *   <li>the default language</li>
 * </ol>
 * The chosen id is not checked against the catalog.
 */
public final class LanguageSelector {

    private static final String LANG_KEY = "lang";

    private LanguageSelector() {
    }

    public static String select(RequestSignals signals, String defaultLang) {
        if (signals == null) {
            return defaultLang;
        }
        if (hasText(signals.langHeader())) {
            return signals.langHeader();
        }
        return fromUserAgent(signals.userAgent()).orElse(defaultLang);
    }

    /**
     * Finds a {@code lang=<id>} piece in a {@code ;} separated string. Keys are
     * matched case-insensitively and both key and value are trimmed.
     */
    static Optional<String> fromUserAgent(String userAgent) {
        if (!hasText(userAgent)) {
            return Optional.empty();
        }
        for (String piece : userAgent.split(";")) {
            int eq = piece.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String key = piece.substring(0, eq).trim();
            String value = piece.substring(eq + 1).trim();
            if (LANG_KEY.equalsIgnoreCase(key) && !value.isEmpty()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
