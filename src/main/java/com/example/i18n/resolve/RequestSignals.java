package com.example.i18n.resolve;

/**
 * What an inbound request tells us about language, debug output and tracing.
 * Any field may be {@code null}.
 *
 * @param langHeader  explicit language header value
 * @param userAgent   semicolon separated client identification string, scanned for {@code lang=}
 * @param debugHeader per-request debug switch
 * @param traceId     trace id attached by an earlier filter
 */
public record RequestSignals(String langHeader, String userAgent, String debugHeader, String traceId) {

    public static RequestSignals none() {
        return new RequestSignals(null, null, null, null);
    }
}
