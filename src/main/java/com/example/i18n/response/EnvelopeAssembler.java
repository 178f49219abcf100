package com.example.i18n.response;

import com.example.i18n.resolve.DebugPolicy;
import com.example.i18n.resolve.MessageResolver;
import com.example.i18n.resolve.RequestSignals;

import java.util.List;

/**
 * Builds the {@link Envelope} for a response code. Every input has a
 * fallback, so this never throws.
 */
public class EnvelopeAssembler {

    private final MessageResolver resolver;
    private final DebugPolicy debugPolicy;

    public EnvelopeAssembler(MessageResolver resolver, DebugPolicy debugPolicy) {
        this.resolver = resolver;
        this.debugPolicy = debugPolicy;
    }

    /**
     * @param code    response code, also the message code
     * @param payload response data, with template params for {@link Payload.WithParams}
     * @param err     cause reported in {@code trace.desc} when debug output is allowed; may be null
     * @param signals request language, debug and trace signals
     */
    public Envelope assemble(int code, Payload payload, Throwable err, RequestSignals signals) {
        Object data = null;
        List<String> params = List.of();
        if (payload instanceof Payload.WithParams withParams) {
            data = withParams.data();
            params = withParams.params();
        } else if (payload instanceof Payload.Plain plain) {
            data = plain.data();
        }

        RequestSignals request = signals == null ? RequestSignals.none() : signals;
        String msg = resolver.resolve(resolver.selectLanguage(request), String.valueOf(code), params);

        String traceId = request.traceId() == null ? "" : request.traceId();
        String desc = err != null && debugPolicy.isDebugAllowed(request) ? describe(err) : "";

        return new Envelope(code, msg, new Trace(traceId, desc), data);
    }

    private static String describe(Throwable err) {
        String message = err.getMessage();
        return message != null ? message : err.toString();
    }
}
