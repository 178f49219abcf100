package com.example.i18n.response;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Response data handed to the responder, optionally with values for the
 * message template. Only {@link #data()} is echoed back to the client.
 */
public sealed interface Payload permits Payload.Plain, Payload.WithParams {

    Object data();

    static Payload of(Object data) {
        return new Plain(data);
    }

    static Payload empty() {
        return new Plain(null);
    }

    static Payload withParams(Object data, String... params) {
        return new WithParams(Arrays.asList(params), data);
    }

    static Payload withParams(Object data, List<String> params) {
        return new WithParams(params, data);
    }

    record Plain(Object data) implements Payload {
    }

    record WithParams(List<String> params, Object data) implements Payload {

        public WithParams {
            params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
        }
    }
}
