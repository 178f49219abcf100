package com.example.i18n.web;

import org.springframework.http.MediaType;

public enum ResponseFormat {

    /** JSON with {@code <}, {@code >} and {@code &} escaped. */
    JSON("application/json;charset=UTF-8"),
    /** JSON wrapped in the request's callback function when one is given. */
    JSONP("application/javascript;charset=UTF-8"),
    /** HTML-safe JSON with every non-ASCII character escaped. */
    ASCII_JSON("application/json;charset=UTF-8"),
    /** JSON without HTML escaping. */
    PURE_JSON("application/json;charset=UTF-8"),
    XML("application/xml;charset=UTF-8"),
    YAML("application/x-yaml;charset=UTF-8");

    private final MediaType mediaType;

    ResponseFormat(String mediaType) {
        this.mediaType = MediaType.parseMediaType(mediaType);
    }

    public MediaType getMediaType() {
        return mediaType;
    }
}
