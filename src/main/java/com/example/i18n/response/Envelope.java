package com.example.i18n.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

/**
 * Standard response body: {@code {"code": .., "msg": .., "trace": {"id": .., "desc": ..}, "data": ..}}.
 * Built fresh for every response. Every field is written, {@code null} data included,
 * whatever inclusion the application's mapper defaults to.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"code", "msg", "trace", "data"})
@JacksonXmlRootElement(localName = "response")
public record Envelope(int code, String msg, Trace trace, Object data) {
}
