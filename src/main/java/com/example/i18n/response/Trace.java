package com.example.i18n.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param id   trace id of the request, empty when none was attached
 * @param desc error description, only filled when debug output is allowed
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record Trace(String id, String desc) {
}
