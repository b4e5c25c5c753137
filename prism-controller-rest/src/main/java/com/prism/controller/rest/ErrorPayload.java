package com.prism.controller.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/** Structured error payload returned by REST endpoints; {@code details} lists individual problems when known. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorPayload(
        Instant timestamp, int status, String error, String message, String path, List<Detail> details) {

    public record Detail(String field, String message) {}
}
