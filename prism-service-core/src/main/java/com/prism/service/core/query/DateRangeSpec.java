package com.prism.service.core.query;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/** Wire form of a date range: a named preset or an explicit {@code from}/{@code to} pair. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DateRangeSpec(String from, String to, @JsonAlias("value") String preset) {

    public static DateRangeSpec between(String from, String to) {
        return new DateRangeSpec(from, to, null);
    }

    public static DateRangeSpec preset(String preset) {
        return new DateRangeSpec(null, null, preset);
    }
}
