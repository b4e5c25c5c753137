package com.prism.service.core.query;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Wire form of a row ordering: a requested dimension or metric key and {@code asc}/{@code desc}. Freeform
 * clients name the key {@code column}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SortSpec(@JsonAlias("column") String key, String direction) {}
