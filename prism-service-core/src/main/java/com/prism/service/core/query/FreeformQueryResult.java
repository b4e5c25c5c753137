package com.prism.service.core.query;

import java.util.List;
import java.util.Map;

/** One page of grouped rows. {@code totals} covers every filtered event; {@code queryMs} is wall time. */
public record FreeformQueryResult(
        List<String> columns, List<Map<String, Object>> rows, Map<String, Number> totals, long queryMs) {}
