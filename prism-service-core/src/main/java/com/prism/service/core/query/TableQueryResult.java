package com.prism.service.core.query;

import java.util.List;
import java.util.Map;

/**
 * Grouped rows plus totals. Each row maps column key to value: dimension values are strings, metric values are
 * numbers. {@code totals} covers every filtered event, not only the returned rows.
 */
public record TableQueryResult(List<String> columns, List<Map<String, Object>> rows, Map<String, Number> totals) {}
