package com.prism.service.core.query;

import java.util.List;
import java.util.stream.Collectors;

/** Structured rejection of a malformed query. Raised before any event is read. */
public class QueryValidationException extends IllegalArgumentException {

    private final List<Violation> violations;

    public QueryValidationException(List<Violation> violations) {
        super(summarize(violations));
        this.violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }

    private static String summarize(List<Violation> violations) {
        if (violations == null || violations.isEmpty()) {
            return "Invalid query";
        }
        return "Invalid query: "
                + violations.stream().map(v -> v.field() + ": " + v.message()).collect(Collectors.joining("; "));
    }

    public record Violation(String field, String message) {}
}
