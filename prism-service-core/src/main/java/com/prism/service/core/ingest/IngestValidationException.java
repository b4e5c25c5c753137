package com.prism.service.core.ingest;

import java.util.List;
import java.util.stream.Collectors;

/** A batch that does not satisfy the ingest schema. Nothing from the batch is stored. */
public class IngestValidationException extends IllegalArgumentException {

    private final List<Violation> violations;

    public IngestValidationException(List<Violation> violations) {
        super("Invalid ingest batch: "
                + violations.stream().map(Violation::toString).collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> violations() {
        return violations;
    }

    public record Violation(String field, String message) {

        @Override
        public String toString() {
            return field + ": " + message;
        }
    }
}
