package com.prism.service.core.segment;

import java.util.List;
import java.util.Objects;

public record SegmentGroup(SegmentLogic logic, List<SegmentNode> children) implements SegmentNode {

    public SegmentGroup {
        Objects.requireNonNull(logic, "logic");
        if (children == null || children.isEmpty()) {
            throw new IllegalArgumentException("Segment group requires at least one rule");
        }
        children = List.copyOf(children);
    }

    public static SegmentGroup and(SegmentNode... children) {
        return new SegmentGroup(SegmentLogic.AND, List.of(children));
    }

    public static SegmentGroup or(SegmentNode... children) {
        return new SegmentGroup(SegmentLogic.OR, List.of(children));
    }

    /** Nesting depth: 1 for a group of rules, 2 for a group that contains groups of rules. */
    public int depth() {
        int deepest = 0;
        for (SegmentNode child : children) {
            if (child instanceof SegmentGroup group) {
                deepest = Math.max(deepest, group.depth());
            }
        }
        return deepest + 1;
    }
}
