package com.prism.service.core.segment;

/** Node of a segment filter tree: either a comparison rule or a boolean group of nodes. */
public sealed interface SegmentNode permits SegmentRule, SegmentGroup {}
