package com.prism.service.core.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

public record TimeseriesQueryResult(List<Point> series) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Point(String bucket, String dimension, Number value) {}
}
