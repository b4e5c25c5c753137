package com.prism.controller.rest;

import com.prism.service.core.query.FreeformQueryRequest;
import com.prism.service.core.query.FreeformQueryResult;
import com.prism.service.core.query.QueryService;
import com.prism.service.core.query.TableQueryRequest;
import com.prism.service.core.query.TableQueryResult;
import com.prism.service.core.query.TimeseriesQueryRequest;
import com.prism.service.core.query.TimeseriesQueryResult;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/query", produces = MediaType.APPLICATION_JSON_VALUE)
public class QueryController {

    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    @PostMapping(path = "/table", consumes = MediaType.APPLICATION_JSON_VALUE)
    public TableQueryResult table(@Valid @RequestBody TableQueryRequest request) {
        return queryService.table(request);
    }

    @PostMapping(path = "/timeseries", consumes = MediaType.APPLICATION_JSON_VALUE)
    public TimeseriesQueryResult timeseries(@Valid @RequestBody TimeseriesQueryRequest request) {
        return queryService.timeseries(request);
    }

    @PostMapping(path = "/freeform", consumes = MediaType.APPLICATION_JSON_VALUE)
    public FreeformQueryResult freeform(@Valid @RequestBody FreeformQueryRequest request) {
        return queryService.freeform(request);
    }
}
