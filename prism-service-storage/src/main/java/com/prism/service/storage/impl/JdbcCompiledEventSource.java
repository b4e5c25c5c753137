package com.prism.service.storage.impl;

import com.prism.core.support.ScalarValues;
import com.prism.service.core.catalog.Metric;
import com.prism.service.core.engine.AggregationPlan;
import com.prism.service.core.engine.GroupRow;
import com.prism.service.core.engine.GroupedAggregation;
import com.prism.service.core.engine.PushdownEventSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Pushes the whole aggregation into PostgreSQL. Two round-trips per plan, rows then totals; failures surface as
 * {@link org.springframework.dao.DataAccessException} to the caller.
 */
public class JdbcCompiledEventSource implements PushdownEventSource {

    private static final Logger log = LoggerFactory.getLogger(JdbcCompiledEventSource.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final AggregationSqlBuilder builder;

    public JdbcCompiledEventSource(NamedParameterJdbcTemplate jdbc) {
        this(jdbc, new AggregationSqlBuilder());
    }

    JdbcCompiledEventSource(NamedParameterJdbcTemplate jdbc, AggregationSqlBuilder builder) {
        this.jdbc = jdbc;
        this.builder = builder;
    }

    @Override
    public String name() {
        return "jdbc-compiled";
    }

    @Override
    public GroupedAggregation compileAndExecute(AggregationPlan plan) {
        var built = builder.build(plan);
        if (log.isDebugEnabled()) {
            log.debug(
                    "Aggregation SQL:\n{}\ntotals:\n{}\nparams: {}", built.rowsSql(), built.totalsSql(), built.params());
        }
        List<GroupRow> rows = jdbc.query(built.rowsSql(), built.params(), (rs, n) -> {
            List<String> dims = new ArrayList<>(plan.dimensions().size());
            for (int i = 0; i < plan.dimensions().size(); i++) {
                dims.add(rs.getString("d" + i));
            }
            return new GroupRow(dims, metrics(rs, plan.metrics()));
        });
        List<Number> totals = plan.totals()
                ? jdbc.queryForObject(built.totalsSql(), built.params(), (rs, n) -> metrics(rs, plan.metrics()))
                : List.of();
        return new GroupedAggregation(rows, totals);
    }

    private static List<Number> metrics(ResultSet rs, List<Metric> metrics) throws SQLException {
        List<Number> values = new ArrayList<>(metrics.size());
        for (int i = 0; i < metrics.size(); i++) {
            String column = "m" + i;
            if (metrics.get(i).aggregation() == Metric.Aggregation.SUM) {
                values.add(ScalarValues.normalize(rs.getBigDecimal(column)));
            } else {
                values.add(rs.getLong(column));
            }
        }
        return values;
    }
}
