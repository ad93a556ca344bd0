package com.flagship.spv_ledger.history;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fluent builder for the grouped/filtered/ordered reads a rebuild needs.
 *
 * <pre>
 * historyQuery.query()
 *     .select("recipient_id")
 *     .sum("amount", "amount")
 *     .from("transactions")
 *     .where("type", TransactionType.TRANSFER.getCode())
 *     .groupBy("recipient_id")
 *     .all();
 * </pre>
 *
 * Identifiers are checked against {@code [a-z_][a-z0-9_]*} before they reach SQL; values are
 * always bound as parameters. Rows are keyed by the selected column name or the aggregate alias.
 */
@Slf4j
public class AggregationQuery {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final NamedParameterJdbcTemplate jdbcTemplate;

    private final List<String> expressions = new ArrayList<>();
    private final List<String> keys = new ArrayList<>();
    private final List<String> conditions = new ArrayList<>();
    private final List<String> groupColumns = new ArrayList<>();
    private final List<String> orderClauses = new ArrayList<>();
    private final MapSqlParameterSource parameters = new MapSqlParameterSource();
    private String table;
    private Integer limit;

    AggregationQuery(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public AggregationQuery select(String... columns) {
        for (String column : columns) {
            project(identifier(column), column);
        }
        return this;
    }

    public AggregationQuery sum(String column, String alias) {
        return sum(List.of(column), alias);
    }

    /**
     * Sums the row-wise total of several columns, e.g. {@code SUM(reward + total_fee)}.
     */
    public AggregationQuery sum(List<String> columns, String alias) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("sum() needs at least one column");
        }
        String operand = columns.stream().map(AggregationQuery::identifier).collect(Collectors.joining(" + "));
        project("SUM(" + operand + ")", identifier(alias));
        return this;
    }

    public AggregationQuery count(String column, String alias) {
        project("COUNT(" + identifier(column) + ")", identifier(alias));
        return this;
    }

    public AggregationQuery from(String table) {
        this.table = identifier(table);
        return this;
    }

    public AggregationQuery where(String column, Object value) {
        String parameter = nextParameter();
        conditions.add(identifier(column) + " = :" + parameter);
        parameters.addValue(parameter, value);
        return this;
    }

    /**
     * Set-membership filter. An empty collection matches no rows.
     */
    public AggregationQuery whereIn(String column, Collection<?> values) {
        identifier(column);
        if (values.isEmpty()) {
            conditions.add("1 = 0");
            return this;
        }
        String parameter = nextParameter();
        conditions.add(column + " IN (:" + parameter + ")");
        parameters.addValue(parameter, values);
        return this;
    }

    public AggregationQuery groupBy(String... columns) {
        for (String column : columns) {
            groupColumns.add(identifier(column));
        }
        return this;
    }

    public AggregationQuery orderBy(String column, SortDirection direction) {
        orderClauses.add(identifier(column) + " " + direction.name());
        return this;
    }

    /**
     * Orders by several columns, applied in the map's iteration order.
     */
    public AggregationQuery orderBy(LinkedHashMap<String, SortDirection> ordering) {
        ordering.forEach(this::orderBy);
        return this;
    }

    public AggregationQuery limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit must not be negative: " + limit);
        }
        this.limit = limit;
        return this;
    }

    /**
     * Runs the query. Rows come back in the database's order unless {@link #orderBy} was used.
     */
    public List<AggregatedRow> all() {
        String sql = toSql();
        log.debug("Executing aggregation query: {}", sql);
        return jdbcTemplate.query(sql, parameters, (rs, rowNum) -> {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                values.put(keys.get(i), rs.getObject(i + 1));
            }
            return new AggregatedRow(values);
        });
    }

    String toSql() {
        if (table == null) {
            throw new IllegalStateException("from() must be called before running the query");
        }
        if (expressions.isEmpty()) {
            throw new IllegalStateException("Nothing selected");
        }

        StringBuilder sql = new StringBuilder("SELECT ");
        for (int i = 0; i < expressions.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            String expression = expressions.get(i);
            sql.append(expression);
            if (!expression.equals(keys.get(i))) {
                sql.append(" AS ").append(keys.get(i));
            }
        }
        sql.append(" FROM ").append(table);
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        if (!groupColumns.isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", groupColumns));
        }
        if (!orderClauses.isEmpty()) {
            sql.append(" ORDER BY ").append(String.join(", ", orderClauses));
        }
        if (limit != null) {
            sql.append(" LIMIT ").append(limit);
        }
        return sql.toString();
    }

    private void project(String expression, String key) {
        if (keys.contains(key)) {
            throw new IllegalArgumentException("Duplicate column or alias: " + key);
        }
        expressions.add(expression);
        keys.add(key);
    }

    private String nextParameter() {
        return "p" + parameters.getValues().size();
    }

    private static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
        return name;
    }
}
