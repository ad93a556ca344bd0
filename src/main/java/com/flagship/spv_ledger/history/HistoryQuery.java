package com.flagship.spv_ledger.history;

import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Entry point to the read-only aggregation surface over blocks, transactions and wallets.
 */
@Component
public class HistoryQuery {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public HistoryQuery(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Starts a new query. Builders are single use and not thread-safe.
     */
    public AggregationQuery query() {
        return new AggregationQuery(jdbcTemplate);
    }
}
