package com.flagship.spv_ledger.history;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Access to the persisted wallet snapshot. The rebuild only reads it.
 */
@Repository
public class WalletSnapshotRepository {

    private final JdbcTemplate jdbcTemplate;

    public WalletSnapshotRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<WalletSnapshot> findAll() {
        return jdbcTemplate.query(
            "SELECT address, public_key, vote_balance FROM wallets ORDER BY address",
            walletSnapshotRowMapper()
        );
    }

    public void save(WalletSnapshot snapshot) {
        jdbcTemplate.update(
            "INSERT INTO wallets (address, public_key, vote_balance) VALUES (?, ?, ?)",
            snapshot.getAddress(),
            snapshot.getPublicKey(),
            snapshot.getVoteBalance()
        );
    }

    private RowMapper<WalletSnapshot> walletSnapshotRowMapper() {
        return (rs, rowNum) -> new WalletSnapshot(
            rs.getString("address"),
            rs.getString("public_key"),
            rs.getLong("vote_balance")
        );
    }
}
