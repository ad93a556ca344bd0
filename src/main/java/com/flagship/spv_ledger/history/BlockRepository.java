package com.flagship.spv_ledger.history;

import com.flagship.spv_ledger.crypto.Transaction;
import com.flagship.spv_ledger.crypto.TransactionCodec;
import com.flagship.spv_ledger.crypto.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Persisted block history: writes blocks with their transactions and reads transactions back.
 *
 * The rebuild itself never writes here; saving blocks belongs to block processing and to fixtures.
 */
@Repository
@Slf4j
public class BlockRepository {

    private static final String TRANSACTION_COLUMNS =
        "id, block_id, block_height, sequence_number, version, type, tx_timestamp, sender_public_key, recipient_id, " +
        "amount, fee, vendor_field_hex, serialized, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionCodec transactionCodec;

    public BlockRepository(JdbcTemplate jdbcTemplate, TransactionCodec transactionCodec) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionCodec = transactionCodec;
    }

    public void saveBlock(Block block) {
        saveBlock(block, Instant.now());
    }

    /**
     * Saves a block and its transactions atomically.
     *
     * @param createdAt insertion time recorded on the block and every transaction in it;
     *                  vote and multisignature resolution orders by this value
     */
    @Transactional
    public void saveBlock(Block block, Instant createdAt) {
        Timestamp created = Timestamp.from(createdAt);
        jdbcTemplate.update(
            "INSERT INTO blocks (id, version, height, block_timestamp, previous_block, number_of_transactions, " +
            "total_amount, total_fee, reward, payload_length, generator_public_key, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            block.getId(),
            block.getVersion(),
            block.getHeight(),
            block.getTimestamp(),
            block.getPreviousBlock(),
            block.getNumberOfTransactions(),
            block.getTotalAmount(),
            block.getTotalFee(),
            block.getReward(),
            block.getPayloadLength(),
            block.getGeneratorPublicKey(),
            created
        );

        List<Transaction> transactions = block.getTransactions();
        for (int i = 0; i < transactions.size(); i++) {
            saveTransaction(block.getId(), block.getHeight(), i, transactions.get(i), created);
        }

        log.debug("Saved block {} at height {} with {} transactions",
            block.getId(), block.getHeight(), transactions.size());
    }

    private void saveTransaction(String blockId, long blockHeight, int sequence, Transaction transaction, Timestamp created) {
        byte[] serialized = transactionCodec.serialize(transaction);
        String vendorFieldHex = transaction.getVendorField() == null
            ? null
            : HexFormat.of().formatHex(transaction.getVendorField().getBytes(StandardCharsets.UTF_8));

        jdbcTemplate.update(
            "INSERT INTO transactions (" + TRANSACTION_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            transactionCodec.computeId(serialized),
            blockId,
            blockHeight,
            sequence,
            transaction.getVersion(),
            transaction.getType().getCode(),
            transaction.getTimestamp(),
            transaction.getSenderPublicKey(),
            transaction.getRecipientId(),
            transaction.getAmount(),
            transaction.getFee(),
            vendorFieldHex,
            serialized,
            created
        );
    }

    public List<StoredTransaction> findAll() {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions ORDER BY created_at, block_height, sequence_number",
            storedTransactionRowMapper()
        );
    }

    public long countAll() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Long.class);
        return count != null ? count : 0L;
    }

    public List<StoredTransaction> findAllBySender(String senderPublicKey) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions WHERE sender_public_key = ? " +
            "ORDER BY created_at, block_height, sequence_number",
            storedTransactionRowMapper(),
            senderPublicKey
        );
    }

    public List<StoredTransaction> findAllByRecipient(String recipientId) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions WHERE recipient_id = ? " +
            "ORDER BY created_at, block_height, sequence_number",
            storedTransactionRowMapper(),
            recipientId
        );
    }

    /**
     * Transactions sent by the public key or received by the address.
     */
    public List<StoredTransaction> findAllByWallet(String address, String publicKey) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions WHERE recipient_id = ? OR sender_public_key = ? " +
            "ORDER BY created_at, block_height, sequence_number",
            storedTransactionRowMapper(),
            address,
            publicKey
        );
    }

    public List<StoredTransaction> findAllByType(TransactionType type) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions WHERE type = ? " +
            "ORDER BY created_at, block_height, sequence_number",
            storedTransactionRowMapper(),
            type.getCode()
        );
    }

    /**
     * Transactions of a type whose own timestamp lies in {@code [from, to]}.
     */
    public List<StoredTransaction> findAllByDateAndType(TransactionType type, long from, long to) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions WHERE type = ? AND tx_timestamp BETWEEN ? AND ? " +
            "ORDER BY tx_timestamp, block_height, sequence_number",
            storedTransactionRowMapper(),
            type.getCode(),
            from,
            to
        );
    }

    public Optional<StoredTransaction> findById(String id) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions WHERE id = ?",
            storedTransactionRowMapper(),
            id
        ).stream().findFirst();
    }

    public Optional<StoredTransaction> findByTypeAndId(TransactionType type, String id) {
        return jdbcTemplate.query(
            "SELECT " + TRANSACTION_COLUMNS + " FROM transactions WHERE type = ? AND id = ?",
            storedTransactionRowMapper(),
            type.getCode(),
            id
        ).stream().findFirst();
    }

    /**
     * Height of the newest stored block, 0 when nothing is stored yet.
     */
    public long findLastHeight() {
        Long height = jdbcTemplate.queryForObject("SELECT COALESCE(MAX(height), 0) FROM blocks", Long.class);
        return height != null ? height : 0L;
    }

    private RowMapper<StoredTransaction> storedTransactionRowMapper() {
        return (rs, rowNum) -> new StoredTransaction(
            rs.getString("id"),
            rs.getString("block_id"),
            rs.getLong("block_height"),
            rs.getInt("sequence_number"),
            rs.getInt("version"),
            TransactionType.fromCode(rs.getInt("type")),
            rs.getLong("tx_timestamp"),
            rs.getString("sender_public_key"),
            rs.getString("recipient_id"),
            rs.getLong("amount"),
            rs.getLong("fee"),
            rs.getString("vendor_field_hex"),
            rs.getBytes("serialized"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
