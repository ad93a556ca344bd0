package com.flagship.spv_ledger.history;

import com.flagship.spv_ledger.crypto.Transaction;
import com.flagship.spv_ledger.crypto.TransactionCodec;
import com.flagship.spv_ledger.crypto.TransactionType;
import com.flagship.spv_ledger.support.LedgerFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.HexFormat;
import java.util.List;

import static com.flagship.spv_ledger.support.LedgerFixtures.GENESIS_DELEGATES;
import static com.flagship.spv_ledger.support.LedgerFixtures.GENESIS_PUBLIC_KEY;
import static com.flagship.spv_ledger.support.LedgerFixtures.GENESIS_TRANSFERS;
import static com.flagship.spv_ledger.support.LedgerFixtures.address;
import static com.flagship.spv_ledger.support.LedgerFixtures.genesisDelegate;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class BlockRepositoryTest {

    @Autowired
    private BlockRepository blockRepository;

    @Autowired
    private WalletSnapshotRepository walletSnapshotRepository;

    @Autowired
    private TransactionCodec transactionCodec;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Block genesisBlock;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM transactions");
        jdbcTemplate.update("DELETE FROM blocks");
        jdbcTemplate.update("DELETE FROM wallets");

        genesisBlock = LedgerFixtures.genesisBlock();
        blockRepository.saveBlock(genesisBlock, LedgerFixtures.createdAt(1));
    }

    private String idOf(Transaction transaction) {
        return transactionCodec.computeId(transactionCodec.serialize(transaction));
    }

    @Test
    @DisplayName("Saving the genesis block stores every transaction in block order")
    void testSaveBlock_StoresAllTransactions() {
        List<StoredTransaction> all = blockRepository.findAll();

        assertEquals(153, all.size());
        assertEquals(153, blockRepository.countAll());
        for (int i = 0; i < all.size(); i++) {
            assertEquals(i, all.get(i).getSequence());
            assertEquals(genesisBlock.getId(), all.get(i).getBlockId());
            assertEquals(1, all.get(i).getBlockHeight());
        }
        assertEquals(1, blockRepository.findLastHeight());
    }

    @Test
    @DisplayName("Stored payload decodes back to the saved transaction")
    void testSaveBlock_PayloadRoundTrip() {
        Transaction registration = genesisBlock.getTransactions().get(GENESIS_TRANSFERS);

        StoredTransaction stored = blockRepository.findById(idOf(registration)).orElseThrow();
        Transaction decoded = transactionCodec.deserialize(HexFormat.of().formatHex(stored.getSerialized()));

        assertEquals(TransactionType.DELEGATE_REGISTRATION, stored.getType());
        assertEquals("genesis_1", decoded.getDelegate().getUsername());
        assertEquals(LedgerFixtures.createdAt(1), stored.getCreatedAt());
    }

    @Test
    @DisplayName("Finders by sender, recipient and wallet")
    void testFinders_BySenderRecipientAndWallet() {
        String firstDelegate = genesisDelegate(0);

        // 100 transfers and the multisignature registration
        assertEquals(GENESIS_TRANSFERS + 1, blockRepository.findAllBySender(GENESIS_PUBLIC_KEY).size());
        // transfers 0 and 51
        assertEquals(2, blockRepository.findAllByRecipient(address(firstDelegate)).size());
        // two received, one registration, one vote
        assertEquals(4, blockRepository.findAllByWallet(address(firstDelegate), firstDelegate).size());
    }

    @Test
    @DisplayName("Finders by type and by date range")
    void testFinders_ByTypeAndDate() {
        assertEquals(GENESIS_DELEGATES, blockRepository.findAllByType(TransactionType.DELEGATE_REGISTRATION).size());
        assertEquals(1, blockRepository.findAllByType(TransactionType.VOTE).size());
        assertEquals(0, blockRepository.findAllByType(TransactionType.SECOND_SIGNATURE).size());

        List<Transaction> transactions = genesisBlock.getTransactions();
        long from = transactions.get(0).getTimestamp();
        long to = transactions.get(9).getTimestamp();
        List<StoredTransaction> firstTen = blockRepository.findAllByDateAndType(TransactionType.TRANSFER, from, to);

        assertEquals(10, firstTen.size());
        assertEquals(from, firstTen.get(0).getTimestamp());
    }

    @Test
    @DisplayName("Lookup by type and id only matches the right type")
    void testFindByTypeAndId() {
        String transferId = idOf(genesisBlock.getTransactions().get(0));

        assertTrue(blockRepository.findByTypeAndId(TransactionType.TRANSFER, transferId).isPresent());
        assertTrue(blockRepository.findByTypeAndId(TransactionType.VOTE, transferId).isEmpty());
        assertTrue(blockRepository.findById("unknown").isEmpty());
    }

    @Test
    @DisplayName("A second block at the same height is rejected as a whole")
    void testSaveBlock_DuplicateHeightRollsBack() {
        Block duplicate = LedgerFixtures.block(1, GENESIS_PUBLIC_KEY, 0,
            List.of(LedgerFixtures.transfer(GENESIS_PUBLIC_KEY, address(genesisDelegate(0)), 1, 0)));
        Block renamed = Block.builder()
            .id("f".repeat(64))
            .height(duplicate.getHeight())
            .timestamp(duplicate.getTimestamp())
            .generatorPublicKey(duplicate.getGeneratorPublicKey())
            .transactions(duplicate.getTransactions())
            .build();

        assertThrows(DataIntegrityViolationException.class,
            () -> blockRepository.saveBlock(renamed, LedgerFixtures.createdAt(2)));
        assertEquals(153, blockRepository.countAll());
    }

    @Test
    @DisplayName("Wallet snapshot rows are read back ordered by address")
    void testWalletSnapshots() {
        for (int i = 0; i < 3; i++) {
            String publicKey = genesisDelegate(i);
            walletSnapshotRepository.save(new WalletSnapshot(address(publicKey), publicKey, 10L * i));
        }

        List<WalletSnapshot> snapshots = walletSnapshotRepository.findAll();

        assertEquals(3, snapshots.size());
        assertTrue(snapshots.get(0).getAddress().compareTo(snapshots.get(1).getAddress()) < 0);
        assertTrue(snapshots.get(1).getAddress().compareTo(snapshots.get(2).getAddress()) < 0);
    }
}
