package com.flagship.spv_ledger.ledger;

import com.flagship.spv_ledger.support.LedgerFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WalletTest {

    private final String delegateKey = LedgerFixtures.publicKey(2);

    @Test
    @DisplayName("Applying a vote points the wallet at the delegate")
    void testApply_Vote() {
        Wallet wallet = new Wallet("AGeYmgbg2LgGxRW2vNNJvQ88PknEJsYizC");

        wallet.apply(LedgerFixtures.vote(LedgerFixtures.publicKey(1), 1, "+" + delegateKey));

        assertEquals(delegateKey, wallet.getVote());
    }

    @Test
    @DisplayName("Applying an unvote clears the vote")
    void testApply_Unvote() {
        Wallet wallet = new Wallet("AGeYmgbg2LgGxRW2vNNJvQ88PknEJsYizC");
        wallet.setVote(delegateKey);

        wallet.apply(LedgerFixtures.vote(LedgerFixtures.publicKey(1), 1, "-" + delegateKey));

        assertNull(wallet.getVote());
    }

    @Test
    @DisplayName("Non-vote transactions leave the wallet untouched")
    void testApply_IgnoresOtherTypes() {
        Wallet wallet = new Wallet("AGeYmgbg2LgGxRW2vNNJvQ88PknEJsYizC");
        wallet.setBalance(50);

        wallet.apply(LedgerFixtures.delegateRegistration(LedgerFixtures.publicKey(1), "alice"));

        assertEquals(50, wallet.getBalance());
        assertNull(wallet.getVote());
        assertNull(wallet.getUsername());
    }

    @Test
    @DisplayName("A different public key cannot replace an attached one")
    void testSetPublicKey_Immutable() {
        Wallet wallet = new Wallet("AGeYmgbg2LgGxRW2vNNJvQ88PknEJsYizC");
        wallet.setPublicKey(delegateKey);
        wallet.setPublicKey(delegateKey);

        assertThrows(IllegalStateException.class, () -> wallet.setPublicKey(LedgerFixtures.publicKey(3)));
    }
}
