package com.flagship.spv_ledger.ledger;

import com.flagship.spv_ledger.crypto.Transaction;
import com.flagship.spv_ledger.crypto.asset.MultiSignatureAsset;
import com.flagship.spv_ledger.crypto.asset.VoteAsset;
import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

/**
 * Ledger state of one address.
 *
 * Wallets are mutable and owned by a {@link WalletManager}. The address never changes and the
 * public key can be attached once. Balances are in the minor currency unit and may be negative.
 */
@Getter
@Setter
public class Wallet {

    private final String address;
    @Setter(lombok.AccessLevel.NONE)
    private String publicKey;
    private long balance;
    private String secondPublicKey;
    private String username;
    private String vote;
    private boolean voted;
    private long voteBalance;
    private long forgedFees;
    private long forgedRewards;
    private long producedBlocks;
    private int rate;
    private MultiSignatureAsset multisignature;
    private LastBlock lastBlock;

    public Wallet(String address) {
        this.address = Objects.requireNonNull(address, "address");
    }

    /**
     * Attaches the public key.
     *
     * @throws IllegalStateException if a different key is already attached
     */
    public void setPublicKey(String publicKey) {
        if (this.publicKey != null && !this.publicKey.equals(publicKey)) {
            throw new IllegalStateException(
                String.format("Wallet %s already has public key %s, refusing %s", address, this.publicKey, publicKey));
        }
        this.publicKey = publicKey;
    }

    public boolean isDelegate() {
        return username != null;
    }

    /**
     * Applies the wallet-state effect of a transaction sent by this wallet.
     *
     * Only votes change state here: {@code +key} points the wallet at a delegate and
     * {@code -key} clears its vote. Balances are rebuilt from aggregated history, not from
     * individual transactions.
     */
    public void apply(Transaction transaction) {
        if (!(transaction.getAsset() instanceof VoteAsset votes)) {
            return;
        }
        for (String entry : votes.getVotes()) {
            this.vote = entry.charAt(0) == VoteAsset.VOTE_PREFIX ? entry.substring(1) : null;
        }
    }

    @Override
    public String toString() {
        return "Wallet{address=" + address
            + ", publicKey=" + publicKey
            + ", balance=" + balance
            + (username != null ? ", username=" + username : "")
            + "}";
    }
}
