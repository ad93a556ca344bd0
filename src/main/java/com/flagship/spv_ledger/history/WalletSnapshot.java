package com.flagship.spv_ledger.history;

import lombok.Value;

/**
 * Row of the {@code wallets} table: the node's last persisted view of a wallet.
 */
@Value
public class WalletSnapshot {
    String address;
    String publicKey;
    long voteBalance;
}
