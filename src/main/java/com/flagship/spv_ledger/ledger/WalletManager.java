package com.flagship.spv_ledger.ledger;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * In-memory wallet ledger, indexed by address, public key and delegate username.
 *
 * All ledger mutation during a rebuild goes through this contract. Implementations are not
 * required to make concurrent mutation of the same wallet safe.
 */
public interface WalletManager {

    /**
     * Returns the wallet for the address, creating it if absent.
     */
    Wallet getWalletByAddress(String address);

    /**
     * Returns the wallet for the address without creating one.
     */
    Optional<Wallet> findWalletByAddress(String address);

    /**
     * Returns the wallet owning the public key, creating it if absent. A wallet already known
     * by the derived address gets the key attached.
     */
    Wallet getWalletByPublicKey(String publicKey);

    Optional<Wallet> findWalletByUsername(String username);

    boolean isGenesisWallet(Wallet wallet);

    /**
     * Refreshes the secondary indices after the public key or username of a wallet changed.
     */
    void reindex(Wallet wallet);

    /**
     * Recomputes every delegate's vote balance from its voters' balances and ranks all
     * delegates by vote balance descending, then public key ascending.
     *
     * @param activeDelegates number of top-ranked delegates kept as the active list
     * @return the active delegates in rank order
     */
    List<Wallet> recomputeDelegateRanking(int activeDelegates);

    List<Wallet> getActiveDelegates();

    Collection<Wallet> getWallets();

    Collection<Wallet> getDelegates();

    int countWallets();

    int countDelegates();

    /**
     * Registers a known wallet before a rebuild, e.g. a genesis wallet.
     */
    Wallet seed(String address, String publicKey);

    /**
     * Drops every wallet. A rebuild that failed must be followed by a reset before it is re-run.
     */
    void reset();
}
