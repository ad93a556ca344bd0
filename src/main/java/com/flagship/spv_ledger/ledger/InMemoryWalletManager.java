package com.flagship.spv_ledger.ledger;

import com.flagship.spv_ledger.config.NetworkConstants;
import com.flagship.spv_ledger.crypto.AddressFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link WalletManager} backed by concurrent maps.
 *
 * The maps tolerate HTTP reads while a rebuild mutates wallets, but a rebuild is expected to
 * be the only writer.
 */
@Component
@Slf4j
public class InMemoryWalletManager implements WalletManager {

    /**
     * Canonical delegate order: vote balance descending, then public key ascending.
     * Lowercase hex compares the same as the underlying bytes.
     */
    public static final Comparator<Wallet> DELEGATE_ORDER = Comparator
        .comparingLong(Wallet::getVoteBalance).reversed()
        .thenComparing(Wallet::getPublicKey, Comparator.nullsLast(Comparator.naturalOrder()));

    private final AddressFactory addressFactory;
    private final Set<String> genesisAddresses;

    private final Map<String, Wallet> walletsByAddress = new ConcurrentHashMap<>();
    private final Map<String, Wallet> walletsByPublicKey = new ConcurrentHashMap<>();
    private final Map<String, Wallet> walletsByUsername = new ConcurrentHashMap<>();
    // address -> username currently indexed, so a renamed delegate drops its stale entry
    private final Map<String, String> indexedUsernames = new ConcurrentHashMap<>();

    private volatile List<Wallet> activeDelegates = List.of();

    public InMemoryWalletManager(AddressFactory addressFactory, NetworkConstants networkConstants) {
        this.addressFactory = addressFactory;
        this.genesisAddresses = networkConstants.getGenesisAddresses();
    }

    @Override
    public Wallet getWalletByAddress(String address) {
        return walletsByAddress.computeIfAbsent(address, Wallet::new);
    }

    @Override
    public Optional<Wallet> findWalletByAddress(String address) {
        return Optional.ofNullable(walletsByAddress.get(address));
    }

    @Override
    public Wallet getWalletByPublicKey(String publicKey) {
        Wallet wallet = walletsByPublicKey.get(publicKey);
        if (wallet != null) {
            return wallet;
        }

        wallet = getWalletByAddress(addressFactory.fromPublicKey(publicKey));
        wallet.setPublicKey(publicKey);
        reindex(wallet);
        return wallet;
    }

    @Override
    public Optional<Wallet> findWalletByUsername(String username) {
        return Optional.ofNullable(walletsByUsername.get(username));
    }

    @Override
    public boolean isGenesisWallet(Wallet wallet) {
        return genesisAddresses.contains(wallet.getAddress());
    }

    @Override
    public void reindex(Wallet wallet) {
        walletsByAddress.put(wallet.getAddress(), wallet);

        if (wallet.getPublicKey() != null) {
            walletsByPublicKey.put(wallet.getPublicKey(), wallet);
        }

        String previous = indexedUsernames.get(wallet.getAddress());
        if (previous != null && !previous.equals(wallet.getUsername())) {
            walletsByUsername.remove(previous, wallet);
            indexedUsernames.remove(wallet.getAddress());
        }
        if (wallet.getUsername() != null) {
            Wallet holder = walletsByUsername.put(wallet.getUsername(), wallet);
            if (holder != null && holder != wallet) {
                log.warn("Username {} moved from {} to {}", wallet.getUsername(), holder.getAddress(), wallet.getAddress());
                indexedUsernames.remove(holder.getAddress());
                // the displaced holder no longer takes part in ranking
                holder.setVoteBalance(0);
                holder.setRate(0);
            }
            indexedUsernames.put(wallet.getAddress(), wallet.getUsername());
        }
    }

    @Override
    public List<Wallet> recomputeDelegateRanking(int activeDelegates) {
        if (activeDelegates <= 0) {
            throw new IllegalArgumentException("Active delegate count must be positive: " + activeDelegates);
        }

        List<Wallet> delegates = new ArrayList<>(walletsByUsername.values());
        delegates.forEach(delegate -> delegate.setVoteBalance(0));

        for (Wallet voter : walletsByAddress.values()) {
            if (voter.getVote() == null) {
                continue;
            }
            Wallet delegate = walletsByPublicKey.get(voter.getVote());
            if (delegate == null || !delegate.isDelegate() || walletsByUsername.get(delegate.getUsername()) != delegate) {
                log.warn("Wallet {} votes for {} which is not a registered delegate", voter.getAddress(), voter.getVote());
                continue;
            }
            delegate.setVoteBalance(delegate.getVoteBalance() + voter.getBalance());
        }

        delegates.sort(DELEGATE_ORDER);
        for (int i = 0; i < delegates.size(); i++) {
            delegates.get(i).setRate(i + 1);
        }

        this.activeDelegates = List.copyOf(delegates.subList(0, Math.min(activeDelegates, delegates.size())));
        log.debug("Ranked {} delegates, {} active", delegates.size(), this.activeDelegates.size());
        return this.activeDelegates;
    }

    @Override
    public List<Wallet> getActiveDelegates() {
        return activeDelegates;
    }

    @Override
    public Collection<Wallet> getWallets() {
        return Collections.unmodifiableCollection(walletsByAddress.values());
    }

    @Override
    public Collection<Wallet> getDelegates() {
        return Collections.unmodifiableCollection(walletsByUsername.values());
    }

    @Override
    public int countWallets() {
        return walletsByAddress.size();
    }

    @Override
    public int countDelegates() {
        return walletsByUsername.size();
    }

    @Override
    public Wallet seed(String address, String publicKey) {
        if (publicKey != null) {
            String derived = addressFactory.fromPublicKey(publicKey);
            if (!derived.equals(address)) {
                throw new IllegalArgumentException(
                    String.format("Public key %s belongs to %s, not %s", publicKey, derived, address));
            }
        }
        Wallet wallet = getWalletByAddress(address);
        if (publicKey != null) {
            wallet.setPublicKey(publicKey);
        }
        reindex(wallet);
        return wallet;
    }

    @Override
    public void reset() {
        walletsByAddress.clear();
        walletsByPublicKey.clear();
        walletsByUsername.clear();
        indexedUsernames.clear();
        activeDelegates = List.of();
    }
}
