package com.flagship.spv_ledger.crypto;

import com.flagship.spv_ledger.crypto.asset.DelegateAsset;
import com.flagship.spv_ledger.crypto.asset.MultiSignatureAsset;
import com.flagship.spv_ledger.crypto.asset.SecondSignatureAsset;
import com.flagship.spv_ledger.crypto.asset.TransactionAsset;
import com.flagship.spv_ledger.crypto.asset.TransferAsset;
import com.flagship.spv_ledger.crypto.asset.VoteAsset;
import lombok.Builder;
import lombok.Value;

/**
 * A decoded transaction. The asset carries the fields of its type only.
 *
 * Signatures are kept as opaque hex; nothing in the rebuild verifies them.
 */
@Value
@Builder(toBuilder = true)
public class Transaction {
    @Builder.Default
    int version = 1;
    int network;
    long timestamp;
    String senderPublicKey;
    long fee;
    String vendorField;
    TransactionAsset asset;
    String signature;

    public TransactionType getType() {
        return asset.getType();
    }

    /**
     * Amount moved to the recipient, zero for everything but transfers.
     */
    public long getAmount() {
        return asset instanceof TransferAsset transfer ? transfer.getAmount() : 0L;
    }

    public String getRecipientId() {
        return asset instanceof TransferAsset transfer ? transfer.getRecipientId() : null;
    }

    public SecondSignatureAsset getSecondSignature() {
        return getAsset(SecondSignatureAsset.class);
    }

    public DelegateAsset getDelegate() {
        return getAsset(DelegateAsset.class);
    }

    public VoteAsset getVotes() {
        return getAsset(VoteAsset.class);
    }

    public MultiSignatureAsset getMultiSignature() {
        return getAsset(MultiSignatureAsset.class);
    }

    private <T extends TransactionAsset> T getAsset(Class<T> assetType) {
        if (!assetType.isInstance(asset)) {
            throw new TransactionDecodeException(
                String.format("Expected %s asset but payload decoded as %s", assetType.getSimpleName(), getType()));
        }
        return assetType.cast(asset);
    }
}
