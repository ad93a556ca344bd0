package com.flagship.spv_ledger.crypto.asset;

import com.flagship.spv_ledger.crypto.TransactionType;
import lombok.Value;

import java.util.List;

/**
 * Registers an m-of-n signing group. Keysgroup entries are {@code +<publicKey>}.
 */
@Value
public class MultiSignatureAsset implements TransactionAsset {
    int min;
    int lifetime;
    List<String> keysgroup;

    public MultiSignatureAsset(int min, int lifetime, List<String> keysgroup) {
        if (min < 1 || min > keysgroup.size()) {
            throw new IllegalArgumentException(
                String.format("Multisignature minimum %d out of range for %d keys", min, keysgroup.size()));
        }
        this.min = min;
        this.lifetime = lifetime;
        this.keysgroup = List.copyOf(keysgroup);
    }

    @Override
    public TransactionType getType() {
        return TransactionType.MULTI_SIGNATURE;
    }
}
