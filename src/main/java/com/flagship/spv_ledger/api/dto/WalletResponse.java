package com.flagship.spv_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.spv_ledger.crypto.asset.MultiSignatureAsset;
import com.flagship.spv_ledger.ledger.LastBlock;
import com.flagship.spv_ledger.ledger.Wallet;
import lombok.Builder;
import lombok.Value;

/**
 * Response DTO for wallets and delegates. Delegate-only fields are omitted for plain wallets.
 */
@Value
@Builder
public class WalletResponse {

    @JsonProperty("address")
    String address;

    @JsonProperty("public_key")
    String publicKey;

    @JsonProperty("second_public_key")
    String secondPublicKey;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("vote")
    String vote;

    @JsonProperty("username")
    String username;

    @JsonProperty("vote_balance")
    Long voteBalance;

    @JsonProperty("rate")
    Integer rate;

    @JsonProperty("forged_fees")
    Long forgedFees;

    @JsonProperty("forged_rewards")
    Long forgedRewards;

    @JsonProperty("produced_blocks")
    Long producedBlocks;

    @JsonProperty("last_block")
    LastBlock lastBlock;

    @JsonProperty("multisignature")
    MultiSignatureAsset multisignature;

    public static WalletResponse from(Wallet wallet) {
        WalletResponseBuilder builder = WalletResponse.builder()
            .address(wallet.getAddress())
            .publicKey(wallet.getPublicKey())
            .secondPublicKey(wallet.getSecondPublicKey())
            .balance(wallet.getBalance())
            .vote(wallet.getVote())
            .lastBlock(wallet.getLastBlock())
            .multisignature(wallet.getMultisignature());

        if (wallet.isDelegate()) {
            builder.username(wallet.getUsername())
                .voteBalance(wallet.getVoteBalance())
                .rate(wallet.getRate())
                .forgedFees(wallet.getForgedFees())
                .forgedRewards(wallet.getForgedRewards())
                .producedBlocks(wallet.getProducedBlocks());
        }
        return builder.build();
    }
}
