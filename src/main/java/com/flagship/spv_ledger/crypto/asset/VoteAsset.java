package com.flagship.spv_ledger.crypto.asset;

import com.flagship.spv_ledger.crypto.TransactionType;
import lombok.Value;

import java.util.List;

/**
 * Vote or unvote operations, each encoded as {@code +<publicKey>} or {@code -<publicKey>}.
 */
@Value
public class VoteAsset implements TransactionAsset {

    public static final char VOTE_PREFIX = '+';
    public static final char UNVOTE_PREFIX = '-';

    List<String> votes;

    public VoteAsset(List<String> votes) {
        for (String vote : votes) {
            if (vote.length() < 2 || (vote.charAt(0) != VOTE_PREFIX && vote.charAt(0) != UNVOTE_PREFIX)) {
                throw new IllegalArgumentException("Vote must start with '+' or '-': " + vote);
            }
        }
        this.votes = List.copyOf(votes);
    }

    public static VoteAsset vote(String delegatePublicKey) {
        return new VoteAsset(List.of(VOTE_PREFIX + delegatePublicKey));
    }

    public static VoteAsset unvote(String delegatePublicKey) {
        return new VoteAsset(List.of(UNVOTE_PREFIX + delegatePublicKey));
    }

    @Override
    public TransactionType getType() {
        return TransactionType.VOTE;
    }
}
