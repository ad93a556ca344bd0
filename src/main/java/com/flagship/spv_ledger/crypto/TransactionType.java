package com.flagship.spv_ledger.crypto;

/**
 * Transaction types with the numeric codes stored in the {@code transactions.type} column.
 */
public enum TransactionType {
    TRANSFER(0),
    SECOND_SIGNATURE(1),
    DELEGATE_REGISTRATION(2),
    VOTE(3),
    MULTI_SIGNATURE(4);

    private final int code;

    TransactionType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static TransactionType fromCode(int code) {
        for (TransactionType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + code);
    }
}
