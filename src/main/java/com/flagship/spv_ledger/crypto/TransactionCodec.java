package com.flagship.spv_ledger.crypto;

/**
 * Converts transactions to and from their stored binary form.
 */
public interface TransactionCodec {

    /**
     * Decodes a hex-encoded payload.
     *
     * @throws TransactionDecodeException if the payload is malformed
     */
    Transaction deserialize(String hexPayload);

    byte[] serialize(Transaction transaction);

    /**
     * Transaction id: hex SHA-256 of the serialized bytes.
     */
    String computeId(byte[] serialized);
}
