package com.flagship.spv_ledger.crypto;

import com.flagship.spv_ledger.crypto.asset.MultiSignatureAsset;
import com.flagship.spv_ledger.crypto.asset.VoteAsset;
import com.flagship.spv_ledger.support.LedgerFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BinaryTransactionCodecTest {

    private static final HexFormat HEX = HexFormat.of();

    private final AddressFactory addressFactory = new AddressFactory(23);
    private final BinaryTransactionCodec codec = new BinaryTransactionCodec(addressFactory);

    private final String sender = LedgerFixtures.publicKey(1);
    private final String delegate = LedgerFixtures.publicKey(2);

    @Test
    @DisplayName("Transfer payload decodes to amount, fee and recipient")
    void testDeserialize_Transfer() {
        String recipient = addressFactory.fromPublicKey(delegate);
        Transaction original = LedgerFixtures.transfer(sender, recipient, 125_000_000L, 10_000_000L);

        Transaction decoded = codec.deserialize(HEX.formatHex(codec.serialize(original)));

        assertEquals(TransactionType.TRANSFER, decoded.getType());
        assertEquals(125_000_000L, decoded.getAmount());
        assertEquals(10_000_000L, decoded.getFee());
        assertEquals(recipient, decoded.getRecipientId());
        assertEquals(sender, decoded.getSenderPublicKey());
        assertEquals(original.getTimestamp(), decoded.getTimestamp());
        assertNull(decoded.getSignature());
    }

    @Test
    @DisplayName("Vote payload keeps vote and unvote prefixes in order")
    void testDeserialize_VotePrefixes() {
        Transaction original = LedgerFixtures.vote(sender, 1, "-" + sender, "+" + delegate);

        VoteAsset votes = codec.deserialize(HEX.formatHex(codec.serialize(original))).getVotes();

        assertEquals(List.of("-" + sender, "+" + delegate), votes.getVotes());
    }

    @Test
    @DisplayName("Multisignature payload exposes min, lifetime and prefixed keysgroup")
    void testDeserialize_MultiSignature() {
        Transaction original = LedgerFixtures.multiSignature(sender, 2, 24, delegate, LedgerFixtures.publicKey(3));

        MultiSignatureAsset asset = codec.deserialize(HEX.formatHex(codec.serialize(original))).getMultiSignature();

        assertEquals(2, asset.getMin());
        assertEquals(24, asset.getLifetime());
        assertEquals(List.of("+" + delegate, "+" + LedgerFixtures.publicKey(3)), asset.getKeysgroup());
    }

    @Test
    @DisplayName("Vendor field and signature survive encoding")
    void testDeserialize_VendorFieldAndSignature() {
        Transaction original = LedgerFixtures.delegateRegistration(sender, "genesis_1").toBuilder()
            .vendorField("hello")
            .signature("3044" + "ab".repeat(10))
            .build();

        Transaction decoded = codec.deserialize(HEX.formatHex(codec.serialize(original)));

        assertEquals("genesis_1", decoded.getDelegate().getUsername());
        assertEquals("hello", decoded.getVendorField());
        assertEquals("3044" + "ab".repeat(10), decoded.getSignature());
    }

    @Test
    @DisplayName("Asking for the wrong asset type fails as a decode error")
    void testAssetAccess_WrongType() {
        Transaction transfer = LedgerFixtures.transfer(sender, addressFactory.fromPublicKey(delegate), 1, 1);

        assertThrows(TransactionDecodeException.class, transfer::getSecondSignature);
        assertThrows(TransactionDecodeException.class, transfer::getVotes);
    }

    @Test
    @DisplayName("Malformed payloads are rejected with TransactionDecodeException")
    void testDeserialize_MalformedPayloads() {
        byte[] valid = codec.serialize(LedgerFixtures.secondSignature(sender, delegate, 5));
        String validHex = HEX.formatHex(valid);

        byte[] badMarker = valid.clone();
        badMarker[0] = 0x00;
        byte[] unknownType = valid.clone();
        unknownType[3] = 9;

        assertThrows(TransactionDecodeException.class, () -> codec.deserialize(""));
        assertThrows(TransactionDecodeException.class, () -> codec.deserialize(null));
        assertThrows(TransactionDecodeException.class, () -> codec.deserialize("xyz"));
        assertThrows(TransactionDecodeException.class, () -> codec.deserialize(validHex.substring(0, 40)));
        assertThrows(TransactionDecodeException.class, () -> codec.deserialize(HEX.formatHex(badMarker)));
        assertThrows(TransactionDecodeException.class, () -> codec.deserialize(HEX.formatHex(unknownType)));
    }

    @Test
    @DisplayName("Vote prefix bytes other than 0 and 1 are rejected")
    void testDeserialize_InvalidVotePrefix() {
        byte[] payload = codec.serialize(LedgerFixtures.vote(sender, 1, "+" + delegate));
        // header 1+1+1+1+4+33+8, empty vendor field 1, vote count 1
        int prefixOffset = 51;
        assertEquals(1, payload[prefixOffset]);
        payload[prefixOffset] = 7;

        assertThrows(TransactionDecodeException.class, () -> codec.deserialize(HEX.formatHex(payload)));
    }

    @Test
    @DisplayName("Transaction id is the SHA-256 of the serialized payload")
    void testComputeId() {
        byte[] payload = codec.serialize(LedgerFixtures.delegateRegistration(sender, "alice"));

        String id = codec.computeId(payload);

        assertEquals(64, id.length());
        assertEquals(id, codec.computeId(payload.clone()));
        assertNotEquals(id, codec.computeId(codec.serialize(LedgerFixtures.delegateRegistration(sender, "alice"))),
            "Fixtures use fresh timestamps, so ids differ");
    }
}
