package com.flagship.spv_ledger.crypto;

import com.flagship.spv_ledger.config.NetworkConstants;
import org.bouncycastle.crypto.digests.RIPEMD160Digest;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HexFormat;

/**
 * Derives and converts wallet addresses.
 *
 * An address is Base58Check(versionByte || RIPEMD160(publicKey)), 21 bytes before encoding.
 */
@Component
public class AddressFactory {

    public static final int ADDRESS_LENGTH = 21;
    public static final int PUBLIC_KEY_LENGTH = 33;

    private final int pubKeyHash;

    @Autowired
    public AddressFactory(NetworkConstants networkConstants) {
        this(networkConstants.getPubKeyHash());
    }

    public AddressFactory(int pubKeyHash) {
        if (pubKeyHash < 0 || pubKeyHash > 255) {
            throw new IllegalArgumentException("Address version byte out of range: " + pubKeyHash);
        }
        this.pubKeyHash = pubKeyHash;
    }

    public String fromPublicKey(String publicKeyHex) {
        byte[] publicKey = parsePublicKey(publicKeyHex);
        RIPEMD160Digest digest = new RIPEMD160Digest();
        digest.update(publicKey, 0, publicKey.length);
        byte[] raw = new byte[ADDRESS_LENGTH];
        raw[0] = (byte) pubKeyHash;
        digest.doFinal(raw, 1);
        return Base58Check.encode(raw);
    }

    public String encode(byte[] raw) {
        if (raw.length != ADDRESS_LENGTH) {
            throw new IllegalArgumentException("Raw address must be " + ADDRESS_LENGTH + " bytes, got " + raw.length);
        }
        return Base58Check.encode(raw);
    }

    public byte[] decode(String address) {
        byte[] raw = Base58Check.decode(address);
        if (raw.length != ADDRESS_LENGTH) {
            throw new IllegalArgumentException("Not a wallet address: " + address);
        }
        return raw;
    }

    public boolean isValid(String address) {
        try {
            return decode(address)[0] == (byte) pubKeyHash;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static byte[] parsePublicKey(String publicKeyHex) {
        byte[] publicKey;
        try {
            publicKey = HexFormat.of().parseHex(publicKeyHex);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Public key is not hex: " + publicKeyHex, e);
        }
        if (publicKey.length != PUBLIC_KEY_LENGTH) {
            throw new IllegalArgumentException(
                String.format("Public key must be %d bytes, got %d", PUBLIC_KEY_LENGTH, publicKey.length));
        }
        return publicKey;
    }
}
