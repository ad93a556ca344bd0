package com.flagship.spv_ledger.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * Base58 encoding with a 4-byte double SHA-256 checksum, as used for wallet addresses.
 */
public final class Base58Check {

    private static final char[] ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz".toCharArray();
    private static final int[] INDEXES = new int[128];
    private static final int CHECKSUM_LENGTH = 4;

    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET.length; i++) {
            INDEXES[ALPHABET[i]] = i;
        }
    }

    private Base58Check() {
    }

    public static String encode(byte[] payload) {
        byte[] checksum = Arrays.copyOf(doubleSha256(payload), CHECKSUM_LENGTH);
        byte[] data = new byte[payload.length + CHECKSUM_LENGTH];
        System.arraycopy(payload, 0, data, 0, payload.length);
        System.arraycopy(checksum, 0, data, payload.length, CHECKSUM_LENGTH);
        return encodePlain(data);
    }

    /**
     * @throws IllegalArgumentException if the input is not Base58 or the checksum does not match
     */
    public static byte[] decode(String encoded) {
        byte[] data = decodePlain(encoded);
        if (data.length < CHECKSUM_LENGTH) {
            throw new IllegalArgumentException("Base58Check input too short: " + encoded);
        }
        byte[] payload = Arrays.copyOfRange(data, 0, data.length - CHECKSUM_LENGTH);
        byte[] checksum = Arrays.copyOfRange(data, data.length - CHECKSUM_LENGTH, data.length);
        byte[] expected = Arrays.copyOf(doubleSha256(payload), CHECKSUM_LENGTH);
        if (!MessageDigest.isEqual(checksum, expected)) {
            throw new IllegalArgumentException("Invalid Base58Check checksum: " + encoded);
        }
        return payload;
    }

    static String encodePlain(byte[] input) {
        if (input.length == 0) {
            return "";
        }
        byte[] number = Arrays.copyOf(input, input.length);
        int zeros = 0;
        while (zeros < number.length && number[zeros] == 0) {
            ++zeros;
        }
        char[] encoded = new char[number.length * 2];
        int outputStart = encoded.length;
        int startAt = zeros;
        while (startAt < number.length) {
            int remainder = divmod(number, startAt, 256, 58);
            if (number[startAt] == 0) {
                ++startAt;
            }
            encoded[--outputStart] = ALPHABET[remainder];
        }
        while (zeros-- > 0) {
            encoded[--outputStart] = ALPHABET[0];
        }
        return new String(encoded, outputStart, encoded.length - outputStart);
    }

    static byte[] decodePlain(String input) {
        if (input.isEmpty()) {
            return new byte[0];
        }
        byte[] input58 = new byte[input.length()];
        for (int i = 0; i < input.length(); ++i) {
            char c = input.charAt(i);
            int digit = c < 128 ? INDEXES[c] : -1;
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid Base58 character '" + c + "' at position " + i);
            }
            input58[i] = (byte) digit;
        }
        int zeros = 0;
        while (zeros < input58.length && input58[zeros] == 0) {
            ++zeros;
        }
        byte[] decoded = new byte[input.length()];
        int outputStart = decoded.length;
        int startAt = zeros;
        while (startAt < input58.length) {
            int remainder = divmod(input58, startAt, 58, 256);
            if (input58[startAt] == 0) {
                ++startAt;
            }
            decoded[--outputStart] = (byte) remainder;
        }
        while (outputStart < decoded.length && decoded[outputStart] == 0) {
            ++outputStart;
        }
        return Arrays.copyOfRange(decoded, outputStart - zeros, decoded.length);
    }

    // Divides the big-endian number in place and returns the remainder.
    private static int divmod(byte[] number, int startAt, int base, int divisor) {
        int remainder = 0;
        for (int i = startAt; i < number.length; i++) {
            int digit = number[i] & 0xFF;
            int temp = remainder * base + digit;
            number[i] = (byte) (temp / divisor);
            remainder = temp % divisor;
        }
        return remainder;
    }

    private static byte[] doubleSha256(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
