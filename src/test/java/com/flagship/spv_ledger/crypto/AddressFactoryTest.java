package com.flagship.spv_ledger.crypto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddressFactoryTest {

    private static final String KNOWN_PUBLIC_KEY = "034151a3ec46b5670a682b0a63394f863587d1bc97483b1b6c70eb58e7f0aed192";

    private final AddressFactory mainnet = new AddressFactory(23);
    private final AddressFactory devnet = new AddressFactory(30);

    @Test
    @DisplayName("Address derivation matches known vectors for both version bytes")
    void testFromPublicKey_KnownVectors() {
        assertEquals("AGeYmgbg2LgGxRW2vNNJvQ88PknEJsYizC", mainnet.fromPublicKey(KNOWN_PUBLIC_KEY));
        assertEquals("D61mfSggzbvQgTUe6JhYKH2doHaqJ3Dyib", devnet.fromPublicKey(KNOWN_PUBLIC_KEY));
        assertEquals("ANkKqpoTZpT5h6Yi57foFG5pCNgkHxB94Y", mainnet.fromPublicKey("02" + "11".repeat(32)));
    }

    @Test
    @DisplayName("Decoding an address yields the version byte and 20-byte hash")
    void testDecode_RoundTripsThroughEncode() {
        String address = mainnet.fromPublicKey(KNOWN_PUBLIC_KEY);
        byte[] raw = mainnet.decode(address);

        assertEquals(AddressFactory.ADDRESS_LENGTH, raw.length);
        assertEquals(23, raw[0]);
        assertEquals(address, mainnet.encode(raw));
    }

    @Test
    @DisplayName("Validity depends on checksum and network version byte")
    void testIsValid() {
        String mainnetAddress = mainnet.fromPublicKey(KNOWN_PUBLIC_KEY);
        String tampered = mainnetAddress.substring(0, mainnetAddress.length() - 1)
            + (mainnetAddress.endsWith("C") ? "D" : "C");

        assertTrue(mainnet.isValid(mainnetAddress));
        assertFalse(devnet.isValid(mainnetAddress), "Mainnet address is not valid on devnet");
        assertFalse(mainnet.isValid(tampered), "Checksum must catch a changed character");
        assertFalse(mainnet.isValid("not-base58-0OIl"));
    }

    @Test
    @DisplayName("Malformed public keys are rejected")
    void testFromPublicKey_RejectsMalformedKeys() {
        assertThrows(IllegalArgumentException.class, () -> mainnet.fromPublicKey("02abcd"));
        assertThrows(IllegalArgumentException.class, () -> mainnet.fromPublicKey("zz" + "11".repeat(32)));
    }

    @Test
    @DisplayName("Raw addresses of the wrong length cannot be encoded")
    void testEncode_RejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> mainnet.encode(new byte[20]));
    }

    @Test
    @DisplayName("Base58 keeps leading zero bytes as leading '1' characters")
    void testBase58_LeadingZeros() {
        byte[] input = {0, 0, 1, 2, 3};

        assertEquals("11Ldp", Base58Check.encodePlain(input));
        assertArrayEquals(input, Base58Check.decodePlain("11Ldp"));
    }
}
