package com.flagship.hospital_cash.db;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class BinaryUuidTest {

    @Test
    @DisplayName("Binary form is the big-endian hex of the canonical uuid")
    void testToBytes_MatchesUnhexOfCanonicalForm() {
        UUID uuid = UUID.fromString("957e4e79-a6bb-4b4d-a8f7-c42152b2c2f6");

        byte[] bytes = BinaryUuid.toBytes(uuid);

        assertEquals(16, bytes.length);
        assertArrayEquals(HexFormat.of().parseHex("957e4e79a6bb4b4da8f7c42152b2c2f6"), bytes);
    }

    @Test
    @DisplayName("Binary form read back from the database gives the canonical uuid")
    void testFromBytes_ParsesDatabaseValue() {
        byte[] stored = HexFormat.of().parseHex("c44619e0368344579a5b38f2a2c1e19c");

        assertEquals(UUID.fromString("c44619e0-3683-4457-9a5b-38f2a2c1e19c"), BinaryUuid.fromBytes(stored));
    }

    @Test
    @DisplayName("Null passes through in both directions")
    void testNulls() {
        assertNull(BinaryUuid.toBytes(null));
        assertNull(BinaryUuid.fromBytes(null));
    }

    @Test
    @DisplayName("Values that are not 16 bytes are rejected")
    void testFromBytes_WrongLength() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> BinaryUuid.fromBytes(new byte[] {1, 2, 3}));

        assertTrue(e.getMessage().contains("got 3"));
    }
}
