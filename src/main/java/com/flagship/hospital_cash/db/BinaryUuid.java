package com.flagship.hospital_cash.db;

import java.nio.ByteBuffer;
import java.util.UUID;

/**
 * Converts UUIDs to and from the 16-byte form stored in BINARY(16) columns.
 *
 * Byte order is big-endian: most significant bits first, matching
 * MySQL's UUID_TO_BIN(uuid) without the swap flag.
 */
public final class BinaryUuid {

    public static final int LENGTH = 16;

    private BinaryUuid() {
        // Utility class
    }

    /**
     * @return the binary form, or null when uuid is null
     */
    public static byte[] toBytes(UUID uuid) {
        if (uuid == null) {
            return null;
        }
        return ByteBuffer.allocate(LENGTH)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits())
                .array();
    }

    /**
     * @return the UUID, or null when bytes is null
     * @throws IllegalArgumentException if bytes is not exactly 16 bytes long
     */
    public static UUID fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                    "Binary UUID must be " + LENGTH + " bytes, got " + bytes.length);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        return new UUID(buffer.getLong(), buffer.getLong());
    }
}
