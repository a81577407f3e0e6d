package br.edu.ifba.socialgraph.shared;

import java.nio.ByteBuffer;
import java.security.SecureRandom;
import java.util.UUID;

/**
 * Time-ordered UUID (version 7) generation for node, edge and job ids.
 */
public final class UuidUtils {

    private static final SecureRandom random = new SecureRandom();

    private UuidUtils() {
    }

    public static UUID randomV7() {
        final byte[] value = new byte[16];
        random.nextBytes(value);
        final ByteBuffer timestamp = ByteBuffer.allocate(Long.BYTES);
        timestamp.putLong(System.currentTimeMillis());
        System.arraycopy(timestamp.array(), 2, value, 0, 6);
        value[6] = (byte) ((value[6] & 0x0F) | 0x70);
        value[8] = (byte) ((value[8] & 0x3F) | 0x80);
        final ByteBuffer buf = ByteBuffer.wrap(value);
        return new UUID(buf.getLong(), buf.getLong());
    }

    /**
     * Parses a client supplied id, rejecting malformed values with {@link IllegalArgumentException}.
     */
    public static UUID parse(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(fieldName + " is not a valid UUID: " + value, e);
        }
    }
}
