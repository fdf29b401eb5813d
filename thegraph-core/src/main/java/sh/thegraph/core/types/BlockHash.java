// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.core.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.thegraph.core.util.Hex;

/**
 * Hex-encoded 32-byte block hash.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 64 hex characters long (32 bytes)</li>
 * </ul>
 * Values are normalized to lowercase, which is also how they are sent back to the indexer in
 * {@code block: { hash: ... }} filters.
 */
public record BlockHash(@JsonValue String value) {
    private static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    public BlockHash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid block hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BlockHash of(final String value) {
        return new BlockHash(value);
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public static BlockHash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Block hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new BlockHash(Hex.encode(bytes));
    }

    @Override
    public String toString() {
        return value;
    }
}
