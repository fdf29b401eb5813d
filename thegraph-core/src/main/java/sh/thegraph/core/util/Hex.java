// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.core.util;

/**
 * Hex encoding for block hashes and other fixed-size chain values.
 */
public final class Hex {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private Hex() {
    }

    /**
     * Decodes a hex string, with or without {@code 0x} prefix.
     *
     * @throws IllegalArgumentException if the input is null, odd-length or not hex
     */
    public static byte[] decode(final String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Hex string cannot be null");
        }
        final String digits = hasPrefix(hex) ? hex.substring(2) : hex;
        if ((digits.length() & 1) == 1) {
            throw new IllegalArgumentException("Hex string must have an even length: " + hex);
        }
        final byte[] out = new byte[digits.length() / 2];
        for (int i = 0; i < out.length; i++) {
            final int high = Character.digit(digits.charAt(i * 2), 16);
            final int low = Character.digit(digits.charAt(i * 2 + 1), 16);
            if (high < 0 || low < 0) {
                throw new IllegalArgumentException("Invalid hex character in: " + hex);
            }
            out[i] = (byte) ((high << 4) | low);
        }
        return out;
    }

    /**
     * Encodes bytes as lowercase hex with a {@code 0x} prefix.
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Bytes cannot be null");
        }
        final StringBuilder sb = new StringBuilder(2 + bytes.length * 2).append("0x");
        for (byte b : bytes) {
            sb.append(DIGITS[(b >>> 4) & 0x0F]).append(DIGITS[b & 0x0F]);
        }
        return sb.toString();
    }

    public static boolean hasPrefix(final String hex) {
        return hex != null
                && hex.length() >= 2
                && hex.charAt(0) == '0'
                && (hex.charAt(1) == 'x' || hex.charAt(1) == 'X');
    }
}
