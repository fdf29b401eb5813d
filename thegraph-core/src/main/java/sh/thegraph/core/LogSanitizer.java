// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.core;

import java.util.regex.Pattern;

/**
 * Utility that removes credentials from debug log payloads.
 *
 * <p>
 * Performs two sanitization operations:
 * <ul>
 * <li>Redacts bearer tokens and {@code "authToken"} JSON values</li>
 * <li>Truncates excessively long logs</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length for sanitized log output. */
    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern BEARER_PATTERN =
            Pattern.compile("(?i)bearer\\s+[A-Za-z0-9._~+/=-]+");

    private static final String BEARER_REPLACEMENT = "Bearer ***[REDACTED]***";

    private static final Pattern AUTH_TOKEN_PATTERN =
            Pattern.compile("\"authToken\"\\s*:\\s*\"[^\"]+\"");

    private static final String AUTH_TOKEN_REPLACEMENT = "\"authToken\":\"***[REDACTED]***\"";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (containsIgnoreCase(sanitized, "bearer")) {
            sanitized = BEARER_PATTERN.matcher(sanitized).replaceAll(BEARER_REPLACEMENT);
        }

        if (sanitized.contains("\"authToken\"")) {
            sanitized = AUTH_TOKEN_PATTERN.matcher(sanitized).replaceAll(AUTH_TOKEN_REPLACEMENT);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }

    private static boolean containsIgnoreCase(final String value, final String needle) {
        for (int i = 0; i + needle.length() <= value.length(); i++) {
            if (value.regionMatches(true, i, needle, 0, needle.length())) {
                return true;
            }
        }
        return false;
    }
}
