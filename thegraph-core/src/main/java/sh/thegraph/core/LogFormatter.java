// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.core;

import java.util.Locale;

/**
 * Log formatter for subgraph queries and pagination runs.
 *
 * <p>
 * All formatters share one layout: an optional status symbol (✓ ✗ ○), a bracketed operation tag
 * and {@code key=value} pairs. Block hashes are shortened to {@code 0x1234...5678} and durations
 * are rendered as {@code 1.50ms} or {@code 2.10s}.
 *
 * <table border="1">
 * <tr><th>Method</th><th>Format</th><th>Use Case</th></tr>
 * <tr><td>formatQuery</td><td>[QUERY]</td><td>Successful GraphQL round trips</td></tr>
 * <tr><td>formatQueryError</td><td>✗ [QUERY-ERROR]</td><td>Transport failures</td></tr>
 * <tr><td>formatBootstrap</td><td>[BOOTSTRAP]</td><td>Watermark bootstrap meta query</td></tr>
 * <tr><td>formatPage</td><td>[PAGE]</td><td>One received page</td></tr>
 * <tr><td>formatReorg</td><td>○ [REORG]</td><td>Indexer reported a purged block</td></tr>
 * <tr><td>formatPaginated</td><td>✓ [PAGINATED]</td><td>Completed pagination run</td></tr>
 * </table>
 *
 * <p>All methods are pure and thread-safe.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    /** Characters kept at the start of a shortened hash, "0x" included. */
    private static final int HASH_PREFIX_LENGTH = 6;

    /** Characters kept at the end of a shortened hash. */
    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: [QUERY] url=https://gateway/api/subgraphs/id/... status=200 media=legacy duration=12.40ms
     */
    public static String formatQuery(String url, int status, String mediaType, long durationMicros) {
        return String.format(
                "[QUERY] url=%s status=%d media=%s %s",
                url, status, mediaType, duration(durationMicros));
    }

    /**
     * Format: ✗ [QUERY-ERROR] url=... kind=RESPONSE_RECV message=... duration=1.50ms
     */
    public static String formatQueryError(String url, Object kind, String message, long durationMicros) {
        return String.format(
                "✗ [QUERY-ERROR] url=%s kind=%s message=%s %s",
                url, kind, message, duration(durationMicros));
    }

    /**
     * Format: [BOOTSTRAP] block=18627000 hash=0x1234...5678
     */
    public static String formatBootstrap(long blockNumber, String blockHash) {
        return String.format(
                "[BOOTSTRAP] block=%d hash=%s",
                blockNumber, shortenHash(blockHash));
    }

    /**
     * Format: [PAGE] block=18627000 hash=0x1234...5678 items=200 last=0xabc...
     */
    public static String formatPage(long blockNumber, String blockHash, int items, String lastId) {
        return String.format(
                "[PAGE] block=%d hash=%s items=%d last=%s",
                blockNumber, shortenHash(blockHash), items, lastId);
    }

    /**
     * Format: ○ [REORG] height={hash=0x...} message=no block with that hash found
     */
    public static String formatReorg(Object blockHeight, String message) {
        return String.format("○ [REORG] height=%s message=%s", blockHeight, message);
    }

    /**
     * Format: ✓ [PAGINATED] items=1200 block=18627004 watermark=18627004
     */
    public static String formatPaginated(int items, Object block, long watermark) {
        return String.format(
                "✓ [PAGINATED] items=%d block=%s watermark=%d",
                items, block, watermark);
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format(Locale.ROOT, "%.2fms", ms);
        } else {
            formatted = String.format(Locale.ROOT, "%.2fs", ms / 1000.0);
        }
        return "duration=" + formatted;
    }

    /**
     * Shortens a hash to {@code 0xabcd...ef12}; short or null values are returned unchanged.
     */
    static String shortenHash(String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
