// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.core.error;

import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a paginated subgraph query fails.
 *
 * <p>Every failure terminates the run; the kind tells the caller what recovery makes sense.
 * {@link Kind#REORG_DETECTED} is kept apart from {@link Kind#RESPONSE_ERROR} so callers can
 * restart from a fresh block instead of treating it as a broken query.
 */
public final class PaginatedQueryException extends ThegraphException {

    /**
     * The closed set of paginated query failures.
     */
    public enum Kind {
        /** The bootstrap meta query failed. */
        BOOTSTRAP_META_QUERY_FAILED,
        /** The first page came back with neither data nor errors, or with no results. */
        EMPTY_RESPONSE,
        /** The indexer no longer has the block the run was pinned to. */
        REORG_DETECTED,
        /** One of the page requests failed at the transport level. */
        REQUEST_ERROR,
        /** The indexer returned GraphQL errors for one of the pages. */
        RESPONSE_ERROR,
        /** A page entity could not be decoded. */
        DESERIALIZATION_ERROR
    }

    private final Kind kind;
    private final List<String> errors;

    private PaginatedQueryException(
            final Kind kind, final String message, final List<String> errors, final @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.errors = List.copyOf(errors);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the server-reported messages of a {@link Kind#RESPONSE_ERROR}, empty otherwise.
     */
    public List<String> errors() {
        return errors;
    }

    // ═══════════════════════════════════════════════════════════════
    // Factory methods, one per kind
    // ═══════════════════════════════════════════════════════════════

    public static PaginatedQueryException bootstrapMetaQueryFailed(final String reason, final @Nullable Throwable cause) {
        return new PaginatedQueryException(
                Kind.BOOTSTRAP_META_QUERY_FAILED, "bootstrap meta query failed: " + reason, List.of(), cause);
    }

    public static PaginatedQueryException emptyResponse() {
        return new PaginatedQueryException(Kind.EMPTY_RESPONSE, "empty response", List.of(), null);
    }

    public static PaginatedQueryException reorgDetected() {
        return new PaginatedQueryException(Kind.REORG_DETECTED, "reorg detected", List.of(), null);
    }

    public static PaginatedQueryException requestError(final String reason, final @Nullable Throwable cause) {
        return new PaginatedQueryException(Kind.REQUEST_ERROR, "request error: " + reason, List.of(), cause);
    }

    public static PaginatedQueryException responseError(final List<String> errors) {
        Objects.requireNonNull(errors, "errors");
        return new PaginatedQueryException(Kind.RESPONSE_ERROR, "response error: " + errors, errors, null);
    }

    public static PaginatedQueryException deserializationError(final String reason, final @Nullable Throwable cause) {
        return new PaginatedQueryException(
                Kind.DESERIALIZATION_ERROR, "deserialization error: " + reason, List.of(), cause);
    }
}
