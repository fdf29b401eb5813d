// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a GraphQL-over-HTTP round trip fails below the GraphQL layer.
 *
 * <p>
 * GraphQL errors reported by the server are not transport failures: they are returned as a
 * {@code Failure} response result. This exception covers everything that prevents a response
 * body from being obtained and decoded.
 *
 * <p>
 * The {@link #body()} carries the raw response text when one was received, which is usually
 * the most useful thing to log when an indexer or gateway answers with an HTML error page.
 */
public final class GraphqlRequestException extends ThegraphException {

    /**
     * Categorizes the transport failure.
     */
    public enum Kind {
        /** The request parameters could not be serialized to JSON. */
        REQUEST_SERIALIZATION,
        /** The HTTP request could not be sent (connect, I/O, timeout, interrupt). */
        REQUEST_SEND,
        /** The HTTP response could not be received or had an unusable status or body. */
        RESPONSE_RECV,
        /** The response body was not a valid GraphQL response. */
        RESPONSE_DESERIALIZATION
    }

    private final Kind kind;
    private final int status;
    private final @Nullable String body;

    public GraphqlRequestException(
            final Kind kind,
            final String message,
            final int status,
            final @Nullable String body,
            final @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
        this.body = body;
    }

    public GraphqlRequestException(final Kind kind, final String message, final @Nullable Throwable cause) {
        this(kind, message, -1, null, cause);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the HTTP status code, or {@code -1} when no response was received.
     */
    public int status() {
        return status;
    }

    public @Nullable String body() {
        return body;
    }

    // ═══════════════════════════════════════════════════════════════
    // Factory methods for specific error conditions
    // ═══════════════════════════════════════════════════════════════

    public static GraphqlRequestException serialization(final Throwable cause) {
        return new GraphqlRequestException(
                Kind.REQUEST_SERIALIZATION,
                "Error serializing GraphQL request parameters: " + cause.getMessage(),
                cause);
    }

    public static GraphqlRequestException send(final Throwable cause) {
        return new GraphqlRequestException(
                Kind.REQUEST_SEND,
                "Error making HTTP request: " + cause.getMessage(),
                cause);
    }

    public static GraphqlRequestException receive(final int status, final String reason) {
        return new GraphqlRequestException(
                Kind.RESPONSE_RECV,
                "Error receiving HTTP response (" + status + "): " + reason,
                status,
                null,
                null);
    }

    public static GraphqlRequestException deserialization(
            final int status, final String body, final Throwable cause) {
        return new GraphqlRequestException(
                Kind.RESPONSE_DESERIALIZATION,
                "Error deserializing GraphQL response. Unexpected response: " + body
                        + ". Error: " + cause.getMessage(),
                status,
                body,
                cause);
    }
}
