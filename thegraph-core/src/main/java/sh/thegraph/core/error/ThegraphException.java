// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Base runtime exception for all client failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * ThegraphException
 * ├── {@link GraphqlRequestException} - GraphQL-over-HTTP transport failures
 * ├── {@link SubgraphQueryException} - single subgraph query failures
 * └── {@link PaginatedQueryException} - paginated query failures (closed set of kinds)
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     List<Subgraph> subgraphs = client.paginatedQuery(SUBGRAPHS, 200, Subgraph.class);
 * } catch (PaginatedQueryException e) {
 *     if (e.kind() == PaginatedQueryException.Kind.REORG_DETECTED) {
 *         // start over from a fresh block
 *     }
 * } catch (ThegraphException e) {
 *     // any other client error
 * }
 * }</pre>
 */
public sealed class ThegraphException extends RuntimeException
        permits GraphqlRequestException,
        SubgraphQueryException,
        PaginatedQueryException {

    public ThegraphException(final String message) {
        super(message);
    }

    public ThegraphException(final String message, final @Nullable Throwable cause) {
        super(message, cause);
    }
}
