// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.core.error;

/**
 * Thrown when a single (non-paginated) subgraph query fails.
 *
 * <p>The message is the full, human-readable description of the failure: transport errors are
 * prefixed with the operation that failed, GraphQL errors list every server-reported message.
 */
public final class SubgraphQueryException extends ThegraphException {

    public SubgraphQueryException(final String message) {
        super(message);
    }

    public SubgraphQueryException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
