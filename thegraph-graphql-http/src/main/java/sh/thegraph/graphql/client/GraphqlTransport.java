// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql.client;

import java.net.URI;
import org.jspecify.annotations.Nullable;

import sh.thegraph.core.error.GraphqlRequestException;
import sh.thegraph.graphql.http.RequestParameters;
import sh.thegraph.graphql.http.ResponseBody;

/**
 * Low-level abstraction for one GraphQL-over-HTTP round trip.
 *
 * <p>
 * Implementations serialize the request, send it, negotiate the response media type and decode
 * the body into {@code data} and {@code errors}. They do not interpret GraphQL errors: those are
 * part of the returned {@link ResponseBody} and are classified by the caller.
 *
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe.
 *
 * <p>
 * <strong>Built-in Implementations:</strong>
 * <ul>
 * <li>{@link HttpGraphqlTransport} - {@code java.net.http} transport (default)</li>
 * </ul>
 *
 * @see GraphqlClient
 */
@FunctionalInterface
public interface GraphqlTransport extends AutoCloseable {

    /**
     * Sends a GraphQL request.
     *
     * @param url the GraphQL endpoint
     * @param bearerToken sent as {@code Authorization: Bearer <token>} when not null
     * @param request the request parameters
     * @return the decoded response body
     * @throws GraphqlRequestException if no decodable GraphQL response could be obtained
     */
    ResponseBody execute(URI url, @Nullable String bearerToken, RequestParameters request)
            throws GraphqlRequestException;

    /**
     * Creates the default HTTP transport.
     */
    static GraphqlTransport http() {
        return HttpGraphqlTransport.builder().build();
    }

    /**
     * Releases transport resources. The default implementation does nothing.
     */
    @Override
    default void close() {
        // Default no-op for transports that don't need cleanup
    }
}
