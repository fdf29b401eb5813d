// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.subgraphs.queries;

import com.fasterxml.jackson.databind.JavaType;
import java.net.URI;
import org.jspecify.annotations.Nullable;

import sh.thegraph.core.error.GraphqlRequestException;
import sh.thegraph.core.error.SubgraphQueryException;
import sh.thegraph.graphql.Document;
import sh.thegraph.graphql.IntoDocument;
import sh.thegraph.graphql.client.GraphqlClient;
import sh.thegraph.graphql.http.IntoRequestParameters;
import sh.thegraph.graphql.http.ResponseResult;
import sh.thegraph.subgraphs.BlockHeight;

/**
 * Authenticated subgraph requests: plain queries, the bootstrap meta query and page queries.
 *
 * <p>Subgraphs sometimes fall behind, because they fail or because the indexer has issues. The
 * {@code _meta} field can be added to any query to learn against which block it was effectively
 * executed; the bootstrap meta query asks for nothing else.
 */
public final class SubgraphQueries {

    /** Selects the block the subgraph has progressed to. */
    public static final Document META_QUERY_DOCUMENT =
            Document.of("{ meta: _meta { block { number hash } } }");

    private SubgraphQueries() {
    }

    /**
     * Sends a query and returns the classified response.
     *
     * @throws GraphqlRequestException on transport failures
     */
    public static <T> ResponseResult<T> sendQuery(
            final GraphqlClient client,
            final URI url,
            final @Nullable String authToken,
            final IntoRequestParameters query,
            final JavaType dataType) throws GraphqlRequestException {
        return client.send(url, authToken, query, dataType);
    }

    /**
     * Sends a query and returns its data.
     *
     * @throws SubgraphQueryException on transport failures, GraphQL errors or empty responses
     */
    public static <T> T sendSubgraphQuery(
            final GraphqlClient client,
            final URI url,
            final @Nullable String authToken,
            final IntoRequestParameters query,
            final JavaType dataType) throws SubgraphQueryException {
        final ResponseResult<T> result;
        try {
            result = sendQuery(client, url, authToken, query, dataType);
        } catch (GraphqlRequestException e) {
            throw new SubgraphQueryException("Error sending subgraph graphql query: " + e.getMessage(), e);
        }
        return unwrap(result);
    }

    /**
     * Fetches the latest block the subgraph has progressed to.
     *
     * @throws SubgraphQueryException on transport failures, GraphQL errors or empty responses
     */
    public static MetaQueryResponse sendBootstrapMetaQuery(
            final GraphqlClient client,
            final URI url,
            final @Nullable String authToken) throws SubgraphQueryException {
        final ResponseResult<MetaQueryResponse> result;
        try {
            result = client.send(url, authToken, META_QUERY_DOCUMENT, MetaQueryResponse.class);
        } catch (GraphqlRequestException e) {
            throw new SubgraphQueryException("Error sending subgraph meta query: " + e.getMessage(), e);
        }
        return unwrap(result);
    }

    /**
     * Sends one page of a paginated query.
     *
     * @param last id of the last entity of the previous page, null for the first page
     * @throws GraphqlRequestException on transport failures
     */
    public static ResponseResult<PageResponse> sendPageQuery(
            final GraphqlClient client,
            final URI url,
            final @Nullable String authToken,
            final IntoDocument query,
            final BlockHeight blockHeight,
            final int pageSize,
            final @Nullable String last) throws GraphqlRequestException {
        return client.send(url, authToken, new PageQuery(query, blockHeight, pageSize, last), PageResponse.class);
    }

    private static <T> T unwrap(final ResponseResult<T> result) {
        if (result instanceof ResponseResult.Data<T> data) {
            return data.value();
        }
        throw new SubgraphQueryException(result.toString());
    }
}
