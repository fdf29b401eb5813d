// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.subgraphs;

import static sh.thegraph.graphql.internal.GraphqlJson.MAPPER;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.jspecify.annotations.Nullable;

import sh.thegraph.core.DebugLogger;
import sh.thegraph.core.GraphDebug.Category;
import sh.thegraph.core.LogFormatter;
import sh.thegraph.core.error.PaginatedQueryException;
import sh.thegraph.core.error.SubgraphQueryException;
import sh.thegraph.core.types.BlockPointer;
import sh.thegraph.graphql.Document;
import sh.thegraph.graphql.IntoDocument;
import sh.thegraph.graphql.client.GraphqlClient;
import sh.thegraph.graphql.client.GraphqlTransport;
import sh.thegraph.graphql.http.IntoRequestParameters;
import sh.thegraph.subgraphs.queries.MetaQueryResponse;
import sh.thegraph.subgraphs.queries.SubgraphQueries;

/**
 * Client for one subgraph endpoint.
 *
 * <p>The client remembers the highest block number any of its paginated queries has observed,
 * the watermark. Every paginated query starts at {@code number_gte: watermark}, so results never
 * go back in chain time, even when requests land on indexers that lag behind. A watermark of
 * {@code 0} means unknown: the next paginated query first asks the subgraph for its latest block.
 *
 * <pre>{@code
 * try (SubgraphClient client = SubgraphClient.builder(GraphqlTransport.http(), url)
 *         .authToken(apiKey)
 *         .build()) {
 *     List<Allocation> allocations = client.paginatedQuery(ALLOCATIONS_QUERY, 200, Allocation.class);
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> thread-safe. Concurrent queries share the watermark, which only ever
 * moves forward.
 */
public final class SubgraphClient implements AutoCloseable {

    private final GraphqlClient client;
    private final URI url;
    private final @Nullable String authToken;
    private final ReorgDetector reorgDetector;
    private final AtomicLong latestBlock;

    private SubgraphClient(final Builder builder) {
        this.client = new GraphqlClient(builder.transport);
        this.url = builder.url;
        this.authToken = builder.authToken;
        this.reorgDetector = builder.reorgDetector;
        this.latestBlock = new AtomicLong(builder.latestBlock);
    }

    public static Builder builder(final GraphqlTransport transport, final URI url) {
        return new Builder(transport, url);
    }

    /**
     * Creates a client without authentication over a default HTTP transport.
     */
    public static SubgraphClient create(final URI url) {
        return builder(GraphqlTransport.http(), url).build();
    }

    public URI url() {
        return url;
    }

    /**
     * Returns the highest block number observed so far, {@code 0} if unknown.
     */
    public long latestBlock() {
        return latestBlock.get();
    }

    /**
     * Sends a single query and returns its data.
     *
     * @throws SubgraphQueryException on transport failures, GraphQL errors or empty responses
     */
    public <T> T query(final IntoRequestParameters request, final Class<T> dataType) throws SubgraphQueryException {
        return query(request, MAPPER.constructType(dataType));
    }

    public <T> T query(final IntoRequestParameters request, final TypeReference<T> dataType)
            throws SubgraphQueryException {
        return query(request, MAPPER.getTypeFactory().constructType(dataType));
    }

    public <T> T query(final String query, final Class<T> dataType) throws SubgraphQueryException {
        return query(Document.of(query), dataType);
    }

    private <T> T query(final IntoRequestParameters request, final JavaType dataType) {
        Objects.requireNonNull(request, "request");
        return SubgraphQueries.sendSubgraphQuery(client, url, authToken, request, dataType);
    }

    /**
     * Fetches every entity matched by {@code query}, page by page, at or after the watermark.
     *
     * @param query the collection fragment; it must accept {@code $block}, {@code $first} and
     *        {@code $last}, see {@link PaginatedQuery}
     * @param pageSize entities per page, must be positive
     * @throws IllegalArgumentException if {@code pageSize} is not positive
     * @throws PaginatedQueryException if the bootstrap or any page fails
     */
    public <T> List<T> paginatedQuery(final IntoDocument query, final int pageSize, final Class<T> entityType)
            throws PaginatedQueryException {
        return paginatedQuery(query, pageSize, MAPPER.constructType(entityType));
    }

    public <T> List<T> paginatedQuery(
            final IntoDocument query, final int pageSize, final TypeReference<T> entityType)
            throws PaginatedQueryException {
        return paginatedQuery(query, pageSize, MAPPER.getTypeFactory().constructType(entityType));
    }

    public <T> List<T> paginatedQuery(final String query, final int pageSize, final Class<T> entityType)
            throws PaginatedQueryException {
        return paginatedQuery(Document.of(query), pageSize, entityType);
    }

    private <T> List<T> paginatedQuery(final IntoDocument query, final int pageSize, final JavaType entityType) {
        Objects.requireNonNull(query, "query");
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive, got " + pageSize);
        }

        long watermark = latestBlock.get();
        if (watermark == 0) {
            watermark = updateLatestBlock(bootstrap().number());
        }

        final PaginatedResult<T> result = new PaginatedQuery(client, url, authToken, reorgDetector)
                .send(query, BlockHeight.numberGte(watermark), pageSize, entityType);

        final @Nullable BlockPointer block = result.block();
        if (block != null) {
            watermark = updateLatestBlock(block.number());
        }
        DebugLogger.log(Category.PAGE, LogFormatter.formatPaginated(result.results().size(), block, watermark));
        return result.results();
    }

    private BlockPointer bootstrap() {
        final MetaQueryResponse response;
        try {
            response = SubgraphQueries.sendBootstrapMetaQuery(client, url, authToken);
        } catch (SubgraphQueryException e) {
            throw PaginatedQueryException.bootstrapMetaQueryFailed(e.getMessage(), e);
        }
        final BlockPointer block = response.meta().block();
        DebugLogger.log(Category.PAGE, LogFormatter.formatBootstrap(block.number(), block.hash().value()));
        return block;
    }

    /**
     * Raises the watermark to {@code blockNumber} if it is higher.
     *
     * @return the watermark after the update
     */
    long updateLatestBlock(final long blockNumber) {
        return latestBlock.accumulateAndGet(blockNumber, Math::max);
    }

    /**
     * Closes the underlying transport.
     */
    @Override
    public void close() {
        client.transport().close();
    }

    public static final class Builder {
        private final GraphqlTransport transport;
        private final URI url;
        private @Nullable String authToken;
        private long latestBlock;
        private ReorgDetector reorgDetector = ReorgDetector.graphNode();

        private Builder(final GraphqlTransport transport, final URI url) {
            this.transport = Objects.requireNonNull(transport, "transport");
            this.url = Objects.requireNonNull(url, "url");
        }

        /**
         * Sets the bearer token sent with every request.
         */
        public Builder authToken(final @Nullable String authToken) {
            this.authToken = authToken;
            return this;
        }

        /**
         * Sets the initial watermark; {@code 0} forces a bootstrap meta query.
         */
        public Builder latestBlock(final long latestBlock) {
            if (latestBlock < 0) {
                throw new IllegalArgumentException("latestBlock must not be negative, got " + latestBlock);
            }
            this.latestBlock = latestBlock;
            return this;
        }

        public Builder reorgDetector(final ReorgDetector reorgDetector) {
            this.reorgDetector = Objects.requireNonNull(reorgDetector, "reorgDetector");
            return this;
        }

        public SubgraphClient build() {
            return new SubgraphClient(this);
        }
    }
}
