// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.subgraphs;

import static sh.thegraph.graphql.internal.GraphqlJson.MAPPER;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

import sh.thegraph.core.DebugLogger;
import sh.thegraph.core.GraphDebug.Category;
import sh.thegraph.core.LogFormatter;
import sh.thegraph.core.error.GraphqlRequestException;
import sh.thegraph.core.error.PaginatedQueryException;
import sh.thegraph.core.types.BlockPointer;
import sh.thegraph.graphql.IntoDocument;
import sh.thegraph.graphql.client.GraphqlClient;
import sh.thegraph.graphql.http.ResponseResult;
import sh.thegraph.subgraphs.queries.PageResponse;
import sh.thegraph.subgraphs.queries.SubgraphQueries;

/**
 * Cursor-based pagination over a subgraph collection.
 *
 * <p>The first page is requested at the caller's block height. Every following page is pinned to
 * the hash of the block the first page was executed at, so the whole run observes one consistent
 * chain state. If the indexer drops that block the run fails with
 * {@link PaginatedQueryException.Kind#REORG_DETECTED}.
 *
 * <p>Pages are ordered by {@code id}; the query fragment must accept the {@code $first} and
 * {@code $last} variables, for example:
 *
 * <pre>{@code
 * allocations(
 *     block: $block
 *     orderBy: id, orderDirection: asc
 *     first: $first
 *     where: { id_gt: $last, status: Active }
 * ) { id indexer { id } }
 * }</pre>
 *
 * <p>Pages are sent one after the other on the calling thread. Instances hold no mutable state
 * and may be shared.
 */
public final class PaginatedQuery {

    private final GraphqlClient client;
    private final URI url;
    private final @Nullable String authToken;
    private final ReorgDetector reorgDetector;

    public PaginatedQuery(
            final GraphqlClient client,
            final URI url,
            final @Nullable String authToken,
            final ReorgDetector reorgDetector) {
        this.client = Objects.requireNonNull(client, "client");
        this.url = Objects.requireNonNull(url, "url");
        this.authToken = authToken;
        this.reorgDetector = Objects.requireNonNull(reorgDetector, "reorgDetector");
    }

    /**
     * Fetches every page of {@code query} and maps the entities onto {@code entityType}.
     *
     * @param query the collection fragment
     * @param blockHeight the height of the first page
     * @param pageSize entities per page, must be positive
     * @param entityType target type of each entity
     * @return all entities with the block they were read at
     * @throws IllegalArgumentException if {@code pageSize} is not positive
     * @throws PaginatedQueryException if any page fails; nothing collected so far is returned
     */
    public <T> PaginatedResult<T> send(
            final IntoDocument query,
            final BlockHeight blockHeight,
            final int pageSize,
            final JavaType entityType) throws PaginatedQueryException {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(blockHeight, "blockHeight");
        Objects.requireNonNull(entityType, "entityType");
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive, got " + pageSize);
        }

        final List<T> results = new ArrayList<>();
        BlockHeight height = blockHeight;
        @Nullable String lastId = null;
        @Nullable BlockPointer blockPointer = null;

        while (true) {
            final ResponseResult<PageResponse> result = sendPage(query, height, pageSize, lastId);

            if (result instanceof ResponseResult.Failure<PageResponse> failure) {
                final List<String> messages = failure.messages();
                if (reorgDetector.isReorgError(messages)) {
                    DebugLogger.log(Category.PAGE, LogFormatter.formatReorg(height.toVariable(), String.join("; ", messages)));
                    throw PaginatedQueryException.reorgDetected();
                }
                throw PaginatedQueryException.responseError(messages);
            }

            final PageResponse page = result instanceof ResponseResult.Data<PageResponse> data ? data.value() : null;
            if (page == null || page.results().isEmpty()) {
                if (lastId == null) {
                    throw PaginatedQueryException.emptyResponse();
                }
                break;
            }

            final List<JsonNode> entities = page.results();
            final JsonNode id = entities.get(entities.size() - 1).get("id");
            if (id == null || !id.isTextual()) {
                throw PaginatedQueryException.deserializationError("failed to extract id for last entry", null);
            }
            lastId = id.textValue();

            blockPointer = page.meta().block();
            height = BlockHeight.hash(blockPointer.hash());

            DebugLogger.log(Category.PAGE, LogFormatter.formatPage(
                    blockPointer.number(), blockPointer.hash().value(), entities.size(), lastId));

            for (JsonNode entity : entities) {
                results.add(convert(entity, entityType));
            }
        }

        return new PaginatedResult<>(results, blockPointer);
    }

    private ResponseResult<PageResponse> sendPage(
            final IntoDocument query,
            final BlockHeight height,
            final int pageSize,
            final @Nullable String lastId) {
        try {
            return SubgraphQueries.sendPageQuery(client, url, authToken, query, height, pageSize, lastId);
        } catch (GraphqlRequestException e) {
            throw PaginatedQueryException.requestError(e.getMessage(), e);
        }
    }

    /**
     * Maps one entity onto {@code entityType}; a {@code null} entry is never a valid entity.
     */
    private static <T> T convert(final JsonNode entity, final JavaType entityType) {
        if (entity == null || entity.isNull()) {
            throw PaginatedQueryException.deserializationError("null entity in results", null);
        }
        final T value;
        try {
            value = MAPPER.convertValue(entity, entityType);
        } catch (IllegalArgumentException e) {
            throw PaginatedQueryException.deserializationError(e.getMessage(), e);
        }
        if (value == null) {
            throw PaginatedQueryException.deserializationError(
                    "entity " + entity + " did not map to " + entityType.getTypeName(), null);
        }
        return value;
    }
}
