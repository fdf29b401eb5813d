// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.subgraphs;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static sh.thegraph.subgraphs.Pages.HASH_100;
import static sh.thegraph.subgraphs.Pages.HASH_101;
import static sh.thegraph.subgraphs.Pages.lastPage;
import static sh.thegraph.subgraphs.Pages.page;
import static sh.thegraph.subgraphs.Pages.pageOf;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JavaType;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import sh.thegraph.core.DebugLogger;
import sh.thegraph.core.GraphDebug;
import sh.thegraph.core.GraphDebug.Category;
import sh.thegraph.core.error.GraphqlRequestException;
import sh.thegraph.core.error.PaginatedQueryException;
import sh.thegraph.core.types.BlockPointer;
import sh.thegraph.graphql.Document;
import sh.thegraph.graphql.client.GraphqlClient;
import sh.thegraph.graphql.client.GraphqlTransport;
import sh.thegraph.graphql.http.GraphqlError;
import sh.thegraph.graphql.http.RequestParameters;
import sh.thegraph.graphql.http.ResponseBody;
import sh.thegraph.graphql.internal.GraphqlJson;

@ExtendWith(MockitoExtension.class)
class PaginatedQueryTest {

    private static final URI URL = URI.create("http://indexer.test/subgraphs/id/Qm");
    private static final Document QUERY = Document.of("""
            entities(block: $block, orderBy: id, first: $first, where: { id_gt: $last }) { id amount }""");
    private static final JavaType ENTITY = GraphqlJson.MAPPER.constructType(Entity.class);

    @Mock
    private GraphqlTransport transport;

    private PaginatedQuery paginatedQuery;

    private final Logger debugLogger = (Logger) LoggerFactory.getLogger(DebugLogger.LOGGER_NAME);

    @BeforeEach
    void setUp() {
        paginatedQuery = new PaginatedQuery(new GraphqlClient(transport), URL, "token", ReorgDetector.graphNode());
    }

    @AfterEach
    void tearDown() {
        GraphDebug.setAllEnabled(false);
        debugLogger.detachAndStopAllAppenders();
    }

    private List<RequestParameters> sentRequests(final int count) {
        ArgumentCaptor<RequestParameters> captor = ArgumentCaptor.forClass(RequestParameters.class);
        verify(transport, times(count)).execute(eq(URL), eq("token"), captor.capture());
        return captor.getAllValues();
    }

    // ==================== Termination ====================

    @Test
    void stopsAtFirstEmptyPageAfterResults() {
        when(transport.execute(any(), any(), any())).thenReturn(
                page(100, HASH_100, "a", "b"),
                page(100, HASH_100, "c", "d"),
                page(100, HASH_100, "e"),
                lastPage(100, HASH_100));

        PaginatedResult<Entity> result = paginatedQuery.send(QUERY, BlockHeight.numberGte(90), 2, ENTITY);

        assertEquals(
                List.of("a", "b", "c", "d", "e"),
                result.results().stream().map(Entity::id).toList());
        assertEquals(new BlockPointer(100, HASH_100), result.block());
        sentRequests(4);
    }

    @Test
    void protocolEmptyAfterResultsAlsoTerminates() {
        when(transport.execute(any(), any(), any())).thenReturn(
                page(100, HASH_100, "a"),
                ResponseBody.empty());

        PaginatedResult<Entity> result = paginatedQuery.send(QUERY, BlockHeight.LATEST, 1, ENTITY);

        assertEquals(List.of(new Entity("a", 0)), result.results());
        sentRequests(2);
    }

    @Test
    void firstPageWithoutResultsIsEmptyResponse() {
        when(transport.execute(any(), any(), any())).thenReturn(lastPage(100, HASH_100));

        PaginatedQueryException e = assertThrows(
                PaginatedQueryException.class,
                () -> paginatedQuery.send(QUERY, BlockHeight.LATEST, 10, ENTITY));

        assertEquals(PaginatedQueryException.Kind.EMPTY_RESPONSE, e.kind());
        sentRequests(1);
    }

    @Test
    void firstPageProtocolEmptyIsEmptyResponse() {
        when(transport.execute(any(), any(), any())).thenReturn(ResponseBody.empty());

        PaginatedQueryException e = assertThrows(
                PaginatedQueryException.class,
                () -> paginatedQuery.send(QUERY, BlockHeight.LATEST, 10, ENTITY));

        assertEquals(PaginatedQueryException.Kind.EMPTY_RESPONSE, e.kind());
    }

    // ==================== Cursor and block pinning ====================

    @Test
    void pinsFollowingPagesToFirstPageBlockHash() throws Exception {
        when(transport.execute(any(), any(), any())).thenReturn(
                page(100, HASH_100, "a", "b"),
                page(100, HASH_100, "c"),
                lastPage(100, HASH_100));

        paginatedQuery.send(QUERY, BlockHeight.numberGte(100), 2, ENTITY);

        List<RequestParameters> requests = sentRequests(3);
        assertEquals(
                "{\"block\":{\"number_gte\":100},\"first\":2,\"last\":\"\"}",
                GraphqlJson.MAPPER.writeValueAsString(requests.get(0).variables()));
        assertEquals(
                "{\"block\":{\"hash\":\"" + HASH_100.value() + "\"},\"first\":2,\"last\":\"b\"}",
                GraphqlJson.MAPPER.writeValueAsString(requests.get(1).variables()));
        assertEquals(BlockHeight.hash(HASH_100), requests.get(2).variables().get("block"));
        assertEquals("c", requests.get(2).variables().get("last"));
    }

    @Test
    void reportsBlockOfLastPage() {
        when(transport.execute(any(), any(), any())).thenReturn(
                page(100, HASH_100, "a"),
                page(101, HASH_101, "b"),
                lastPage(101, HASH_101));

        PaginatedResult<Entity> result = paginatedQuery.send(QUERY, BlockHeight.LATEST, 1, ENTITY);

        assertEquals(new BlockPointer(101, HASH_101), result.block());
    }

    @Test
    void nonStringIdIsDeserializationError() {
        when(transport.execute(any(), any(), any()))
                .thenReturn(pageOf(100, HASH_100, List.of(Map.of("id", 5, "amount", 1))));

        PaginatedQueryException e = assertThrows(
                PaginatedQueryException.class,
                () -> paginatedQuery.send(QUERY, BlockHeight.LATEST, 1, ENTITY));

        assertEquals(PaginatedQueryException.Kind.DESERIALIZATION_ERROR, e.kind());
        assertEquals("deserialization error: failed to extract id for last entry", e.getMessage());
    }

    @Test
    void missingIdIsDeserializationError() {
        when(transport.execute(any(), any(), any()))
                .thenReturn(pageOf(100, HASH_100, List.of(Map.of("amount", 1))));

        PaginatedQueryException e = assertThrows(
                PaginatedQueryException.class,
                () -> paginatedQuery.send(QUERY, BlockHeight.LATEST, 1, ENTITY));

        assertEquals(PaginatedQueryException.Kind.DESERIALIZATION_ERROR, e.kind());
    }

    @Test
    void badEntityOnLaterPageFailsWholeRun() {
        when(transport.execute(any(), any(), any())).thenReturn(
                page(100, HASH_100, "a", "b"),
                pageOf(100, HASH_100, List.of(
                        Map.of("id", "c", "amount", 1),
                        Map.of("id", "d", "amount", "not a number"))));

        PaginatedQueryException e = assertThrows(
                PaginatedQueryException.class,
                () -> paginatedQuery.send(QUERY, BlockHeight.LATEST, 2, ENTITY));

        assertEquals(PaginatedQueryException.Kind.DESERIALIZATION_ERROR, e.kind());
        sentRequests(2);
    }

    @Test
    void nullEntityFailsWholeRun() {
        List<Object> results = new ArrayList<>();
        results.add(null);
        results.add(Map.of("id", "a", "amount", 1));
        when(transport.execute(any(), any(), any())).thenReturn(
                pageOf(100, HASH_100, results),
                lastPage(100, HASH_100));

        PaginatedQueryException e = assertThrows(
                PaginatedQueryException.class,
                () -> paginatedQuery.send(QUERY, BlockHeight.LATEST, 2, ENTITY));

        assertEquals(PaginatedQueryException.Kind.DESERIALIZATION_ERROR, e.kind());
        assertEquals("deserialization error: null entity in results", e.getMessage());
        sentRequests(1);
    }

    // ==================== Failures ====================

    @Test
    void purgedBlockIsReorg() {
        when(transport.execute(any(), any(), any())).thenReturn(
                page(100, HASH_100, "a"),
                ResponseBody.fromError(GraphqlError.of(
                        "Store error: no block with that hash found: " + HASH_100.value())));

        PaginatedQueryException e = assertThrows(
                PaginatedQueryException.class,
                () -> paginatedQuery.send(QUERY, BlockHeight.LATEST, 1, ENTITY));

        assertEquals(PaginatedQueryException.Kind.REORG_DETECTED, e.kind());
        assertTrue(e.errors().isEmpty());
    }

    @Test
    void otherGraphqlErrorsAreResponseErrors() {
        when(transport.execute(any(), any(), any())).thenReturn(ResponseBody.fromErrors(List.of(
                GraphqlError.of("Type `Entity` has no field `amount`"),
                GraphqlError.of("second"))));

        PaginatedQueryException e = assertThrows(
                PaginatedQueryException.class,
                () -> paginatedQuery.send(QUERY, BlockHeight.LATEST, 1, ENTITY));

        assertEquals(PaginatedQueryException.Kind.RESPONSE_ERROR, e.kind());
        assertEquals(List.of("Type `Entity` has no field `amount`", "second"), e.errors());
    }

    @Test
    void customReorgDetectorIsUsed() {
        when(transport.execute(any(), any(), any()))
                .thenReturn(ResponseBody.fromError(GraphqlError.of("block pruned")));
        PaginatedQuery custom = new PaginatedQuery(
                new GraphqlClient(transport), URL, "token", ReorgDetector.containing("pruned"));

        PaginatedQueryException e = assertThrows(
                PaginatedQueryException.class,
                () -> custom.send(QUERY, BlockHeight.LATEST, 1, ENTITY));

        assertEquals(PaginatedQueryException.Kind.REORG_DETECTED, e.kind());
    }

    @Test
    void transportFailureIsRequestError() {
        GraphqlRequestException cause = GraphqlRequestException.send(new IOException("Connection reset"));
        when(transport.execute(any(), any(), any()))
                .thenReturn(page(100, HASH_100, "a"))
                .thenThrow(cause);

        PaginatedQueryException e = assertThrows(
                PaginatedQueryException.class,
                () -> paginatedQuery.send(QUERY, BlockHeight.LATEST, 1, ENTITY));

        assertEquals(PaginatedQueryException.Kind.REQUEST_ERROR, e.kind());
        assertEquals("request error: Error making HTTP request: Connection reset", e.getMessage());
        assertSame(cause, e.getCause());
    }

    @Test
    void nonPositivePageSizeFailsBeforeSending() {
        assertThrows(IllegalArgumentException.class, () -> paginatedQuery.send(QUERY, BlockHeight.LATEST, 0, ENTITY));
        assertThrows(IllegalArgumentException.class, () -> paginatedQuery.send(QUERY, BlockHeight.LATEST, -1, ENTITY));

        verify(transport, never()).execute(any(), any(), any());
    }

    // ==================== Logging ====================

    @Test
    void logsPagesAndReorgsWhenEnabled() {
        GraphDebug.setEnabled(Category.PAGE, true);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        debugLogger.addAppender(appender);
        when(transport.execute(any(), any(), any())).thenReturn(
                page(100, HASH_100, "a"),
                ResponseBody.fromError(GraphqlError.of(ReorgDetector.GRAPH_NODE_REORG_ERROR)));

        assertThrows(PaginatedQueryException.class, () -> paginatedQuery.send(QUERY, BlockHeight.LATEST, 1, ENTITY));

        List<String> messages = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
        assertEquals(2, messages.size());
        assertEquals("[PAGE] block=100 hash=0x1000...0100 items=1 last=a", messages.get(0));
        assertEquals(
                "○ [REORG] height={hash=" + HASH_100.value() + "} message=" + ReorgDetector.GRAPH_NODE_REORG_ERROR,
                messages.get(1));
    }
}
