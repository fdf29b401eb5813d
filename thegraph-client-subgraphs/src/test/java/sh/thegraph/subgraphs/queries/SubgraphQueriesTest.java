// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.subgraphs.queries;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.thegraph.core.error.GraphqlRequestException;
import sh.thegraph.core.error.SubgraphQueryException;
import sh.thegraph.core.types.BlockHash;
import sh.thegraph.core.types.BlockPointer;
import sh.thegraph.graphql.Document;
import sh.thegraph.graphql.client.GraphqlClient;
import sh.thegraph.graphql.client.GraphqlTransport;
import sh.thegraph.graphql.http.GraphqlError;
import sh.thegraph.graphql.http.RequestParameters;
import sh.thegraph.graphql.http.ResponseBody;
import sh.thegraph.graphql.http.ResponseResult;
import sh.thegraph.graphql.internal.GraphqlJson;
import sh.thegraph.subgraphs.BlockHeight;

@ExtendWith(MockitoExtension.class)
class SubgraphQueriesTest {

    private static final URI URL = URI.create("http://gateway.test/api/subgraphs/id/Qm");
    private static final BlockHash HASH =
            BlockHash.of("0xabcdef0000000000000000000000000000000000000000000000000000000001");

    @Mock
    private GraphqlTransport transport;

    private GraphqlClient client;

    @BeforeEach
    void setUp() {
        client = new GraphqlClient(transport);
    }

    private static ResponseBody meta(final long number) {
        return ResponseBody.fromData(Map.of("meta", Map.of("block", Map.of("number", number, "hash", HASH.value()))));
    }

    @Test
    void bootstrapReturnsLatestBlock() {
        when(transport.execute(eq(URL), eq("token"), any())).thenReturn(meta(42));

        MetaQueryResponse response = SubgraphQueries.sendBootstrapMetaQuery(client, URL, "token");

        assertEquals(new BlockPointer(42, HASH), response.meta().block());
        ArgumentCaptor<RequestParameters> captor = ArgumentCaptor.forClass(RequestParameters.class);
        verify(transport).execute(eq(URL), eq("token"), captor.capture());
        assertEquals("{ meta: _meta { block { number hash } } }", captor.getValue().query().text());
        assertTrue(captor.getValue().variables().isEmpty());
    }

    @Test
    void bootstrapTransportErrorIsPrefixed() {
        when(transport.execute(any(), any(), any()))
                .thenThrow(GraphqlRequestException.send(new IOException("Connection refused")));

        SubgraphQueryException e = assertThrows(
                SubgraphQueryException.class, () -> SubgraphQueries.sendBootstrapMetaQuery(client, URL, null));

        assertEquals(
                "Error sending subgraph meta query: Error making HTTP request: Connection refused", e.getMessage());
        assertInstanceOf(GraphqlRequestException.class, e.getCause());
    }

    @Test
    void bootstrapGraphqlErrorsAreReported() {
        when(transport.execute(any(), any(), any())).thenReturn(ResponseBody.fromError(GraphqlError.of("auth error")));

        SubgraphQueryException e = assertThrows(
                SubgraphQueryException.class, () -> SubgraphQueries.sendBootstrapMetaQuery(client, URL, null));

        assertTrue(e.getMessage().startsWith("GraphQL request failed: "));
        assertTrue(e.getMessage().contains("auth error"));
    }

    @Test
    void subgraphQueryUnwrapsData() {
        when(transport.execute(any(), any(), any())).thenReturn(meta(7));

        MetaQueryResponse response = SubgraphQueries.sendSubgraphQuery(
                client, URL, null, SubgraphQueries.META_QUERY_DOCUMENT,
                GraphqlJson.MAPPER.constructType(MetaQueryResponse.class));

        assertEquals(7, response.meta().block().number());
    }

    @Test
    void subgraphQueryEmptyResponseFails() {
        when(transport.execute(any(), any(), any())).thenReturn(ResponseBody.empty());

        SubgraphQueryException e = assertThrows(
                SubgraphQueryException.class,
                () -> SubgraphQueries.sendSubgraphQuery(
                        client, URL, null, Document.of("{ a }"), GraphqlJson.MAPPER.constructType(JsonNode.class)));

        assertEquals("Empty response", e.getMessage());
    }

    @Test
    void subgraphQueryTransportErrorIsPrefixed() {
        when(transport.execute(any(), any(), any())).thenThrow(GraphqlRequestException.receive(503, "busy"));

        SubgraphQueryException e = assertThrows(
                SubgraphQueryException.class,
                () -> SubgraphQueries.sendSubgraphQuery(
                        client, URL, null, Document.of("{ a }"), GraphqlJson.MAPPER.constructType(JsonNode.class)));

        assertEquals(
                "Error sending subgraph graphql query: Error receiving HTTP response (503): busy", e.getMessage());
    }

    @Test
    void pageQueryReturnsEntitiesAsTrees() {
        when(transport.execute(any(), any(), any())).thenReturn(ResponseBody.fromData(Map.of(
                "meta", Map.of("block", Map.of("number", 9, "hash", HASH.value())),
                "results", List.of(Map.of("id", "a"), Map.of("id", "b")))));

        ResponseResult<PageResponse> result = SubgraphQueries.sendPageQuery(
                client, URL, null, Document.of("things { id }"), BlockHeight.LATEST, 2, null);

        ResponseResult.Data<PageResponse> data = assertInstanceOf(ResponseResult.Data.class, result);
        PageResponse page = data.value();
        assertEquals(9, page.meta().block().number());
        assertEquals(List.of("a", "b"), page.results().stream().map(n -> n.get("id").asText()).toList());
    }
}
