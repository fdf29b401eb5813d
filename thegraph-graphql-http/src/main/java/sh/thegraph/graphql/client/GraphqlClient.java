// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql.client;

import static sh.thegraph.graphql.internal.GraphqlJson.MAPPER;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

import sh.thegraph.core.error.GraphqlRequestException;
import sh.thegraph.graphql.http.IntoRequestParameters;
import sh.thegraph.graphql.http.ResponseBody;
import sh.thegraph.graphql.http.ResponseResult;

/**
 * A typed GraphQL client that wraps a {@link GraphqlTransport}.
 *
 * <p>The transport returns raw response bodies; this class classifies them and, for successful
 * responses only, maps the {@code data} entry onto the requested type with Jackson. Data sent
 * alongside errors is never mapped.
 *
 * <pre>{@code
 * GraphqlClient client = new GraphqlClient(GraphqlTransport.http());
 * ResponseResult<Meta> result = client.send(url, token, Document.of(META_QUERY), Meta.class);
 * }</pre>
 *
 * <p><b>Thread Safety:</b> thread-safe if the underlying transport is.
 */
public final class GraphqlClient {

    private final GraphqlTransport transport;

    public GraphqlClient(final GraphqlTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    public GraphqlTransport transport() {
        return transport;
    }

    public <T> ResponseResult<T> send(
            final URI url,
            final @Nullable String bearerToken,
            final IntoRequestParameters request,
            final Class<T> dataType) throws GraphqlRequestException {
        return send(url, bearerToken, request, MAPPER.constructType(dataType));
    }

    public <T> ResponseResult<T> send(
            final URI url,
            final @Nullable String bearerToken,
            final IntoRequestParameters request,
            final TypeReference<T> dataType) throws GraphqlRequestException {
        return send(url, bearerToken, request, MAPPER.getTypeFactory().constructType(dataType));
    }

    /**
     * Sends a request and maps a successful payload onto {@code dataType}.
     *
     * @throws GraphqlRequestException if the transport fails, or with kind
     *         {@code RESPONSE_DESERIALIZATION} if the payload does not match {@code dataType}
     */
    public <T> ResponseResult<T> send(
            final URI url,
            final @Nullable String bearerToken,
            final IntoRequestParameters request,
            final JavaType dataType) throws GraphqlRequestException {
        Objects.requireNonNull(request, "request");
        final ResponseBody body = transport.execute(url, bearerToken, request.toRequestParameters());
        if (body == null) {
            throw new GraphqlRequestException(
                    GraphqlRequestException.Kind.RESPONSE_DESERIALIZATION, "Transport returned no response body", null);
        }
        final ResponseResult<JsonNode> result = body.classify();
        return result.map(node -> convert(node, dataType));
    }

    private static <T> T convert(final JsonNode node, final JavaType dataType) {
        try {
            return MAPPER.convertValue(node, dataType);
        } catch (IllegalArgumentException e) {
            throw GraphqlRequestException.deserialization(-1, node.toString(), e);
        }
    }
}
