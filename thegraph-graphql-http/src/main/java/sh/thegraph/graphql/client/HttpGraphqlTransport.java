// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql.client;

import static sh.thegraph.graphql.internal.GraphqlJson.MAPPER;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

import sh.thegraph.core.DebugLogger;
import sh.thegraph.core.GraphDebug.Category;
import sh.thegraph.core.LogFormatter;
import sh.thegraph.core.error.GraphqlRequestException;
import sh.thegraph.graphql.http.MediaTypes;
import sh.thegraph.graphql.http.RequestParameters;
import sh.thegraph.graphql.http.ResponseBody;

/**
 * GraphQL-over-HTTP transport built on {@link java.net.http.HttpClient}.
 *
 * <p>
 * Requests are sent as {@code POST} with a JSON body and an {@code Accept} header listing both
 * {@code application/graphql-response+json} and the legacy {@code application/json}. A response
 * without {@code Content-Type} is read as legacy {@code application/json}.
 *
 * <p>
 * Status handling follows the legacy watershed rules: {@code 2xx}, {@code 4xx} and {@code 5xx}
 * bodies are decoded as GraphQL responses (servers may report request errors with a non-2xx
 * status), while {@code 1xx} and {@code 3xx} responses, empty bodies and bodies that are not
 * GraphQL JSON fail with a {@link GraphqlRequestException}.
 *
 * <pre>{@code
 * GraphqlTransport transport = HttpGraphqlTransport.builder()
 *         .readTimeout(Duration.ofSeconds(60))
 *         .header("User-Agent", "indexer-agent")
 *         .build();
 * }</pre>
 */
public final class HttpGraphqlTransport implements GraphqlTransport {

    private final TransportConfig config;
    private final HttpClient httpClient;

    private HttpGraphqlTransport(final TransportConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public TransportConfig config() {
        return config;
    }

    @Override
    public ResponseBody execute(final URI url, final @Nullable String bearerToken, final RequestParameters request)
            throws GraphqlRequestException {
        final String payload = serialize(request);
        final HttpRequest httpRequest = buildRequest(url, bearerToken, payload);

        final long start = System.nanoTime();
        final HttpResponse<String> response;
        try {
            response = send(httpRequest);
        } catch (GraphqlRequestException e) {
            logError(url, e, start);
            throw e;
        }

        final int status = response.statusCode();
        final String mediaType = isLegacyResponse(response) ? "legacy" : "graphql-response";
        final String body = response.body();

        try {
            if (status < 200 || (status >= 300 && status < 400)) {
                throw GraphqlRequestException.receive(
                        status, body == null || body.isEmpty() ? "Empty response body" : body);
            }
            if (body == null || body.isBlank()) {
                throw GraphqlRequestException.receive(status, "Empty response body");
            }
            final ResponseBody decoded = parse(status, body);
            DebugLogger.log(
                    Category.QUERY, LogFormatter.formatQuery(url.toString(), status, mediaType, elapsedMicros(start)));
            return decoded;
        } catch (GraphqlRequestException e) {
            logError(url, e, start);
            throw e;
        }
    }

    private String serialize(final RequestParameters request) {
        try {
            return MAPPER.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw GraphqlRequestException.serialization(e);
        }
    }

    private HttpRequest buildRequest(final URI url, final @Nullable String bearerToken, final String payload) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(url)
                .header("Content-Type", MediaTypes.GRAPHQL_REQUEST)
                .header("Accept", MediaTypes.ACCEPT)
                .timeout(config.readTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(payload));

        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }

        if (bearerToken != null) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }

        return builder.build();
    }

    private HttpResponse<String> send(final HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw GraphqlRequestException.send(e);
        } catch (IOException e) {
            throw GraphqlRequestException.send(e);
        }
    }

    /**
     * Decodes a GraphQL response; the root must be a JSON object.
     */
    private ResponseBody parse(final int status, final String body) {
        final JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw GraphqlRequestException.deserialization(status, body, e);
        }
        if (root == null || !root.isObject()) {
            throw GraphqlRequestException.deserialization(status, body, new IllegalStateException(
                    "expected a JSON object, got " + (root == null ? "nothing" : root.getNodeType())));
        }
        try {
            return MAPPER.treeToValue(root, ResponseBody.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw GraphqlRequestException.deserialization(status, body, e);
        }
    }

    /**
     * A response is legacy when it declares {@code application/json} or no content type at all.
     */
    static boolean isLegacyResponse(final HttpResponse<?> response) {
        final Optional<String> contentType = response.headers().firstValue("Content-Type");
        if (contentType.isEmpty()) {
            return true;
        }
        final String essence = contentType.get().split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return !essence.equals(MediaTypes.GRAPHQL_RESPONSE);
    }

    private static void logError(final URI url, final GraphqlRequestException e, final long start) {
        DebugLogger.log(
                Category.QUERY,
                LogFormatter.formatQueryError(url.toString(), e.kind(), e.getMessage(), elapsedMicros(start)));
    }

    private static long elapsedMicros(final long start) {
        return (System.nanoTime() - start) / 1_000L;
    }

    public static final class Builder {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(30);
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpGraphqlTransport build() {
            return new HttpGraphqlTransport(new TransportConfig(connectTimeout, readTimeout, headers));
        }
    }
}
