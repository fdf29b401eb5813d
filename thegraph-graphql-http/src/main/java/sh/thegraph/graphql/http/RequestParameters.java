// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

import sh.thegraph.graphql.Document;

/**
 * The parameters of a GraphQL-over-HTTP request, serialized as the JSON request body.
 *
 * <p>{@code operationName} is omitted when null; {@code variables} and {@code extensions} are
 * omitted when empty. Variable values are serialized with Jackson when the request is sent, so
 * any Jackson-serializable value is accepted. Iteration order of the maps is kept.
 *
 * @param query the GraphQL document
 * @param operationName the operation to execute when the document defines several
 * @param variables values for the variables defined by the operation
 * @param extensions protocol extensions
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record RequestParameters(
        @JsonProperty("query") Document query,
        @JsonProperty("operationName") @Nullable String operationName,
        @JsonProperty("variables") Map<String, Object> variables,
        @JsonProperty("extensions") Map<String, Object> extensions) implements IntoRequestParameters {

    public RequestParameters {
        Objects.requireNonNull(query, "query");
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        extensions = extensions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extensions));
    }

    public static RequestParameters of(final Document query) {
        return new RequestParameters(query, null, Map.of(), Map.of());
    }

    public static RequestParameters of(final String query) {
        return of(Document.of(query));
    }

    public RequestParameters withOperationName(final @Nullable String name) {
        return new RequestParameters(query, name, variables, extensions);
    }

    public RequestParameters withVariables(final Map<String, ?> values) {
        return new RequestParameters(query, operationName, new LinkedHashMap<>(values), extensions);
    }

    public RequestParameters withExtensions(final Map<String, ?> values) {
        return new RequestParameters(query, operationName, variables, new LinkedHashMap<>(values));
    }

    @Override
    public RequestParameters toRequestParameters() {
        return this;
    }
}
