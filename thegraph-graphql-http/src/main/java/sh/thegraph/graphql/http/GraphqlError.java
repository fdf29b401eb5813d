// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Objects;

/**
 * An entry of the {@code errors} list of a GraphQL response.
 *
 * <p>{@code path} segments are field names (strings) or list indices (integers), with aliased
 * fields reported under their alias.
 *
 * @param message human-readable description, always present
 * @param locations where in the document the error starts, possibly empty
 * @param path response path of the failing field, possibly empty
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record GraphqlError(String message, List<ErrorLocation> locations, List<Object> path) {

    public GraphqlError {
        Objects.requireNonNull(message, "message");
        locations = locations == null ? List.of() : List.copyOf(locations);
        path = path == null ? List.of() : List.copyOf(path);
    }

    public static GraphqlError of(final String message) {
        return new GraphqlError(message, List.of(), List.of());
    }

    public static GraphqlError of(final Throwable error) {
        return of(String.valueOf(error.getMessage()));
    }
}
