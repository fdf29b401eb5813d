// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql.http;

import static sh.thegraph.graphql.internal.GraphqlJson.MAPPER;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A decoded GraphQL response body: the {@code data} entry and the {@code errors} entry.
 *
 * <p>A JSON {@code null} data entry is the same as an absent one. The payload is kept as a JSON
 * tree so that it can be classified before being mapped to a caller type.
 *
 * @param data the response data, or {@code null} when absent
 * @param errors the errors raised during the request, empty when none
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ResponseBody(@Nullable JsonNode data, List<GraphqlError> errors) {

    public ResponseBody {
        if (data != null && (data.isNull() || data.isMissingNode())) {
            data = null;
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Creates a response body carrying the given data, converted to a JSON tree.
     */
    public static ResponseBody fromData(final Object data) {
        return new ResponseBody(MAPPER.valueToTree(data), List.of());
    }

    public static ResponseBody fromError(final GraphqlError error) {
        return new ResponseBody(null, List.of(error));
    }

    public static ResponseBody fromErrors(final List<GraphqlError> errors) {
        return new ResponseBody(null, errors);
    }

    public static ResponseBody empty() {
        return new ResponseBody(null, List.of());
    }

    /**
     * Classifies this body.
     *
     * <p>A GraphQL {@code errors} entry, when present, holds at least one
     * error. Data without errors is a success, no data and no errors is {@link
     * ResponseResult.Empty}, and anything with errors is a {@link ResponseResult.Failure}, even
     * when data is present.
     */
    public ResponseResult<JsonNode> classify() {
        if (errors.isEmpty()) {
            return data != null ? ResponseResult.data(data) : ResponseResult.empty();
        }
        return ResponseResult.failure(errors);
    }
}
