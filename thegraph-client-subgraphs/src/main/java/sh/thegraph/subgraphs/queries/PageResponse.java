// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.subgraphs.queries;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * Response of one page query.
 *
 * <p>Entities are kept as JSON trees: the cursor is read from the last one before any of them
 * is mapped to the caller's type.
 *
 * @param meta the block the page was executed at
 * @param results the page entities, in server order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PageResponse(Meta meta, List<JsonNode> results) {
    public PageResponse {
        Objects.requireNonNull(meta, "meta");
        results = results == null ? List.of() : List.copyOf(results);
    }
}
