// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.subgraphs.queries;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

/**
 * Response of the bootstrap meta query.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MetaQueryResponse(Meta meta) {
    public MetaQueryResponse {
        Objects.requireNonNull(meta, "meta");
    }
}
