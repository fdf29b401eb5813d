// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.subgraphs.queries;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

import sh.thegraph.core.types.BlockPointer;

/**
 * The {@code _meta} selection of a subgraph response: the block the query ran against.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Meta(BlockPointer block) {
    public Meta {
        Objects.requireNonNull(block, "block");
    }
}
