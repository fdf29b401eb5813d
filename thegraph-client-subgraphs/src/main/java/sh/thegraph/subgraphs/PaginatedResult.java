// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.subgraphs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

import sh.thegraph.core.types.BlockPointer;

/**
 * Entities collected by one pagination run.
 *
 * @param results every entity of every page, in server order
 * @param block the block the pages were executed at, null if no page returned entities
 * @param <T> the entity type
 */
public record PaginatedResult<T>(List<T> results, @Nullable BlockPointer block) {

    public PaginatedResult {
        results = Collections.unmodifiableList(new ArrayList<>(results));
    }

    public Optional<BlockPointer> blockPointer() {
        return Optional.ofNullable(block);
    }
}
