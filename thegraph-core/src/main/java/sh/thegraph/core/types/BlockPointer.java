// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.core.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Comparator;
import java.util.Objects;

/**
 * A pointer to a block in the chain: the block at which a subgraph query was executed.
 *
 * <p>Deserialized from the {@code meta.block} selection of every subgraph response. Pointers
 * order by block number; the hash only breaks ties so that ordering stays consistent with
 * {@link #equals(Object)}.
 *
 * @param number the block number, never negative
 * @param hash the block hash
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BlockPointer(long number, BlockHash hash) implements Comparable<BlockPointer> {

    private static final Comparator<BlockPointer> ORDER =
            Comparator.comparingLong(BlockPointer::number)
                    .thenComparing(p -> p.hash().value());

    public BlockPointer {
        if (number < 0) {
            throw new IllegalArgumentException("Block number cannot be negative: " + number);
        }
        Objects.requireNonNull(hash, "hash");
    }

    @Override
    public int compareTo(final BlockPointer other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "#" + number + " (" + hash + ")";
    }
}
