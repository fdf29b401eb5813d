// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.subgraphs;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Map;
import java.util.Objects;

import sh.thegraph.core.types.BlockHash;

/**
 * The block at which a subgraph query is executed.
 * <p>
 * Serialized as the {@code Block_height} GraphQL input object: at most one field is set, and
 * {@link #LATEST} is the empty object.
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * BlockHeight.LATEST.toVariable();            // {}
 * BlockHeight.number(100).toVariable();       // {number=100}
 * BlockHeight.numberGte(100).toVariable();    // {number_gte=100}
 * BlockHeight.hash(blockHash).toVariable();   // {hash=0x...}
 * }</pre>
 */
public sealed interface BlockHeight
        permits BlockHeight.Latest, BlockHeight.Hash, BlockHeight.Number, BlockHeight.NumberGte {

    /** The latest block the indexer has processed. */
    BlockHeight LATEST = new Latest();

    static BlockHeight hash(final BlockHash hash) {
        return new Hash(hash);
    }

    static BlockHeight number(final long number) {
        return new Number(number);
    }

    static BlockHeight numberGte(final long number) {
        return new NumberGte(number);
    }

    /**
     * Returns the GraphQL input object for the {@code $block} variable.
     */
    @JsonValue
    Map<String, Object> toVariable();

    /**
     * Query at the latest indexed block.
     */
    record Latest() implements BlockHeight {
        @Override
        @JsonValue
        public Map<String, Object> toVariable() {
            return Map.of();
        }
    }

    /**
     * Query at the block with exactly this hash.
     */
    record Hash(BlockHash value) implements BlockHeight {
        public Hash {
            Objects.requireNonNull(value, "hash");
        }

        @Override
        @JsonValue
        public Map<String, Object> toVariable() {
            return Map.of("hash", value.value());
        }
    }

    /**
     * Query at the block with exactly this number.
     */
    record Number(long value) implements BlockHeight {
        public Number {
            if (value < 0) {
                throw new IllegalArgumentException("Block number cannot be negative: " + value);
            }
        }

        @Override
        @JsonValue
        public Map<String, Object> toVariable() {
            return Map.of("number", value);
        }
    }

    /**
     * Query at the latest block whose number is at least this one; the indexer rejects the query
     * if it has not reached it yet.
     */
    record NumberGte(long value) implements BlockHeight {
        public NumberGte {
            if (value < 0) {
                throw new IllegalArgumentException("Block number cannot be negative: " + value);
            }
        }

        @Override
        @JsonValue
        public Map<String, Object> toVariable() {
            return Map.of("number_gte", value);
        }
    }
}
