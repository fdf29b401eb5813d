// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.subgraphs;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether the errors of a failed page mean the pinned block was reorganized away.
 *
 * <p>Indexers do not report reorgs in a structured way, so detection depends on the backend's
 * error text. {@link #graphNode()} matches the message Graph Node returns when asked for a block
 * hash it no longer has.
 */
@FunctionalInterface
public interface ReorgDetector {

    /** Error message returned by Graph Node, typically when a reorg happens. */
    String GRAPH_NODE_REORG_ERROR = "no block with that hash found";

    /**
     * @param messages the server-reported error messages of one response
     * @return true if they indicate a reorg
     */
    boolean isReorgError(List<String> messages);

    static ReorgDetector graphNode() {
        return containing(GRAPH_NODE_REORG_ERROR);
    }

    /**
     * Matches when any message contains {@code fragment}.
     */
    static ReorgDetector containing(final String fragment) {
        Objects.requireNonNull(fragment, "fragment");
        return messages -> messages.stream().anyMatch(m -> m != null && m.contains(fragment));
    }
}
