// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.subgraphs.queries;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

import sh.thegraph.graphql.Document;
import sh.thegraph.graphql.IntoDocument;
import sh.thegraph.graphql.http.IntoRequestParameters;
import sh.thegraph.graphql.http.RequestParameters;
import sh.thegraph.subgraphs.BlockHeight;

/**
 * One page request of a paginated subgraph query.
 *
 * <p>The caller's query is embedded verbatim as the {@code results} field next to a
 * {@code meta} selection that reports the block the page ran against:
 *
 * <pre>
 * query ($block: Block_height!, $first: Int!, $last: String!) {
 *     meta: _meta(block: $block) { block { number hash } }
 *     results: &lt;query&gt;
 * }
 * </pre>
 *
 * <p>The embedded query is expected to use {@code $block}, {@code $first} and {@code $last}
 * itself, typically as {@code block: $block, first: $first, orderBy: id, where: { id_gt: $last
 * }}. Nothing checks this.
 */
public final class PageQuery implements IntoRequestParameters {

    private static final String HEADER =
            "query ($block: Block_height!, $first: Int!, $last: String!) {\n"
                    + "    meta: _meta(block: $block) { block { number hash } }\n"
                    + "    results: ";

    private final Document query;
    private final BlockHeight block;
    private final int first;
    private final String last;

    /**
     * @param query the entity query to embed
     * @param block the block to run the page at
     * @param first the page size
     * @param last the id of the last entity of the previous page, or null for the first page
     */
    public PageQuery(final IntoDocument query, final BlockHeight block, final int first, final @Nullable String last) {
        this.query = Objects.requireNonNull(query, "query").toDocument();
        this.block = Objects.requireNonNull(block, "block");
        this.first = first;
        this.last = last == null ? "" : last;
    }

    public Document document() {
        return Document.of(HEADER + query.text() + "\n}");
    }

    /**
     * Returns the {@code block}, {@code first} and {@code last} variables, in that order.
     */
    public Map<String, Object> variables() {
        final Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("block", block);
        vars.put("first", first);
        vars.put("last", last);
        return vars;
    }

    public BlockHeight block() {
        return block;
    }

    @Override
    public RequestParameters toRequestParameters() {
        return RequestParameters.of(document()).withVariables(variables());
    }
}
