// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql;

/**
 * A value that can be turned into a GraphQL {@link Document}.
 *
 * <p>Implementations must be repeatable: paginated queries call {@link #toDocument()} once per
 * run and embed the result in every page request.
 */
@FunctionalInterface
public interface IntoDocument {

    Document toDocument();
}
