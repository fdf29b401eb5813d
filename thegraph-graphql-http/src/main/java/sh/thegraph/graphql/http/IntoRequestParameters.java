// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql.http;

/**
 * A value that can be turned into the parameters of a GraphQL-over-HTTP request.
 */
@FunctionalInterface
public interface IntoRequestParameters {

    RequestParameters toRequestParameters();
}
