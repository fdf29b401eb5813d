// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql.http;

/**
 * GraphQL-over-HTTP media types.
 */
public final class MediaTypes {

    /** Media type of request bodies. */
    public static final String GRAPHQL_REQUEST = "application/json";

    /** Preferred media type of server responses. */
    public static final String GRAPHQL_RESPONSE = "application/graphql-response+json";

    /** Legacy media type of server responses, assumed when no Content-Type is sent. */
    public static final String GRAPHQL_LEGACY_RESPONSE = "application/json";

    /** Accept header value asking for either response media type. */
    public static final String ACCEPT =
            GRAPHQL_RESPONSE + "; charset=utf-8, " + GRAPHQL_LEGACY_RESPONSE + "; charset=utf-8";

    private MediaTypes() {
    }
}
