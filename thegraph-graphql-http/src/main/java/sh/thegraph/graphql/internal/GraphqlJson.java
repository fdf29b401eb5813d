// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql.internal;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared JSON configuration for the GraphQL modules.
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API.
 */
public final class GraphqlJson {

    /**
     * Shared, thread-safe ObjectMapper.
     * <p>
     * Subgraph entities usually carry more fields than the caller maps, so unknown properties are
     * ignored rather than rejected.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private GraphqlJson() {
        // Utility class - prevent instantiation
    }
}
