// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql.client;

import java.time.Duration;
import java.util.Map;

/**
 * Settings of an {@link HttpGraphqlTransport}.
 *
 * @param connectTimeout TCP connect timeout, 10s by default
 * @param readTimeout per-request response timeout, 30s by default
 * @param headers extra headers sent with every request
 */
public record TransportConfig(
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers) {

    private static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_READ = Duration.ofSeconds(30);

    public TransportConfig {
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static TransportConfig defaults() {
        return new TransportConfig(DEFAULT_CONNECT, DEFAULT_READ, Map.of());
    }
}
