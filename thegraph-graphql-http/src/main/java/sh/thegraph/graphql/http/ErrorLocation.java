// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Beginning of the syntax element a GraphQL error refers to. Both values start at 1.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorLocation(int line, int column) {}
