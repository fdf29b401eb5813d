// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Objects;

import sh.thegraph.graphql.http.IntoRequestParameters;
import sh.thegraph.graphql.http.RequestParameters;

/**
 * A raw GraphQL request document.
 *
 * <p>The text is never parsed or validated; it is sent to the server as-is. A document without
 * variables converts directly into {@link RequestParameters}.
 *
 * @param text the GraphQL source text
 */
public record Document(@JsonValue String text) implements IntoDocument, IntoRequestParameters {

    public Document {
        Objects.requireNonNull(text, "text");
    }

    public static Document of(final String text) {
        return new Document(text);
    }

    @Override
    public Document toDocument() {
        return this;
    }

    @Override
    public RequestParameters toRequestParameters() {
        return RequestParameters.of(this);
    }

    @Override
    public String toString() {
        return text;
    }
}
