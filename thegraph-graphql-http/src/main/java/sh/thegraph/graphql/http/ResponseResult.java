// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.thegraph.graphql.http;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * The classified outcome of a GraphQL-over-HTTP response.
 *
 * <p>Exactly one of:
 * <ul>
 * <li>{@link Data} - the server returned data and no errors</li>
 * <li>{@link Empty} - the server returned neither data nor errors, a protocol violation</li>
 * <li>{@link Failure} - the server reported one or more errors; data sent alongside errors is
 * discarded, partial results are never surfaced</li>
 * </ul>
 *
 * @param <T> the payload type
 * @see ResponseBody#classify()
 */
public sealed interface ResponseResult<T>
        permits ResponseResult.Data, ResponseResult.Empty, ResponseResult.Failure {

    static <T> ResponseResult<T> data(final T value) {
        return new Data<>(value);
    }

    static <T> ResponseResult<T> empty() {
        return new Empty<>();
    }

    static <T> ResponseResult<T> failure(final List<GraphqlError> errors) {
        return new Failure<>(errors);
    }

    /**
     * Transforms the payload of a {@link Data} result; other results keep their kind.
     */
    <R> ResponseResult<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Successful response payload.
     */
    record Data<T>(T value) implements ResponseResult<T> {
        public Data {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> ResponseResult<R> map(final Function<? super T, ? extends R> mapper) {
            return new Data<>(mapper.apply(value));
        }
    }

    /**
     * Response without data and without errors.
     */
    record Empty<T>() implements ResponseResult<T> {
        @Override
        public <R> ResponseResult<R> map(final Function<? super T, ? extends R> mapper) {
            return new Empty<>();
        }

        @Override
        public String toString() {
            return "Empty response";
        }
    }

    /**
     * Response carrying server-reported errors.
     */
    record Failure<T>(List<GraphqlError> errors) implements ResponseResult<T> {
        public Failure {
            errors = List.copyOf(errors);
            if (errors.isEmpty()) {
                throw new IllegalArgumentException("A failure must carry at least one error");
            }
        }

        /**
         * Returns the error messages in the order the server reported them.
         */
        public List<String> messages() {
            return errors.stream().map(GraphqlError::message).toList();
        }

        @Override
        public <R> ResponseResult<R> map(final Function<? super T, ? extends R> mapper) {
            return new Failure<>(errors);
        }

        @Override
        public String toString() {
            return "GraphQL request failed: " + errors;
        }
    }
}
