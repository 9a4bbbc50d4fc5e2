package ai.codenav.query;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a {@link CodeQueryService} call.
 *
 * <ul>
 *   <li>Success: the query ran; the value may itself be empty (no subtypes, no matches)
 *   <li>Failure: the query could not run, see {@link QueryErrorKind}
 * </ul>
 */
public sealed interface QueryResult<T> permits QueryResult.Success, QueryResult.Failure {

    static <T> QueryResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> QueryResult<T> failure(QueryErrorKind kind, String message) {
        return new Failure<>(new QueryError(kind, message));
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default Optional<T> value() {
        if (this instanceof Success<T> success) {
            return Optional.of(success.result());
        }
        return Optional.empty();
    }

    default Optional<QueryError> error() {
        if (this instanceof Failure<T> failure) {
            return Optional.of(failure.cause());
        }
        return Optional.empty();
    }

    /** @throws NoSuchElementException with the error message if this is a failure */
    default T orElseThrow() {
        return value().orElseThrow(() -> new NoSuchElementException(String.valueOf(error().orElse(null))));
    }

    default <R> QueryResult<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.result()));
        }
        return new Failure<>(((Failure<T>) this).cause());
    }

    record Success<T>(T result) implements QueryResult<T> {
        @Override
        public String toString() {
            return "Success{" + result + "}";
        }
    }

    record Failure<T>(QueryError cause) implements QueryResult<T> {
        @Override
        public String toString() {
            return "Failure{" + cause + "}";
        }
    }
}
