package ai.codenav.query;

public record QueryError(QueryErrorKind kind, String message) {

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
