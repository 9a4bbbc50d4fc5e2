package ai.codenav.analyzer;

/** Thrown by a {@link CodeModel} whose backing index is still being built. */
public class IndexNotReadyException extends RuntimeException {
    public IndexNotReadyException(String message) {
        super(message);
    }
}
