package ai.codenav.analyzer;

/**
 * Where a declaration or reference occurrence lives.
 *
 * @param path file path relative to the project root (or an absolute/library path for external symbols)
 * @param line 1-based line of the declaration's name
 * @param column 1-based column, or 0 when the model does not record one
 */
public record SourceLocation(String path, int line, int column) {
    public SourceLocation {
        if (line < 0) {
            throw new IllegalArgumentException("line must not be negative: " + line);
        }
        if (column < 0) {
            throw new IllegalArgumentException("column must not be negative: " + column);
        }
    }

    public SourceLocation(String path, int line) {
        this(path, line, 0);
    }
}
