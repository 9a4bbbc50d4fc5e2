package ai.codenav.query;

/** Where a query starts: a source position, or a declaration's fully-qualified name. */
public sealed interface StartRef permits StartRef.Position, StartRef.QualifiedName {

    static StartRef at(String file, int line, int column) {
        return new Position(file, line, column);
    }

    static StartRef named(String qualifiedName) {
        return new QualifiedName(qualifiedName);
    }

    /**
     * @param file path relative to the project root
     * @param line 1-based
     * @param column 1-based
     */
    record Position(String file, int line, int column) implements StartRef {
        public Position {
            if (file.isBlank()) {
                throw new IllegalArgumentException("file must not be blank");
            }
            if (line < 1) {
                throw new IllegalArgumentException("line must be >= 1, got " + line);
            }
            if (column < 1) {
                throw new IllegalArgumentException("column must be >= 1, got " + column);
            }
        }

        @Override
        public String toString() {
            return file + ":" + line + ":" + column;
        }
    }

    record QualifiedName(String name) implements StartRef {
        public QualifiedName {
            if (name.isBlank()) {
                throw new IllegalArgumentException("qualified name must not be blank");
            }
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
