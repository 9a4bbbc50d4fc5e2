package ai.codenav.index;

import ai.codenav.analyzer.ElementKind;
import ai.codenav.analyzer.Language;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * One declaration known to an {@link InMemoryCodeModel}.
 *
 * @param id stable identifier, unique within the model
 * @param line first line of the declaration (1-based)
 * @param endLine last line of the declaration's body; equal to {@code line} for one-line declarations
 * @param container id of the enclosing declaration, null for top-level declarations
 */
public record Declaration(
        String id,
        String name,
        @Nullable String qualifiedName,
        ElementKind kind,
        Language language,
        @Nullable String file,
        int line,
        int endLine,
        @Nullable String container,
        List<String> parameterTypes,
        @Nullable String signature,
        boolean library) {

    public Declaration {
        if (id.isBlank()) {
            throw new IllegalArgumentException("declaration id must not be blank");
        }
        if (kind == ElementKind.REFERENCE || kind == ElementKind.CALL) {
            throw new IllegalArgumentException(kind + " is not a declaration kind: " + id);
        }
        if (line < 0 || endLine < line) {
            throw new IllegalArgumentException("bad line range " + line + ".." + endLine + " for " + id);
        }
        parameterTypes = List.copyOf(parameterTypes);
    }

    boolean spans(int atLine) {
        return line <= atLine && atLine <= endLine;
    }
}
