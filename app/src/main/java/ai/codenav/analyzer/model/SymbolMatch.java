package ai.codenav.analyzer.model;

import ai.codenav.analyzer.ElementKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SymbolMatch(
        String name,
        @Nullable String qualifiedName,
        ElementKind kind,
        String file,
        int line,
        @Nullable String containerName,
        String language) {

    /** Matches from different providers are considered the same symbol under this key. */
    public String dedupKey() {
        return file + ":" + line + ":" + name;
    }
}
