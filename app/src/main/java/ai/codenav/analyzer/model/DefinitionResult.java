package ai.codenav.analyzer.model;

import ai.codenav.analyzer.ElementKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/**
 * Where a symbol is declared.
 *
 * @param column 1-based, or 0 when the model records none
 * @param library true when the declaration comes from a dependency rather than project sources
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DefinitionResult(
        String name,
        @Nullable String qualifiedName,
        ElementKind kind,
        String file,
        int line,
        int column,
        @Nullable String containerName,
        String language,
        boolean library) {}
