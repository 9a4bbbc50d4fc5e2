package ai.codenav.analyzer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/**
 * One reference occurrence of a declaration.
 *
 * @param column 1-based, or 0 when the model records none
 * @param enclosing {@code Container.member} the occurrence sits in, null at top level
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UsageEntry(
        String file, int line, int column, UsageType type, @Nullable String enclosing, String language) {}
