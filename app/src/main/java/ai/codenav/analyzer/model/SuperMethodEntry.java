package ai.codenav.analyzer.model;

import ai.codenav.analyzer.ElementKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * One overridden ancestor method.
 *
 * @param depth number of hierarchy hops from the starting method's declaring type; 1 is the nearest ancestor
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SuperMethodEntry(
        String name,
        String signature,
        String containingClass,
        ElementKind containingClassKind,
        @Nullable String file,
        @Nullable Integer line,
        @JsonProperty("isInterface") boolean isInterface,
        int depth,
        String language) {}
