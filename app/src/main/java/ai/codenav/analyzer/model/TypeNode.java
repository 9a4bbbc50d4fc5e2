package ai.codenav.analyzer.model;

import ai.codenav.analyzer.ElementKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A type in a hierarchy result. In a supertype tree every node carries its own (possibly empty) list of supertypes;
 * root and subtype nodes leave it null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TypeNode(
        String name,
        @Nullable String qualifiedName,
        @Nullable String file,
        @Nullable Integer line,
        ElementKind kind,
        String language,
        @Nullable List<TypeNode> supertypes) {

    public TypeNode {
        supertypes = supertypes == null ? null : List.copyOf(supertypes);
    }

    /** A declared supertype that could not be resolved to a declaration. */
    public static TypeNode unresolved(String declaredName, ElementKind kind, String language) {
        return new TypeNode(declaredName, declaredName.contains(".") ? declaredName : null, null, null, kind, language,
                List.of());
    }

    /** The key used to detect a repeated type along one path: qualified name when known, else the name. */
    public String identity() {
        return qualifiedName != null ? qualifiedName : name;
    }
}
