package ai.codenav.analyzer.model;

import java.util.List;

public record TypeHierarchyResult(TypeNode node, List<TypeNode> supertypes, List<TypeNode> subtypes) {
    public TypeHierarchyResult {
        supertypes = List.copyOf(supertypes);
        subtypes = List.copyOf(subtypes);
    }
}
