package ai.codenav.analyzer.model;

import java.util.List;

/** A method and its ancestor chain, ordered as discovered (nearest first along each inheritance path). */
public record SuperMethodsResult(MethodInfo method, List<SuperMethodEntry> hierarchy) {
    public SuperMethodsResult {
        hierarchy = List.copyOf(hierarchy);
    }
}
