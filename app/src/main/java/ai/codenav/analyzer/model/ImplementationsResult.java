package ai.codenav.analyzer.model;

import java.util.List;

public record ImplementationsResult(List<ImplementationEntry> implementations, int totalCount) {
    public ImplementationsResult {
        implementations = List.copyOf(implementations);
    }

    public static ImplementationsResult of(List<ImplementationEntry> implementations) {
        return new ImplementationsResult(implementations, implementations.size());
    }
}
