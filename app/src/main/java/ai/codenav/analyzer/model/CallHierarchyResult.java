package ai.codenav.analyzer.model;

import java.util.List;

public record CallHierarchyResult(CallNode node, List<CallNode> calls) {
    public CallHierarchyResult {
        calls = List.copyOf(calls);
    }
}
