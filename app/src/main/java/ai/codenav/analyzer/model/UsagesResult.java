package ai.codenav.analyzer.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import org.jetbrains.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UsagesResult(String symbol, @Nullable String qualifiedName, List<UsageEntry> usages, int totalCount) {
    public UsagesResult {
        usages = List.copyOf(usages);
    }
}
