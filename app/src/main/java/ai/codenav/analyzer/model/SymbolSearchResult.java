package ai.codenav.analyzer.model;

import java.util.List;

public record SymbolSearchResult(List<SymbolMatch> symbols, int totalCount, String query) {
    public SymbolSearchResult {
        symbols = List.copyOf(symbols);
    }
}
