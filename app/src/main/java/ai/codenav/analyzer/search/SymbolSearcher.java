package ai.codenav.analyzer.search;

import ai.codenav.analyzer.CancellationToken;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.ElementRenderer;
import ai.codenav.analyzer.LanguagePolicy;
import ai.codenav.analyzer.SearchScope;
import ai.codenav.analyzer.SymbolCategory;
import ai.codenav.analyzer.model.SymbolMatch;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds declarations whose names match a pattern, restricted to the languages of one policy.
 *
 * <p>Types are enumerated first, then callables, then variables. Each matching name is resolved to its declarations
 * as soon as it is enumerated, and enumeration stops once {@code limit} declarations have been collected; the
 * collected matches are then ranked.
 */
public final class SymbolSearcher {
    private static final Logger logger = LogManager.getLogger(SymbolSearcher.class);

    /** Names enumerated between cancellation checks. */
    private static final int CANCELLATION_BATCH = 256;

    private final CodeModel model;
    private final LanguagePolicy policy;
    private final ElementRenderer renderer;

    public SymbolSearcher(CodeModel model, LanguagePolicy policy) {
        this.model = model;
        this.policy = policy;
        this.renderer = new ElementRenderer(model, policy);
    }

    public List<SymbolMatch> search(String pattern, SearchScope scope, int limit, CancellationToken cancellation) {
        if (pattern.isBlank() || limit <= 0) {
            return List.of();
        }
        var matcher = new NameMatcher(pattern);
        var collected = new LinkedHashMap<String, SymbolMatch>();

        for (var category : SymbolCategory.SEARCH_ORDER) {
            if (collected.size() >= limit) {
                break;
            }
            try (var stream = model.allDeclaredNames(category, scope)) {
                int seen = 0;
                for (var it = stream.iterator(); collected.size() < limit && it.hasNext(); ) {
                    if (++seen % CANCELLATION_BATCH == 0) {
                        cancellation.checkCancelled();
                    }
                    var name = it.next();
                    if (matcher.matches(name)) {
                        collect(name, category, scope, limit, collected);
                    }
                }
            }
            cancellation.checkCancelled();
        }
        logger.debug("Search '{}' collected {} matches", pattern, collected.size());
        return matcher.rank(new ArrayList<>(collected.values()));
    }

    private void collect(
            String name,
            SymbolCategory category,
            SearchScope scope,
            int limit,
            LinkedHashMap<String, SymbolMatch> collected) {
        try (var declarations = model.declarationsNamed(name, category, scope)) {
            for (var it = declarations.iterator(); collected.size() < limit && it.hasNext(); ) {
                var declaration = it.next();
                if (policy.handles(model.languageOf(declaration))) {
                    var match = renderer.symbolMatch(declaration);
                    collected.putIfAbsent(match.dedupKey(), match);
                }
            }
        }
    }
}
