package ai.codenav.analyzer;

import ai.codenav.analyzer.model.SymbolMatch;
import java.util.List;

/**
 * Implemented by providers that can search declarations by name. Unlike the other capabilities this one is not
 * dispatched on a starting element: every available provider contributes.
 */
public interface SymbolSearchProvider extends CapabilityProvider {

    /**
     * @param pattern non-blank search text
     * @param limit maximum number of matches to return, already clamped by the caller
     * @return ranked matches, at most {@code limit}
     */
    List<SymbolMatch> searchSymbols(String pattern, SearchScope scope, int limit, CancellationToken cancellation);
}
