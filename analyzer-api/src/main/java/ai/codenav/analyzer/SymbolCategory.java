package ai.codenav.analyzer;

import java.util.List;

/**
 * Coarse declaration categories used for name enumeration. Symbol search descends in {@link #SEARCH_ORDER}: types
 * first, then callables, then variables.
 */
public enum SymbolCategory {
    TYPE,
    CALLABLE,
    VARIABLE,
    NONE;

    public static final List<SymbolCategory> SEARCH_ORDER = List.of(TYPE, CALLABLE, VARIABLE);
}
