package ai.codenav.analyzer;

/** A provider offering every capability for one language tag. */
public interface LanguageProvider
        extends TypeHierarchyProvider,
                CallHierarchyProvider,
                SuperMethodsProvider,
                SymbolSearchProvider,
                ImplementationsProvider,
                UsagesProvider,
                DefinitionProvider {}
