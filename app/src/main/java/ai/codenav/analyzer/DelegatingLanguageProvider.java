package ai.codenav.analyzer;

import ai.codenav.analyzer.model.CallHierarchyResult;
import ai.codenav.analyzer.model.DefinitionResult;
import ai.codenav.analyzer.model.ImplementationsResult;
import ai.codenav.analyzer.model.SuperMethodsResult;
import ai.codenav.analyzer.model.SymbolMatch;
import ai.codenav.analyzer.model.TypeHierarchyResult;
import ai.codenav.analyzer.model.UsagesResult;
import java.util.List;
import java.util.Optional;

/**
 * Registers an existing provider under another language tag, for dialects that share one model (Kotlin on the Java
 * provider, TypeScript on the JavaScript one). Only {@link #language()} differs from the delegate.
 */
public final class DelegatingLanguageProvider implements LanguageProvider {

    private final AbstractLanguageProvider delegate;
    private final Language language;

    public DelegatingLanguageProvider(AbstractLanguageProvider delegate, Language language) {
        if (!delegate.familyLanguages().contains(language)) {
            throw new IllegalArgumentException(
                    delegate + " does not cover " + language + "; it cannot be registered under that tag");
        }
        this.delegate = delegate;
        this.language = language;
    }

    @Override
    public Language language() {
        return language;
    }

    /** The provider doing the work; aggregate queries use it to avoid asking the same provider twice. */
    public AbstractLanguageProvider delegate() {
        return delegate;
    }

    @Override
    public boolean canHandle(ElementHandle element) {
        return delegate.canHandle(element);
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }

    @Override
    public Optional<TypeHierarchyResult> typeHierarchy(ElementHandle element, CancellationToken cancellation) {
        return delegate.typeHierarchy(element, cancellation);
    }

    @Override
    public Optional<CallHierarchyResult> callHierarchy(
            ElementHandle element, CallDirection direction, int depth, CancellationToken cancellation) {
        return delegate.callHierarchy(element, direction, depth, cancellation);
    }

    @Override
    public Optional<SuperMethodsResult> superMethods(ElementHandle element, CancellationToken cancellation) {
        return delegate.superMethods(element, cancellation);
    }

    @Override
    public List<SymbolMatch> searchSymbols(
            String pattern, SearchScope scope, int limit, CancellationToken cancellation) {
        return delegate.searchSymbols(pattern, scope, limit, cancellation);
    }

    @Override
    public Optional<ImplementationsResult> findImplementations(ElementHandle element, CancellationToken cancellation) {
        return delegate.findImplementations(element, cancellation);
    }

    @Override
    public Optional<UsagesResult> findUsages(
            ElementHandle element, SearchScope scope, CancellationToken cancellation) {
        return delegate.findUsages(element, scope, cancellation);
    }

    @Override
    public Optional<DefinitionResult> findDefinition(ElementHandle element, CancellationToken cancellation) {
        return delegate.findDefinition(element, cancellation);
    }

    @Override
    public String toString() {
        return "DelegatingLanguageProvider[" + language + " -> " + delegate + "]";
    }
}
