package ai.codenav.query;

import ai.codenav.analyzer.CallDirection;
import ai.codenav.analyzer.CallHierarchyProvider;
import ai.codenav.analyzer.CancellationToken;
import ai.codenav.analyzer.CapabilityProvider;
import ai.codenav.analyzer.CapabilityRegistry;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.DefinitionProvider;
import ai.codenav.analyzer.DelegatingLanguageProvider;
import ai.codenav.analyzer.ElementHandle;
import ai.codenav.analyzer.ImplementationsProvider;
import ai.codenav.analyzer.IndexNotReadyException;
import ai.codenav.analyzer.Language;
import ai.codenav.analyzer.LanguageFamilies;
import ai.codenav.analyzer.LanguageFamily;
import ai.codenav.analyzer.SearchScope;
import ai.codenav.analyzer.SuperMethodsProvider;
import ai.codenav.analyzer.SymbolSearchProvider;
import ai.codenav.analyzer.TypeHierarchyProvider;
import ai.codenav.analyzer.UsagesProvider;
import ai.codenav.analyzer.model.CallHierarchyResult;
import ai.codenav.analyzer.model.DefinitionResult;
import ai.codenav.analyzer.model.ImplementationsResult;
import ai.codenav.analyzer.model.SuperMethodsResult;
import ai.codenav.analyzer.model.SymbolMatch;
import ai.codenav.analyzer.model.SymbolSearchResult;
import ai.codenav.analyzer.model.TypeHierarchyResult;
import ai.codenav.analyzer.model.UsagesResult;
import ai.codenav.analyzer.search.NameMatcher;
import ai.codenav.util.QueryLimits;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.BiFunction;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point for code navigation queries. Resolves the start reference against the {@link CodeModel}, picks a
 * provider for the element's language, runs the query and wraps the outcome in a {@link QueryResult}.
 *
 * <p>Index-not-ready and cancellation are reported as {@link QueryResult.Failure}s; other runtime exceptions are
 * programming errors and propagate. Safe for concurrent use once constructed.
 */
public final class CodeQueryService {
    private static final Logger logger = LogManager.getLogger(CodeQueryService.class);

    private final CodeModel model;
    private final CapabilityRegistry registry;

    public CodeQueryService(CodeModel model) {
        this(model, QueryLimits.load());
    }

    public CodeQueryService(CodeModel model, QueryLimits limits) {
        this(model, limits, LanguageFamilies.defaults());
    }

    public CodeQueryService(CodeModel model, QueryLimits limits, List<LanguageFamily> families) {
        this(model, new CapabilityRegistry(limits));
        for (var family : families) {
            registry.registerFamily(family, model);
        }
    }

    /** Uses a registry the caller has already populated. */
    public CodeQueryService(CodeModel model, CapabilityRegistry registry) {
        this.model = model;
        this.registry = registry;
    }

    public CapabilityRegistry registry() {
        return registry;
    }

    private QueryLimits limits() {
        return registry.limits();
    }

    // Type hierarchy

    public QueryResult<TypeHierarchyResult> typeHierarchy(StartRef start) {
        return typeHierarchy(start, CancellationToken.none());
    }

    public QueryResult<TypeHierarchyResult> typeHierarchy(StartRef start, CancellationToken cancellation) {
        return guarded(
                cancellation,
                () -> dispatch(
                        TypeHierarchyProvider.class,
                        start,
                        (provider, element) -> provider.typeHierarchy(element, cancellation),
                        "No type found at " + start));
    }

    // Call hierarchy

    public QueryResult<CallHierarchyResult> callHierarchy(
            StartRef start, CallDirection direction, @Nullable Integer depth) {
        return callHierarchy(start, direction, depth, CancellationToken.none());
    }

    /** @param depth requested levels; null selects the default, other values are clamped into the allowed range */
    public QueryResult<CallHierarchyResult> callHierarchy(
            StartRef start, CallDirection direction, @Nullable Integer depth, CancellationToken cancellation) {
        int effectiveDepth = limits().clampCallDepth(depth);
        return guarded(
                cancellation,
                () -> dispatch(
                        CallHierarchyProvider.class,
                        start,
                        (provider, element) -> provider.callHierarchy(element, direction, effectiveDepth, cancellation),
                        "No method or function found at " + start));
    }

    // Super methods

    public QueryResult<SuperMethodsResult> superMethods(StartRef start) {
        return superMethods(start, CancellationToken.none());
    }

    public QueryResult<SuperMethodsResult> superMethods(StartRef start, CancellationToken cancellation) {
        return guarded(
                cancellation,
                () -> dispatch(
                        SuperMethodsProvider.class,
                        start,
                        (provider, element) -> provider.superMethods(element, cancellation),
                        "No method declared in a type found at " + start));
    }

    // Implementations

    public QueryResult<ImplementationsResult> findImplementations(StartRef start) {
        return findImplementations(start, CancellationToken.none());
    }

    public QueryResult<ImplementationsResult> findImplementations(StartRef start, CancellationToken cancellation) {
        return guarded(
                cancellation,
                () -> dispatch(
                        ImplementationsProvider.class,
                        start,
                        (provider, element) -> provider.findImplementations(element, cancellation),
                        "No type or method found at " + start));
    }

    // Usages and definitions

    public QueryResult<UsagesResult> findUsages(StartRef start) {
        return findUsages(start, SearchScope.PROJECT, CancellationToken.none());
    }

    /** Reference occurrences of the declaration at {@code start}, or of the target when it is a reference. */
    public QueryResult<UsagesResult> findUsages(StartRef start, SearchScope scope, CancellationToken cancellation) {
        return guarded(
                cancellation,
                () -> dispatch(
                        UsagesProvider.class,
                        start,
                        (provider, element) -> provider.findUsages(element, scope, cancellation),
                        QueryErrorKind.SYMBOL_NOT_RESOLVED,
                        "The reference at " + start + " does not resolve to a declaration"));
    }

    public QueryResult<DefinitionResult> findDefinition(StartRef start) {
        return findDefinition(start, CancellationToken.none());
    }

    public QueryResult<DefinitionResult> findDefinition(StartRef start, CancellationToken cancellation) {
        return guarded(
                cancellation,
                () -> dispatch(
                        DefinitionProvider.class,
                        start,
                        (provider, element) -> provider.findDefinition(element, cancellation),
                        QueryErrorKind.SYMBOL_NOT_RESOLVED,
                        "The reference at " + start + " does not resolve to a declaration"));
    }

    // Symbol search

    public QueryResult<SymbolSearchResult> searchSymbols(String pattern, SearchScope scope, @Nullable Integer limit) {
        return searchSymbols(pattern, scope, limit, CancellationToken.none());
    }

    /**
     * Searches every available language provider and merges their matches. Matches reported by more than one provider
     * (same file, line and name) are kept once.
     */
    public QueryResult<SymbolSearchResult> searchSymbols(
            String pattern, SearchScope scope, @Nullable Integer limit, CancellationToken cancellation) {
        int effectiveLimit = limits().clampSearchLimit(limit);
        if (pattern.isBlank()) {
            return QueryResult.success(new SymbolSearchResult(List.of(), 0, pattern));
        }
        return guarded(cancellation, () -> {
            var merged = new LinkedHashMap<String, SymbolMatch>();
            for (var provider : searchProviders()) {
                cancellation.checkCancelled();
                for (var match : provider.searchSymbols(pattern, scope, effectiveLimit, cancellation)) {
                    merged.putIfAbsent(match.dedupKey(), match);
                }
            }
            var ranked = new NameMatcher(pattern).rank(new ArrayList<>(merged.values()));
            var symbols = ranked.size() > effectiveLimit ? ranked.subList(0, effectiveLimit) : ranked;
            logger.debug("searchSymbols '{}' ({}): {} of {} matches", pattern, scope, symbols.size(), ranked.size());
            return QueryResult.success(new SymbolSearchResult(symbols, symbols.size(), pattern));
        });
    }

    /** Available search providers, with dialect registrations folded into the provider they delegate to. */
    private List<SymbolSearchProvider> searchProviders() {
        var distinct = new LinkedHashSet<SymbolSearchProvider>();
        for (var provider : registry.providers(SymbolSearchProvider.class)) {
            distinct.add(
                    provider instanceof DelegatingLanguageProvider delegating ? delegating.delegate() : provider);
        }
        return List.copyOf(distinct);
    }

    // Plumbing

    private <P extends CapabilityProvider, R> QueryResult<R> dispatch(
            Class<P> capability,
            StartRef start,
            BiFunction<P, ElementHandle, Optional<R>> operation,
            String notApplicableMessage) {
        return dispatch(capability, start, operation, QueryErrorKind.NOT_A_TYPE_OR_METHOD, notApplicableMessage);
    }

    private <P extends CapabilityProvider, R> QueryResult<R> dispatch(
            Class<P> capability,
            StartRef start,
            BiFunction<P, ElementHandle, Optional<R>> operation,
            QueryErrorKind notApplicableKind,
            String notApplicableMessage) {
        var maybeElement = resolve(start);
        if (maybeElement.isEmpty()) {
            logger.debug("Nothing resolves at {}", start);
            return QueryResult.failure(QueryErrorKind.NO_ELEMENT_AT_POSITION, "No element found at " + start);
        }
        var element = maybeElement.get();
        Language language = model.languageOf(element);
        var provider = registry.selectProvider(capability, element, language);
        if (provider.isEmpty()) {
            var supported = registry.supportedLanguages(capability).stream()
                    .map(Language::name)
                    .collect(Collectors.joining(", "));
            return QueryResult.failure(
                    QueryErrorKind.NO_PROVIDER_FOR_LANGUAGE,
                    "No " + capability.getSimpleName() + " for language " + language.name() + ". Supported: "
                            + (supported.isEmpty() ? "none" : supported));
        }
        logger.debug("{} for {} handled by {}", capability.getSimpleName(), start, provider.get());
        return operation
                .apply(provider.get(), element)
                .map(QueryResult::success)
                .orElseGet(() -> QueryResult.failure(notApplicableKind, notApplicableMessage));
    }

    private Optional<ElementHandle> resolve(StartRef start) {
        if (start instanceof StartRef.Position position) {
            return model.resolveAt(position.file(), position.line(), position.column());
        }
        return model.resolveByQualifiedName(((StartRef.QualifiedName) start).name());
    }

    private <R> QueryResult<R> guarded(CancellationToken cancellation, Supplier<QueryResult<R>> body) {
        try {
            cancellation.checkCancelled();
            if (!model.isReady()) {
                return QueryResult.failure(
                        QueryErrorKind.INDEX_NOT_READY, "The code index is being built; retry when it is ready");
            }
            return body.get();
        } catch (IndexNotReadyException e) {
            logger.debug("Index not ready: {}", e.getMessage());
            return QueryResult.failure(QueryErrorKind.INDEX_NOT_READY, e.getMessage());
        } catch (CancellationException e) {
            logger.debug("Query cancelled");
            return QueryResult.failure(QueryErrorKind.CANCELLED, "Query was cancelled");
        }
    }
}
