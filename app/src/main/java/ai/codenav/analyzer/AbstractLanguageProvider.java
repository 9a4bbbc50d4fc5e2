package ai.codenav.analyzer;

import ai.codenav.analyzer.hierarchy.CallHierarchyResolver;
import ai.codenav.analyzer.hierarchy.ImplementationFinder;
import ai.codenav.analyzer.hierarchy.SuperMethodResolver;
import ai.codenav.analyzer.hierarchy.TypeHierarchyResolver;
import ai.codenav.analyzer.model.CallHierarchyResult;
import ai.codenav.analyzer.model.DefinitionResult;
import ai.codenav.analyzer.model.ImplementationsResult;
import ai.codenav.analyzer.model.SuperMethodsResult;
import ai.codenav.analyzer.model.SymbolMatch;
import ai.codenav.analyzer.model.TypeHierarchyResult;
import ai.codenav.analyzer.model.UsagesResult;
import ai.codenav.analyzer.navigation.DefinitionFinder;
import ai.codenav.analyzer.navigation.UsageFinder;
import ai.codenav.analyzer.search.SymbolSearcher;
import ai.codenav.util.QueryLimits;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Base for a language family's provider: implements every capability by running the shared resolvers with this
 * provider as their {@link LanguagePolicy}. Subclasses override the policy hooks where their language differs.
 */
public abstract class AbstractLanguageProvider implements LanguageProvider, LanguagePolicy {

    protected final CodeModel model;
    protected final QueryLimits limits;
    private final Language language;
    private final Set<Language> familyLanguages;

    private final TypeHierarchyResolver typeHierarchyResolver;
    private final CallHierarchyResolver callHierarchyResolver;
    private final SuperMethodResolver superMethodResolver;
    private final ImplementationFinder implementationFinder;
    private final SymbolSearcher symbolSearcher;
    private final UsageFinder usageFinder;
    private final DefinitionFinder definitionFinder;

    protected AbstractLanguageProvider(
            CodeModel model, QueryLimits limits, Language language, Set<Language> familyLanguages) {
        this.model = model;
        this.limits = limits;
        this.language = language;
        this.familyLanguages = Set.copyOf(familyLanguages);
        this.typeHierarchyResolver = new TypeHierarchyResolver(model, this, limits);
        this.callHierarchyResolver = new CallHierarchyResolver(model, this, limits);
        this.superMethodResolver = new SuperMethodResolver(model, this, limits);
        this.implementationFinder = new ImplementationFinder(model, this, limits);
        this.symbolSearcher = new SymbolSearcher(model, this);
        this.usageFinder = new UsageFinder(model, this, limits);
        this.definitionFinder = new DefinitionFinder(model, this);
    }

    @Override
    public Language language() {
        return language;
    }

    /** Languages whose elements this provider accepts. */
    public Set<Language> familyLanguages() {
        return familyLanguages;
    }

    @Override
    public boolean canHandle(ElementHandle element) {
        return handles(model.languageOf(element));
    }

    @Override
    public boolean isAvailable() {
        return model.languages().stream().anyMatch(familyLanguages::contains);
    }

    @Override
    public Optional<TypeHierarchyResult> typeHierarchy(ElementHandle element, CancellationToken cancellation) {
        return typeHierarchyResolver.resolve(element, cancellation);
    }

    @Override
    public Optional<CallHierarchyResult> callHierarchy(
            ElementHandle element, CallDirection direction, int depth, CancellationToken cancellation) {
        return callHierarchyResolver.resolve(element, direction, depth, cancellation);
    }

    @Override
    public Optional<SuperMethodsResult> superMethods(ElementHandle element, CancellationToken cancellation) {
        return superMethodResolver.resolve(element, cancellation);
    }

    @Override
    public List<SymbolMatch> searchSymbols(
            String pattern, SearchScope scope, int limit, CancellationToken cancellation) {
        return symbolSearcher.search(pattern, scope, limit, cancellation);
    }

    @Override
    public Optional<ImplementationsResult> findImplementations(ElementHandle element, CancellationToken cancellation) {
        return implementationFinder.find(element, cancellation);
    }

    @Override
    public Optional<UsagesResult> findUsages(
            ElementHandle element, SearchScope scope, CancellationToken cancellation) {
        return usageFinder.find(element, scope, cancellation);
    }

    @Override
    public Optional<DefinitionResult> findDefinition(ElementHandle element, CancellationToken cancellation) {
        return definitionFinder.find(element, cancellation);
    }

    // LanguagePolicy defaults

    @Override
    public boolean handles(Language language) {
        return familyLanguages.contains(language);
    }

    @Override
    public ElementKind typeKindOf(ElementHandle type) {
        return model.kindOf(type);
    }

    @Override
    public List<String> parameterTypesOf(ElementHandle callable) {
        return model.parameterTypesOf(callable);
    }

    @Override
    public boolean sameSignature(ElementHandle method, ElementHandle ancestorMethod) {
        return parameterTypesOf(method).equals(parameterTypesOf(ancestorMethod));
    }

    @Override
    public List<ElementHandle> directSuperMethods(ElementHandle method) {
        return model.overriddenMethods(method);
    }

    @Override
    public Optional<String> containerNameOf(ElementHandle declaration) {
        return model.containerOf(declaration).filter(c -> model.kindOf(c).isType()).map(model::nameOf);
    }

    /**
     * Super methods found by name alone: each declared supertype branch is searched depth-first, left to right, and
     * the first ancestor declaring a callable of the same name ends that branch.
     */
    protected List<ElementHandle> superMethodsByName(ElementHandle method) {
        var type = model.containerOf(method).filter(c -> model.kindOf(c).isType());
        if (type.isEmpty()) {
            return List.of();
        }
        var found = new ArrayList<ElementHandle>();
        collectByName(type.get(), model.nameOf(method), new HashSet<>(), found, 0);
        return found;
    }

    private void collectByName(
            ElementHandle type, String name, Set<ElementHandle> visited, List<ElementHandle> found, int depth) {
        if (depth >= limits.maxHierarchyDepth() || found.size() >= limits.maxSuperMethods()) {
            return;
        }
        for (var ref : model.declaredSupertypes(type)) {
            var ancestor = ref.target();
            if (ancestor == null || !visited.add(ancestor)) {
                continue;
            }
            var match = model.membersNamed(ancestor, name).stream()
                    .filter(m -> model.kindOf(m).isCallable())
                    .findFirst();
            if (match.isPresent()) {
                found.add(match.get());
            } else {
                collectByName(ancestor, name, visited, found, depth + 1);
            }
        }
    }

    /** Module-style container name: the qualified name minus its last segment, else the file name sans extension. */
    protected Optional<String> moduleNameOf(ElementHandle declaration) {
        var qualified = model.qualifiedNameOf(declaration);
        if (qualified.isPresent() && qualified.get().lastIndexOf('.') > 0) {
            var q = qualified.get();
            return Optional.of(q.substring(0, q.lastIndexOf('.')));
        }
        return model.locationOf(declaration).map(loc -> {
            var path = loc.path();
            var fileName = path.substring(path.lastIndexOf('/') + 1);
            int dot = fileName.lastIndexOf('.');
            return dot > 0 ? fileName.substring(0, dot) : fileName;
        });
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + language + "]";
    }
}
