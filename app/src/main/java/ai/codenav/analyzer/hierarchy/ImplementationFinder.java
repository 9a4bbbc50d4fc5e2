package ai.codenav.analyzer.hierarchy;

import ai.codenav.analyzer.CancellationToken;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.ElementHandle;
import ai.codenav.analyzer.ElementKind;
import ai.codenav.analyzer.ElementRenderer;
import ai.codenav.analyzer.LanguagePolicy;
import ai.codenav.analyzer.model.ImplementationEntry;
import ai.codenav.analyzer.model.ImplementationsResult;
import ai.codenav.util.QueryLimits;
import java.util.List;
import java.util.Optional;

/** Lists overriding methods of a method, or inheritors of a type when the element is not inside a method. */
public final class ImplementationFinder {
    private final CodeModel model;
    private final LanguagePolicy policy;
    private final QueryLimits limits;
    private final ElementRenderer renderer;

    public ImplementationFinder(CodeModel model, LanguagePolicy policy, QueryLimits limits) {
        this.model = model;
        this.policy = policy;
        this.limits = limits;
        this.renderer = new ElementRenderer(model, policy);
    }

    public Optional<ImplementationsResult> find(ElementHandle element, CancellationToken cancellation) {
        var method = model.enclosing(element, ElementKind::isCallable);
        if (method.isPresent()) {
            return Optional.of(ImplementationsResult.of(overridersOf(method.get(), cancellation)));
        }
        var type = model.enclosing(element, ElementKind::isType);
        return type.map(t -> ImplementationsResult.of(inheritorsOf(t, cancellation)));
    }

    private List<ImplementationEntry> overridersOf(ElementHandle method, CancellationToken cancellation) {
        try (var overriders = model.overridingMethods(method)) {
            return overriders
                    .peek(m -> cancellation.checkCancelled())
                    .filter(m -> !m.equals(method))
                    .distinct()
                    .limit(limits.maxImplementations())
                    .map(m -> renderer.implementationEntry(m, renderer.memberName(m), ElementKind.METHOD))
                    .toList();
        }
    }

    private List<ImplementationEntry> inheritorsOf(ElementHandle type, CancellationToken cancellation) {
        try (var subtypes = model.transitiveSubtypes(type)) {
            return subtypes.peek(t -> cancellation.checkCancelled())
                    .filter(t -> !t.equals(type))
                    .distinct()
                    .limit(limits.maxImplementations())
                    .map(t -> renderer.implementationEntry(t, renderer.displayName(t), policy.typeKindOf(t)))
                    .toList();
        }
    }
}
