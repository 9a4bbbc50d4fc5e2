package ai.codenav.analyzer.hierarchy;

import ai.codenav.analyzer.CancellationToken;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.ElementHandle;
import ai.codenav.analyzer.ElementKind;
import ai.codenav.analyzer.ElementRenderer;
import ai.codenav.analyzer.LanguagePolicy;
import ai.codenav.analyzer.model.SuperMethodEntry;
import ai.codenav.analyzer.model.SuperMethodsResult;
import ai.codenav.util.QueryLimits;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Walks the declared supertypes of a method's declaring type and reports every ancestor that declares a method the
 * starting method overrides. The walk continues through ancestors that do not declare the method, so a grandparent's
 * method is found even when the parent inherits it unchanged. The language's implicit root is walked like any other
 * ancestor, so {@code toString()} reports {@code java.lang.Object.toString}.
 */
public final class SuperMethodResolver {
    private static final Logger logger = LogManager.getLogger(SuperMethodResolver.class);

    private final CodeModel model;
    private final LanguagePolicy policy;
    private final QueryLimits limits;
    private final ElementRenderer renderer;

    public SuperMethodResolver(CodeModel model, LanguagePolicy policy, QueryLimits limits) {
        this.model = model;
        this.policy = policy;
        this.limits = limits;
        this.renderer = new ElementRenderer(model, policy);
    }

    public Optional<SuperMethodsResult> resolve(ElementHandle element, CancellationToken cancellation) {
        var maybeMethod = model.enclosing(element, ElementKind::isCallable);
        if (maybeMethod.isEmpty()) {
            return Optional.empty();
        }
        var method = maybeMethod.get();
        var maybeType = renderer.declaringType(method);
        if (maybeType.isEmpty()) {
            logger.debug("{} is not declared in a type", model.nameOf(method));
            return Optional.empty();
        }
        var type = maybeType.get();

        var hierarchy = new ArrayList<SuperMethodEntry>();
        walk(type, method, 1, new HashSet<>(), hierarchy, cancellation);
        return Optional.of(new SuperMethodsResult(renderer.methodInfo(method, type), hierarchy));
    }

    private void walk(
            ElementHandle type,
            ElementHandle method,
            int depth,
            Set<String> visited,
            List<SuperMethodEntry> out,
            CancellationToken cancellation) {
        if (depth > limits.maxHierarchyDepth()) {
            return;
        }
        var name = model.nameOf(method);
        for (var ref : model.declaredSupertypes(type)) {
            cancellation.checkCancelled();
            var ancestor = ref.target();
            if (ancestor == null) {
                logger.debug("Skipping unresolved supertype {} while looking for {}", ref.declaredName(), name);
                continue;
            }
            var ancestorName = renderer.displayName(ancestor);
            if (!visited.add(ancestorName + "#" + name)) {
                continue;
            }
            findOverridden(ancestor, method).ifPresent(m -> out.add(entry(m, ancestor, depth)));
            walk(ancestor, method, depth + 1, visited, out, cancellation);
        }
    }

    private Optional<ElementHandle> findOverridden(ElementHandle ancestor, ElementHandle method) {
        return model.membersNamed(ancestor, model.nameOf(method)).stream()
                .filter(m -> model.kindOf(m).isCallable())
                .filter(m -> policy.sameSignature(method, m))
                .findFirst();
    }

    private SuperMethodEntry entry(ElementHandle superMethod, ElementHandle ancestor, int depth) {
        var kind = policy.typeKindOf(ancestor);
        return new SuperMethodEntry(
                model.nameOf(superMethod),
                renderer.signatureOf(superMethod),
                renderer.displayName(ancestor),
                kind,
                renderer.fileOf(superMethod),
                renderer.lineOf(superMethod),
                kind == ElementKind.INTERFACE,
                depth,
                renderer.languageName(superMethod));
    }
}
