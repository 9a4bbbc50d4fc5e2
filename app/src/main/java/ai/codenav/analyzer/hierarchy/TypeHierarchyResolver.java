package ai.codenav.analyzer.hierarchy;

import ai.codenav.analyzer.CancellationToken;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.ElementHandle;
import ai.codenav.analyzer.ElementKind;
import ai.codenav.analyzer.ElementRenderer;
import ai.codenav.analyzer.LanguagePolicy;
import ai.codenav.analyzer.model.TypeHierarchyResult;
import ai.codenav.analyzer.model.TypeNode;
import ai.codenav.util.QueryLimits;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the supertype tree and the flat subtype list of a type.
 *
 * <p>Supertypes are expanded depth-first in declaration order (superclass, then interfaces). A type already placed in
 * the current root-to-leaf path is not placed again below itself, which keeps cyclic declarations finite. A diamond
 * ancestor is listed under every branch that declares it.
 */
public final class TypeHierarchyResolver {
    private static final Logger logger = LogManager.getLogger(TypeHierarchyResolver.class);

    private final CodeModel model;
    private final LanguagePolicy policy;
    private final QueryLimits limits;
    private final ElementRenderer renderer;

    public TypeHierarchyResolver(CodeModel model, LanguagePolicy policy, QueryLimits limits) {
        this.model = model;
        this.policy = policy;
        this.limits = limits;
        this.renderer = new ElementRenderer(model, policy);
    }

    public Optional<TypeHierarchyResult> resolve(ElementHandle element, CancellationToken cancellation) {
        var maybeType = model.enclosing(element, ElementKind::isType);
        if (maybeType.isEmpty()) {
            return Optional.empty();
        }
        var type = maybeType.get();
        cancellation.checkCancelled();

        var path = new HashSet<String>();
        path.add(renderer.displayName(type));
        var supertypes = supertypesOf(type, path, 0, cancellation);
        var subtypes = subtypesOf(type, cancellation);
        logger.debug(
                "Type hierarchy of {}: {} direct supertypes, {} subtypes",
                renderer.displayName(type),
                supertypes.size(),
                subtypes.size());
        return Optional.of(new TypeHierarchyResult(renderer.typeNode(type, null), supertypes, subtypes));
    }

    private List<TypeNode> supertypesOf(
            ElementHandle type, Set<String> path, int depth, CancellationToken cancellation) {
        if (depth >= limits.maxHierarchyDepth()) {
            logger.debug("Hierarchy ceiling {} reached at {}", limits.maxHierarchyDepth(), renderer.displayName(type));
            return List.of();
        }
        var result = new ArrayList<TypeNode>();
        for (var ref : model.declaredSupertypes(type)) {
            cancellation.checkCancelled();
            var target = ref.target();
            if (target == null) {
                var declared = ref.declaredName();
                if (policy.isImplicitRoot(declared) || path.contains(declared)) {
                    continue;
                }
                logger.debug("Unresolved supertype {} of {}", declared, renderer.displayName(type));
                var kind = ref.interfaceSlot() ? ElementKind.INTERFACE : ElementKind.CLASS;
                result.add(TypeNode.unresolved(declared, kind, renderer.languageName(type)));
                continue;
            }
            var name = renderer.displayName(target);
            if (policy.isImplicitRoot(name) || !path.add(name)) {
                continue;
            }
            var grandparents = supertypesOf(target, path, depth + 1, cancellation);
            path.remove(name);
            result.add(renderer.typeNode(target, grandparents));
        }
        return result;
    }

    private List<TypeNode> subtypesOf(ElementHandle type, CancellationToken cancellation) {
        try (var subtypes = model.transitiveSubtypes(type)) {
            return subtypes.peek(s -> cancellation.checkCancelled())
                    .filter(s -> !s.equals(type))
                    .distinct()
                    .limit(limits.maxSubtypes())
                    .map(s -> renderer.typeNode(s, null))
                    .toList();
        }
    }
}
