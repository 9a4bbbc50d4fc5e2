package ai.codenav.analyzer.hierarchy;

import ai.codenav.analyzer.CallDirection;
import ai.codenav.analyzer.CallSite;
import ai.codenav.analyzer.CancellationToken;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.ElementHandle;
import ai.codenav.analyzer.ElementKind;
import ai.codenav.analyzer.ElementRenderer;
import ai.codenav.analyzer.LanguagePolicy;
import ai.codenav.analyzer.SearchScope;
import ai.codenav.analyzer.model.CallHierarchyResult;
import ai.codenav.analyzer.model.CallNode;
import ai.codenav.util.QueryLimits;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Expands callers or callees of a method into a tree.
 *
 * <p>One set of method keys is shared by the whole traversal: a method appears at most once in a result, and the
 * start method never appears below itself. Each level holds at most {@link QueryLimits#maxResultsPerLevel()} entries
 * and recursion stops at {@link QueryLimits#maxStackDepth()} regardless of the requested depth.
 */
public final class CallHierarchyResolver {
    private static final Logger logger = LogManager.getLogger(CallHierarchyResolver.class);

    private final CodeModel model;
    private final LanguagePolicy policy;
    private final QueryLimits limits;
    private final ElementRenderer renderer;

    public CallHierarchyResolver(CodeModel model, LanguagePolicy policy, QueryLimits limits) {
        this.model = model;
        this.policy = policy;
        this.limits = limits;
        this.renderer = new ElementRenderer(model, policy);
    }

    public Optional<CallHierarchyResult> resolve(
            ElementHandle element, CallDirection direction, int depth, CancellationToken cancellation) {
        var maybeMethod = model.enclosing(element, ElementKind::isCallable);
        if (maybeMethod.isEmpty()) {
            return Optional.empty();
        }
        var method = maybeMethod.get();
        var visited = new HashSet<String>();
        visited.add(renderer.methodKey(method));

        var calls = direction == CallDirection.CALLERS
                ? callers(method, depth, 0, visited, cancellation)
                : callees(method, depth, 0, visited, cancellation);
        logger.debug("{} of {}: {} at top level", direction, renderer.callName(method), calls.size());
        return Optional.of(new CallHierarchyResult(renderer.callNode(method, null), calls));
    }

    private List<CallNode> callers(
            ElementHandle method, int remaining, int stackDepth, Set<String> visited, CancellationToken cancellation) {
        if (remaining <= 0 || stackDepth >= limits.maxStackDepth()) {
            return List.of();
        }
        cancellation.checkCancelled();

        var searchSet = superMethodClosure(method);
        var searchKeys = new HashSet<String>();
        for (var m : searchSet) {
            searchKeys.add(renderer.methodKey(m));
        }

        var found = new LinkedHashMap<String, ElementHandle>();
        search:
        for (var target : searchSet) {
            try (var references = model.referencesTo(target, SearchScope.PROJECT)) {
                var it = references.iterator();
                while (it.hasNext()) {
                    cancellation.checkCancelled();
                    var caller = model.enclosing(it.next(), ElementKind::isCallable);
                    if (caller.isEmpty()) {
                        continue;
                    }
                    var key = renderer.methodKey(caller.get());
                    if (searchKeys.contains(key) || visited.contains(key)) {
                        continue;
                    }
                    found.putIfAbsent(key, caller.get());
                    if (found.size() >= limits.maxResultsPerLevel()) {
                        break search;
                    }
                }
            }
        }

        var result = new ArrayList<CallNode>();
        for (var entry : found.entrySet()) {
            if (!visited.add(entry.getKey())) {
                continue;
            }
            var caller = entry.getValue();
            var children = callers(caller, remaining - 1, stackDepth + 1, visited, cancellation);
            result.add(renderer.callNode(caller, children));
        }
        return result;
    }

    private List<CallNode> callees(
            ElementHandle method, int remaining, int stackDepth, Set<String> visited, CancellationToken cancellation) {
        if (remaining <= 0 || stackDepth >= limits.maxStackDepth()) {
            return List.of();
        }
        cancellation.checkCancelled();

        var result = new ArrayList<CallNode>();
        var unresolvedSeen = new HashSet<String>();
        List<CallSite> sites;
        try (var stream = model.callSitesWithin(method)) {
            sites = stream.limit(limits.maxResultsPerLevel()).toList();
        }
        for (var site : sites) {
            cancellation.checkCancelled();
            var target = site.target();
            if (target == null) {
                if (unresolvedSeen.add(site.calleeName())) {
                    logger.debug("Unresolved call {} in {}", site.calleeText(), renderer.callName(method));
                    result.add(CallNode.unresolved(site.calleeName(), renderer.languageName(method)));
                }
                continue;
            }
            var callee = model.enclosing(target, ElementKind::isCallable).orElse(target);
            if (!visited.add(renderer.methodKey(callee))) {
                continue;
            }
            var children = callees(callee, remaining - 1, stackDepth + 1, visited, cancellation);
            result.add(renderer.callNode(callee, children));
        }
        return result;
    }

    /** The method plus every method it overrides, directly or transitively, up to the super-method cap. */
    private Set<ElementHandle> superMethodClosure(ElementHandle method) {
        var closure = new LinkedHashSet<ElementHandle>();
        closure.add(method);
        var queue = new ArrayDeque<ElementHandle>();
        queue.add(method);
        int supers = 0;
        while (!queue.isEmpty() && supers < limits.maxSuperMethods()) {
            for (var sup : policy.directSuperMethods(queue.poll())) {
                if (supers >= limits.maxSuperMethods()) {
                    break;
                }
                if (closure.add(sup)) {
                    supers++;
                    queue.add(sup);
                }
            }
        }
        return closure;
    }
}
