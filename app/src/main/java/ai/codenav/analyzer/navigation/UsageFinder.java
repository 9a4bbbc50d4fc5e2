package ai.codenav.analyzer.navigation;

import ai.codenav.analyzer.CallSite;
import ai.codenav.analyzer.CancellationToken;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.ElementHandle;
import ai.codenav.analyzer.ElementKind;
import ai.codenav.analyzer.ElementRenderer;
import ai.codenav.analyzer.LanguagePolicy;
import ai.codenav.analyzer.SearchScope;
import ai.codenav.analyzer.SourceLocation;
import ai.codenav.analyzer.model.CallNode;
import ai.codenav.analyzer.model.UsageEntry;
import ai.codenav.analyzer.model.UsageType;
import ai.codenav.analyzer.model.UsagesResult;
import ai.codenav.util.QueryLimits;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lists the reference occurrences of a declaration in model order. Starting on a reference searches the usages of
 * its target, so "find usages" works from either end.
 */
public final class UsageFinder {
    private static final Logger logger = LogManager.getLogger(UsageFinder.class);

    private final CodeModel model;
    private final QueryLimits limits;
    private final ElementRenderer renderer;

    public UsageFinder(CodeModel model, LanguagePolicy policy, QueryLimits limits) {
        this.model = model;
        this.limits = limits;
        this.renderer = new ElementRenderer(model, policy);
    }

    public Optional<UsagesResult> find(ElementHandle element, SearchScope scope, CancellationToken cancellation) {
        var maybeTarget = model.declarationOf(element);
        if (maybeTarget.isEmpty()) {
            logger.debug("{} does not resolve to a declaration", element);
            return Optional.empty();
        }
        var target = maybeTarget.get();
        List<UsageEntry> usages;
        try (var references = model.referencesTo(target, scope)) {
            usages = references
                    .peek(r -> cancellation.checkCancelled())
                    .distinct()
                    .limit(limits.maxUsages())
                    .map(r -> usageEntry(r, target))
                    .toList();
        }
        logger.debug("{} usages of {} ({})", usages.size(), renderer.displayName(target), scope);
        return Optional.of(new UsagesResult(
                model.nameOf(target), model.qualifiedNameOf(target).orElse(null), usages, usages.size()));
    }

    private UsageEntry usageEntry(ElementHandle reference, ElementHandle target) {
        var location = model.locationOf(reference);
        var from = model.containerOf(reference);
        return new UsageEntry(
                location.map(SourceLocation::path).orElse(CallNode.UNKNOWN_FILE),
                location.map(SourceLocation::line).orElse(0),
                location.map(SourceLocation::column).orElse(0),
                classify(reference, target, from),
                from.map(renderer::memberName).orElse(null),
                renderer.languageName(reference));
    }

    private UsageType classify(ElementHandle reference, ElementHandle target, Optional<ElementHandle> from) {
        var kind = model.kindOf(target);
        if (kind == ElementKind.FIELD) {
            return UsageType.FIELD_ACCESS;
        }
        if (kind.isCallable() && from.isPresent() && isCallSite(from.get(), target, reference)) {
            return UsageType.METHOD_CALL;
        }
        return UsageType.REFERENCE;
    }

    private boolean isCallSite(ElementHandle caller, ElementHandle target, ElementHandle reference) {
        if (!model.kindOf(caller).isCallable()) {
            return false;
        }
        int line = model.locationOf(reference).map(SourceLocation::line).orElse(-1);
        try (var sites = model.callSitesWithin(caller)) {
            return sites.filter(CallSite::isResolved).anyMatch(s -> target.equals(s.target()) && s.line() == line);
        }
    }
}
