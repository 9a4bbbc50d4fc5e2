package ai.codenav.analyzer.navigation;

import ai.codenav.analyzer.CancellationToken;
import ai.codenav.analyzer.CodeModel;
import ai.codenav.analyzer.ElementHandle;
import ai.codenav.analyzer.LanguagePolicy;
import ai.codenav.analyzer.SourceLocation;
import ai.codenav.analyzer.model.CallNode;
import ai.codenav.analyzer.model.DefinitionResult;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Go to definition: a reference occurrence resolves to its target, a declaration to itself. */
public final class DefinitionFinder {
    private static final Logger logger = LogManager.getLogger(DefinitionFinder.class);

    private final CodeModel model;
    private final LanguagePolicy policy;

    public DefinitionFinder(CodeModel model, LanguagePolicy policy) {
        this.model = model;
        this.policy = policy;
    }

    public Optional<DefinitionResult> find(ElementHandle element, CancellationToken cancellation) {
        cancellation.checkCancelled();
        var target = model.declarationOf(element);
        if (target.isEmpty()) {
            logger.debug("Reference {} has no resolved target", element);
        }
        return target.map(this::definition);
    }

    private DefinitionResult definition(ElementHandle declaration) {
        var kind = model.kindOf(declaration);
        var location = model.locationOf(declaration);
        return new DefinitionResult(
                model.nameOf(declaration),
                model.qualifiedNameOf(declaration).orElse(null),
                kind.isType() ? policy.typeKindOf(declaration) : kind,
                location.map(SourceLocation::path).orElse(CallNode.UNKNOWN_FILE),
                location.map(SourceLocation::line).orElse(0),
                location.map(SourceLocation::column).orElse(0),
                policy.containerNameOf(declaration).orElse(null),
                model.languageOf(declaration).name(),
                model.isLibrary(declaration));
    }
}
