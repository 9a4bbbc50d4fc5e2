package ai.codenav.analyzer;

import ai.codenav.analyzer.model.DefinitionResult;
import java.util.Optional;

/** Implemented by providers that can navigate from a reference occurrence to its declaration. */
public interface DefinitionProvider extends CapabilityProvider {

    /** @return empty when the element is a reference the model could not resolve */
    Optional<DefinitionResult> findDefinition(ElementHandle element, CancellationToken cancellation);
}
