package ai.codenav.analyzer;

import ai.codenav.analyzer.model.UsagesResult;
import java.util.Optional;

/** Implemented by providers that can list the reference occurrences of a declaration. */
public interface UsagesProvider extends CapabilityProvider {

    /**
     * @param element a declaration, or a reference occurrence whose target is searched
     * @return empty when the element is a reference the model could not resolve
     */
    Optional<UsagesResult> findUsages(ElementHandle element, SearchScope scope, CancellationToken cancellation);
}
