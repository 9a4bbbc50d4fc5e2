package ai.codenav.analyzer;

import ai.codenav.analyzer.model.ImplementationsResult;
import java.util.Optional;

/** Implemented by providers that can list overriding methods of a method, or inheritors of a type. */
public interface ImplementationsProvider extends CapabilityProvider {

    /** @return empty when the element lies in neither a method nor a type */
    Optional<ImplementationsResult> findImplementations(ElementHandle element, CancellationToken cancellation);
}
