package ai.codenav.analyzer;

import ai.codenav.analyzer.model.SuperMethodsResult;
import java.util.Optional;

/** Implemented by providers that can list the ancestor methods a method overrides or implements. */
public interface SuperMethodsProvider extends CapabilityProvider {

    /** @return empty when the element is not inside a method declared in a type */
    Optional<SuperMethodsResult> superMethods(ElementHandle element, CancellationToken cancellation);
}
