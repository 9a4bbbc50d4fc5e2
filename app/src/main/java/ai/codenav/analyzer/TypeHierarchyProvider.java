package ai.codenav.analyzer;

import ai.codenav.analyzer.model.TypeHierarchyResult;
import java.util.Optional;

/** Implemented by providers that can report the supertypes and subtypes of a type. */
public interface TypeHierarchyProvider extends CapabilityProvider {

    /**
     * Builds the hierarchy of the type that is, or encloses, the given element.
     *
     * @return empty when the element is not inside a type
     */
    Optional<TypeHierarchyResult> typeHierarchy(ElementHandle element, CancellationToken cancellation);
}
