package ai.codenav.analyzer;

import ai.codenav.analyzer.model.CallHierarchyResult;
import java.util.Optional;

/**
 * Implemented by providers that can build caller and callee trees.
 *
 * <p>Callers of a method include callers of every method it overrides, so a call made through an interface or base
 * class reference is reported.
 */
public interface CallHierarchyProvider extends CapabilityProvider {

    /**
     * @param element a method or function, or any element inside one
     * @param depth number of levels to expand below the start method, already clamped by the caller
     * @return empty when the element is not inside a method or function
     */
    Optional<CallHierarchyResult> callHierarchy(
            ElementHandle element, CallDirection direction, int depth, CancellationToken cancellation);
}
