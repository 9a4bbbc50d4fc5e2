package ai.codenav.analyzer;

/**
 * Marker for the per-language capability interfaces the query engine dispatches to. A provider is identified for
 * dispatch by its capability type together with the {@link Language} it serves.
 */
public interface CapabilityProvider {

    /** The language tag this provider is registered under. */
    Language language();

    /**
     * Whether this provider can process the given element. Implementations usually check the element's language and
     * that it is (or lies inside) the kind of declaration the capability works on.
     */
    boolean canHandle(ElementHandle element);

    /**
     * Whether the language support this provider depends on is present in the host. This is probed once at
     * registration and cached by the registry, so it should be cheap and side-effect free.
     */
    boolean isAvailable();
}
