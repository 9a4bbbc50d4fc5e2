package ai.codenav.query;

/** Recoverable reasons a query produced no result. */
public enum QueryErrorKind {
    /** The position or qualified name did not resolve to any element. */
    NO_ELEMENT_AT_POSITION,
    /** No registered provider accepts the element's language for the requested capability. */
    NO_PROVIDER_FOR_LANGUAGE,
    /** The element is not inside the kind of declaration the query works on. */
    NOT_A_TYPE_OR_METHOD,
    /** The start is a reference the model could not resolve to a declaration. */
    SYMBOL_NOT_RESOLVED,
    /** The host's index is still being built. */
    INDEX_NOT_READY,
    CANCELLED
}
