package ai.codenav.analyzer.model;

/** How a reference occurrence uses its target. */
public enum UsageType {
    METHOD_CALL,
    FIELD_ACCESS,
    REFERENCE
}
