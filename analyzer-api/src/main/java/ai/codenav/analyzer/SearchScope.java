package ai.codenav.analyzer;

/** Which declarations a search may see. */
public enum SearchScope {
    /** Declarations in the project's own sources. */
    PROJECT,
    /** Project sources plus library and external dependencies. */
    ALL;

    public static SearchScope of(boolean includeLibraries) {
        return includeLibraries ? ALL : PROJECT;
    }
}
