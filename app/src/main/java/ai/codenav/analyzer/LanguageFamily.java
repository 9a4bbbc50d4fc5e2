package ai.codenav.analyzer;

import ai.codenav.util.QueryLimits;

/**
 * A group of languages whose providers are registered together because they share one model (for example Java and
 * Kotlin). Families are registered through {@link CapabilityRegistry#registerFamily}, which isolates failures so one
 * broken family does not prevent the others from registering.
 */
public interface LanguageFamily {

    String name();

    /** Runtime probe: whether the host model carries facts for any of this family's languages. */
    boolean isSupported(CodeModel model);

    void register(CapabilityRegistry registry, CodeModel model, QueryLimits limits);
}
