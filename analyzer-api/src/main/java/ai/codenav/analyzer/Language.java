package ai.codenav.analyzer;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A language tag as reported by the code model. Providers are dispatched on this tag.
 *
 * @param id machine identifier as the host reports it (e.g. {@code JAVA}, {@code kotlin})
 * @param name human-friendly name used in results (e.g. {@code Java})
 * @param extensions source file extensions, without the dot
 * @param base the language this one is a dialect of, or null (e.g. TypeScript's base is JavaScript)
 */
public record Language(String id, String name, List<String> extensions, @Nullable Language base) {

    public Language {
        extensions = List.copyOf(extensions);
    }

    public boolean isDialectOf(Language other) {
        return base != null && (base.equals(other) || base.isDialectOf(other));
    }

    @Override
    public String toString() {
        return name;
    }
}
