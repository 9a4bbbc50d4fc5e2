package ai.codenav.analyzer;

import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

public class Languages {
    public static final Language JAVA = new Language("JAVA", "Java", List.of("java"), null);
    public static final Language KOTLIN = new Language("kotlin", "Kotlin", List.of("kt", "kts"), null);
    public static final Language PYTHON = new Language("Python", "Python", List.of("py", "pyi"), null);
    public static final Language JAVASCRIPT =
            new Language("JavaScript", "JavaScript", List.of("js", "mjs", "cjs", "jsx"), null);
    public static final Language TYPESCRIPT =
            new Language("TypeScript", "TypeScript", List.of("ts", "tsx", "mts", "cts"), JAVASCRIPT);
    public static final Language NONE = new Language("NONE", "None", List.of(), null);

    public static final List<Language> ALL_LANGUAGES = List.of(JAVA, KOTLIN, PYTHON, JAVASCRIPT, TYPESCRIPT);

    private Languages() {}

    /** Looks up a known language by its id, case-insensitively. Returns {@link #NONE} when unknown. */
    public static Language fromId(@Nullable String id) {
        if (id == null || id.isBlank()) {
            return NONE;
        }
        for (Language lang : ALL_LANGUAGES) {
            if (lang.id().equalsIgnoreCase(id) || lang.name().equalsIgnoreCase(id)) {
                return lang;
            }
        }
        return NONE;
    }

    public static Language fromExtension(String extension) {
        if (extension.isEmpty()) {
            return NONE;
        }
        String lowerExt = extension.toLowerCase(Locale.ROOT);
        // Ensure the extension does not start with a dot for consistent matching.
        String normalizedExt = lowerExt.startsWith(".") ? lowerExt.substring(1) : lowerExt;

        for (Language lang : ALL_LANGUAGES) {
            if (lang.extensions().contains(normalizedExt)) {
                return lang;
            }
        }
        return NONE;
    }

    /** Derives the language of a source path from its extension. */
    public static Language fromPath(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        int dot = path.lastIndexOf('.');
        if (dot <= slash) {
            return NONE;
        }
        return fromExtension(path.substring(dot + 1));
    }
}
