package ai.codenav.analyzer;

import java.util.Locale;

public enum CallDirection {
    CALLERS,
    CALLEES;

    /** Parses {@code callers}/{@code callees} case-insensitively. */
    public static CallDirection parse(String raw) {
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown call direction '" + raw + "', expected callers or callees", e);
        }
    }
}
