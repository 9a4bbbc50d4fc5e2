package ai.codenav.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Traversal ceilings and result caps shared by all resolvers.
 *
 * <p>Values come from the classpath resource {@code codenav.properties}; any key can be overridden with a system
 * property of the same name prefixed by {@code codenav.}, e.g. {@code -Dcodenav.maxCallDepth=7}. Unparseable or
 * non-positive values are logged and the default is kept.
 */
public record QueryLimits(
        int maxHierarchyDepth,
        int maxSubtypes,
        int maxStackDepth,
        int maxResultsPerLevel,
        int maxSuperMethods,
        int defaultCallDepth,
        int maxCallDepth,
        int maxImplementations,
        int defaultSearchLimit,
        int maxSearchLimit,
        int maxUsages) {
    private static final Logger logger = LogManager.getLogger(QueryLimits.class);

    public static final String RESOURCE = "codenav.properties";
    public static final String SYSTEM_PREFIX = "codenav.";

    private static final QueryLimits DEFAULTS = new QueryLimits(100, 100, 50, 20, 10, 3, 5, 100, 25, 100, 500);

    public QueryLimits {
        if (defaultCallDepth > maxCallDepth) {
            throw new IllegalArgumentException(
                    "defaultCallDepth " + defaultCallDepth + " exceeds maxCallDepth " + maxCallDepth);
        }
        if (defaultSearchLimit > maxSearchLimit) {
            throw new IllegalArgumentException(
                    "defaultSearchLimit " + defaultSearchLimit + " exceeds maxSearchLimit " + maxSearchLimit);
        }
    }

    public static QueryLimits defaults() {
        return DEFAULTS;
    }

    /** Loads limits from {@value #RESOURCE} on the classpath, then applies system property overrides. */
    public static QueryLimits load() {
        var props = new Properties();
        try (InputStream in = QueryLimits.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.debug("No {} on classpath, using built-in limits", RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load {}: {}", RESOURCE, e.getMessage());
        }
        for (var name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                props.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
            }
        }
        return fromProperties(props);
    }

    public static QueryLimits fromProperties(Properties props) {
        int defaultCallDepth = getInt(props, "defaultCallDepth", DEFAULTS.defaultCallDepth);
        int maxCallDepth = getInt(props, "maxCallDepth", DEFAULTS.maxCallDepth);
        int defaultSearchLimit = getInt(props, "defaultSearchLimit", DEFAULTS.defaultSearchLimit);
        int maxSearchLimit = getInt(props, "maxSearchLimit", DEFAULTS.maxSearchLimit);
        if (defaultCallDepth > maxCallDepth) {
            logger.warn("defaultCallDepth {} exceeds maxCallDepth {}; lowering it", defaultCallDepth, maxCallDepth);
            defaultCallDepth = maxCallDepth;
        }
        if (defaultSearchLimit > maxSearchLimit) {
            logger.warn(
                    "defaultSearchLimit {} exceeds maxSearchLimit {}; lowering it", defaultSearchLimit, maxSearchLimit);
            defaultSearchLimit = maxSearchLimit;
        }
        return new QueryLimits(
                getInt(props, "maxHierarchyDepth", DEFAULTS.maxHierarchyDepth),
                getInt(props, "maxSubtypes", DEFAULTS.maxSubtypes),
                getInt(props, "maxStackDepth", DEFAULTS.maxStackDepth),
                getInt(props, "maxResultsPerLevel", DEFAULTS.maxResultsPerLevel),
                getInt(props, "maxSuperMethods", DEFAULTS.maxSuperMethods),
                defaultCallDepth,
                maxCallDepth,
                getInt(props, "maxImplementations", DEFAULTS.maxImplementations),
                defaultSearchLimit,
                maxSearchLimit,
                getInt(props, "maxUsages", DEFAULTS.maxUsages));
    }

    private static int getInt(Properties props, String key, int fallback) {
        @Nullable String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < 1) {
                logger.warn("Ignoring non-positive value {} for {}", value, key);
                return fallback;
            }
            return value;
        } catch (NumberFormatException e) {
            logger.warn("Ignoring unparseable value '{}' for {}", raw, key);
            return fallback;
        }
    }

    /** Clamps a requested call depth into 1..maxCallDepth; null selects the default. */
    public int clampCallDepth(@Nullable Integer requested) {
        if (requested == null) return defaultCallDepth;
        return Math.max(1, Math.min(requested, maxCallDepth));
    }

    /** Clamps a requested search limit into 1..maxSearchLimit; null selects the default. */
    public int clampSearchLimit(@Nullable Integer requested) {
        if (requested == null) return defaultSearchLimit;
        return Math.max(1, Math.min(requested, maxSearchLimit));
    }
}
