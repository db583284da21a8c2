package io.surfworks.entitlement.client;

import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies the configured log level to every logger under
 * {@code io.surfworks.entitlement}.
 */
public final class LicenseLogging {

    public static final String LOGGER_NAMESPACE = "io.surfworks.entitlement";

    // Strong reference; java.util.logging only keeps weak references to loggers.
    private static final Logger ROOT = Logger.getLogger(LOGGER_NAMESPACE);

    private LicenseLogging() {}

    /**
     * Set the namespace level from a name such as {@code INFO} or {@code DEBUG}.
     * A null or blank name leaves the current level untouched.
     *
     * @return the level that was applied, or null if none
     */
    public static Level configure(String levelName) {
        if (levelName == null || levelName.isBlank()) {
            return null;
        }
        Level level = parseLevel(levelName);
        ROOT.setLevel(level);
        return level;
    }

    /**
     * Map a level name to a {@link Level}. Accepts the java.util.logging names
     * plus {@code ERROR}, {@code WARN}, {@code DEBUG} and {@code TRACE};
     * anything else maps to INFO.
     */
    public static Level parseLevel(String levelName) {
        String name = levelName.trim().toUpperCase(Locale.ROOT);
        return switch (name) {
            case "ERROR", "CRITICAL" -> Level.SEVERE;
            case "WARN" -> Level.WARNING;
            case "DEBUG" -> Level.FINE;
            case "TRACE" -> Level.FINEST;
            default -> standardLevel(name);
        };
    }

    private static Level standardLevel(String name) {
        try {
            return Level.parse(name);
        } catch (IllegalArgumentException e) {
            return Level.INFO;
        }
    }

    static Logger rootLogger() {
        return ROOT;
    }
}
