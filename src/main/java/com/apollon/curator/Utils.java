package com.apollon.curator;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Utility class for configuration lookup and file naming helpers.
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
public final class Utils {
    private Utils() {}

    static final String APP_DIR_NAME = "CuratorApollon";

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\\\\\s]", "_");
    }

    /**
     * Reads a setting from the environment, falling back to a JVM system property and then to a default.
     * @param key variable / property name
     * @param defaultVal value used when neither is set
     * @return resolved value
     */
    public static String envOrProp(String key, String defaultVal) {
        try {
            String ev = System.getenv(key);
            if (ev != null) return ev;
        } catch (SecurityException ignored) {
            // fall through to system properties
        }
        String prop = System.getProperty(key);
        return prop != null ? prop : defaultVal;
    }

    /**
     * Per-user application data directory: {@code %APPDATA%\CuratorApollon} on Windows, otherwise
     * {@code $XDG_DATA_HOME/CuratorApollon} or {@code ~/.local/share/CuratorApollon}. Not created here.
     */
    public static Path appDataDir() {
        String os = System.getProperty("os.name", "").toLowerCase();
        if (os.contains("win")) {
            return Paths.get(envOrProp("APPDATA", System.getProperty("user.home")), APP_DIR_NAME);
        }
        String xdg = envOrProp("XDG_DATA_HOME", "");
        Path base = xdg.isBlank() ? Paths.get(System.getProperty("user.home"), ".local", "share") : Paths.get(xdg);
        return base.resolve(APP_DIR_NAME);
    }

    /**
     * Library file location, overridable through {@code CURATOR_LIBRARY_PATH}.
     */
    public static Path libraryPath() {
        String override = envOrProp("CURATOR_LIBRARY_PATH", "");
        return override.isBlank() ? appDataDir().resolve("library.json") : Paths.get(override);
    }
}
