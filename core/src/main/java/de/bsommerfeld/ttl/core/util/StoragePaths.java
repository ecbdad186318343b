package de.bsommerfeld.ttl.core.util;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Default on-disk locations of the corpus store. Nothing here creates
 * directories, callers do that before writing.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/ttl-store}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\ttl-store}</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/ttl-store}, falling back
 * to {@code ~/.local/share/ttl-store}</li>
 * </ul>
 */
public final class StoragePaths {

    public static final String APP_NAME = "ttl-store";

    private StoragePaths() {
    }

    public static Path dataDir() {
        return dataDir(System.getProperty("os.name", "generic"),
                System.getProperty("user.home"),
                System.getenv("APPDATA"),
                System.getenv("XDG_DATA_HOME"));
    }

    /** {@code corpus.db} inside {@link #dataDir()}. */
    public static Path defaultDatabaseFile() {
        return dataDir().resolve("corpus.db");
    }

    /** {@code store.json} inside {@link #dataDir()}. */
    public static Path defaultConfigFile() {
        return dataDir().resolve("store.json");
    }

    static Path dataDir(String osName, String userHome, String appData, String xdgDataHome) {
        String os = osName.toLowerCase(Locale.ENGLISH);
        if (os.contains("mac") || os.contains("darwin"))
            return Path.of(userHome, "Library", "Application Support", APP_NAME);
        if (os.contains("win")) {
            return appData != null
                    ? Path.of(appData, APP_NAME)
                    : Path.of(userHome, "AppData", "Roaming", APP_NAME);
        }
        if (xdgDataHome != null && !xdgDataHome.isEmpty())
            return Path.of(xdgDataHome, APP_NAME);
        return Path.of(userHome, ".local", "share", APP_NAME);
    }
}
