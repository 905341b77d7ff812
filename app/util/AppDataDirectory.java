package util;

import com.typesafe.config.Config;

import java.io.File;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves where NewsDesk keeps its local files.
 *
 * <p>An explicit {@code bookmarks.dir} setting wins. Otherwise the platform
 * application-data directory is used:</p>
 * <ul>
 *     <li>Windows: {@code %APPDATA%\NewsDesk}</li>
 *     <li>macOS: {@code ~/Library/Application Support/NewsDesk}</li>
 *     <li>others: {@code $XDG_DATA_HOME/newsdesk}, falling back to {@code ~/.local/share/newsdesk}</li>
 * </ul>
 */
public final class AppDataDirectory {

    static final String APP_NAME = "NewsDesk";

    private AppDataDirectory() {}

    public static File resolve(Config config) {
        if (config.hasPath("bookmarks.dir") && !config.getString("bookmarks.dir").isBlank()) {
            return new File(config.getString("bookmarks.dir"));
        }
        return forPlatform(System.getProperty("os.name", ""), System.getProperty("user.home", "."), System.getenv());
    }

    static File forPlatform(String osName, String userHome, Map<String, String> env) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            String appData = env.get("APPDATA");
            File base = (appData == null || appData.isBlank())
                    ? new File(userHome, "AppData" + File.separator + "Roaming")
                    : new File(appData);
            return new File(base, APP_NAME);
        }
        if (os.contains("mac")) {
            return new File(userHome, "Library" + File.separator + "Application Support" + File.separator + APP_NAME);
        }
        String xdg = env.get("XDG_DATA_HOME");
        File base = (xdg == null || xdg.isBlank())
                ? new File(userHome, ".local" + File.separator + "share")
                : new File(xdg);
        return new File(base, APP_NAME.toLowerCase(Locale.ROOT));
    }
}
