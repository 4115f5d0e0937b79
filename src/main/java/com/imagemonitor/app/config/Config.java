package com.imagemonitor.app.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Caminhos do ImageMonitor: diretório de dados, banco SQLite, settings.json e cache de thumbnails.
 * <p>
 * Cada valor configurável é procurado nesta ordem: propriedade {@code -D}, variável de ambiente, arquivo {@code .env}.
 */
public final class Config {

    private static final Logger logger = LoggerFactory.getLogger(Config.class);

    private static final String APP_FOLDER = "ImageMonitor";
    private static final String DEFAULT_DB_NAME = "imageMonitor.db";
    private static final String SETTINGS_FILE_NAME = "settings.json";
    private static final String THUMBNAIL_FOLDER = "Thumbnails";

    /** Chaves configuráveis: nome da variável de ambiente e propriedade de sistema equivalente. */
    enum Key {
        DB_NAME("IMAGEMONITOR_DB_NAME", "imagemonitor.dbName"),
        DATA_DIR("IMAGEMONITOR_DATA_DIR", "imagemonitor.dataDir"),
        THUMBNAIL_DIR("IMAGEMONITOR_THUMBNAIL_DIR", "imagemonitor.thumbnailDir");

        final String env;
        final String property;

        Key(String env, String property) {
            this.env = env;
            this.property = property;
        }

        static Key ofEnv(String env) {
            for (Key k : values()) {
                if (k.env.equals(env)) return k;
            }
            return null;
        }
    }

    private static final Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();

    // (override usado, diretório resolvido); trocado inteiro para leituras sem lock
    private record Resolved(String override, Path dir) {}

    private static volatile Resolved resolved;

    private Config() {}

    public static String getDbUrl() {
        return "jdbc:sqlite:" + getDbFilePath().toAbsolutePath();
    }

    public static Path getDbFilePath() {
        String name = lookup(Key.DB_NAME);
        return getDataDir().resolve(name != null ? name : DEFAULT_DB_NAME);
    }

    public static Path getSettingsFilePath() {
        return getDataDir().resolve(SETTINGS_FILE_NAME);
    }

    public static Path getThumbnailCacheDir() {
        String explicit = lookup(Key.THUMBNAIL_DIR);
        return explicit != null
                ? Paths.get(explicit).toAbsolutePath().normalize()
                : getDataDir().resolve(THUMBNAIL_FOLDER);
    }

    /**
     * Diretório de dados, criado se preciso. O resultado fica em cache até o override mudar
     * (os testes trocam {@code imagemonitor.dataDir} em tempo de execução).
     */
    public static Path getDataDir() {
        String override = lookup(Key.DATA_DIR);
        Resolved snapshot = resolved;
        if (snapshot != null && sameOverride(snapshot.override(), override)) {
            return snapshot.dir();
        }
        synchronized (Config.class) {
            snapshot = resolved;
            if (snapshot == null || !sameOverride(snapshot.override(), override)) {
                Path dir = override != null ? explicitDataDir(override) : platformDataDir();
                snapshot = new Resolved(override, dir);
                resolved = snapshot;
            }
            return snapshot.dir();
        }
    }

    /** Busca por nome de variável de ambiente; mantido para chamadas que só conhecem o nome. */
    static String getEnvOrDotenv(String envKey) {
        Key key = Key.ofEnv(envKey);
        if (key != null) return lookup(key);
        return firstNonBlank(System.getenv(envKey), dotenv.get(envKey));
    }

    private static String lookup(Key key) {
        return firstNonBlank(System.getProperty(key.property), System.getenv(key.env), dotenv.get(key.env));
    }

    private static String firstNonBlank(String... candidates) {
        for (String c : candidates) {
            if (c != null && !c.isBlank()) return c.trim();
        }
        return null;
    }

    private static boolean sameOverride(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    private static Path explicitDataDir(String raw) {
        Path dir = Paths.get(raw).toAbsolutePath().normalize();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create data directory (" + Key.DATA_DIR.env + "): " + dir, e);
        }
        logger.info("Data directory (override): {}", dir);
        return dir;
    }

    private static Path platformDataDir() {
        Path home = Paths.get(System.getProperty("user.home"));
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);

        Path base;
        if (os.startsWith("windows")) {
            String roaming = firstNonBlank(System.getenv("APPDATA"));
            base = roaming != null ? Paths.get(roaming) : home.resolve("AppData").resolve("Roaming");
        } else if (os.contains("mac") || os.contains("darwin")) {
            base = home.resolve("Library").resolve("Application Support");
        } else {
            String xdg = firstNonBlank(System.getenv("XDG_DATA_HOME"));
            base = xdg != null ? Paths.get(xdg) : home.resolve(".local").resolve("share");
        }
        Path dir = base.resolve(APP_FOLDER);

        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            Path cwd = Paths.get("").toAbsolutePath();
            logger.warn("Cannot use {} ({}); falling back to working directory {}", dir, e.getMessage(), cwd);
            return cwd;
        }
        logger.info("Data directory: {}", dir.toAbsolutePath());
        return dir;
    }
}
