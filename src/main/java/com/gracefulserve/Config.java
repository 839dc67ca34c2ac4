package com.gracefulserve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

public final class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    private static final Path CONFIG_FILE = Path.of(System.getProperty("user.home"), "GracefulServe", "server.properties");

    static final String LISTEN_ADDR = "LISTEN_ADDR";
    static final String READ_TIMEOUT_SECONDS = "READ_TIMEOUT_SECONDS";
    static final String WRITE_TIMEOUT_SECONDS = "WRITE_TIMEOUT_SECONDS";
    static final String IDLE_TIMEOUT_SECONDS = "IDLE_TIMEOUT_SECONDS";
    static final String SHUTDOWN_TIMEOUT_SECONDS = "SHUTDOWN_TIMEOUT_SECONDS";

    public static final String DEFAULT_LISTEN_ADDR = ":9000";
    public static final int DEFAULT_READ_TIMEOUT_SECONDS = 5;
    public static final int DEFAULT_WRITE_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_IDLE_TIMEOUT_SECONDS = 15;
    public static final int DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 30;

    private static Properties props;

    private Config() {}

    private static synchronized void loadIfNeeded() {
        if (props != null) return;
        props = load(CONFIG_FILE);

        // environment wins over the file
        for (String key : new String[]{LISTEN_ADDR, READ_TIMEOUT_SECONDS, WRITE_TIMEOUT_SECONDS,
                IDLE_TIMEOUT_SECONDS, SHUTDOWN_TIMEOUT_SECONDS}) {
            String env = System.getenv(key);
            if (env != null && !env.isBlank()) {
                props.setProperty(key, env.trim());
            }
        }
    }

    static Properties load(Path file) {
        Properties loaded = new Properties();
        if (file != null && Files.exists(file)) {
            try (InputStream in = Files.newInputStream(file)) {
                loaded.load(in);
            } catch (IOException e) {
                log.warn("Could not load config file {}: {}", file, e.getMessage());
            }
        }
        return loaded;
    }

    static synchronized void reset(Properties replacement) {
        props = replacement;
    }

    public static String getListenAddr() {
        loadIfNeeded();
        String value = props.getProperty(LISTEN_ADDR);
        return value == null || value.isBlank() ? DEFAULT_LISTEN_ADDR : value.trim();
    }

    public static int getReadTimeoutSeconds() {
        return positiveInt(READ_TIMEOUT_SECONDS, DEFAULT_READ_TIMEOUT_SECONDS);
    }

    public static int getWriteTimeoutSeconds() {
        return positiveInt(WRITE_TIMEOUT_SECONDS, DEFAULT_WRITE_TIMEOUT_SECONDS);
    }

    public static int getIdleTimeoutSeconds() {
        return positiveInt(IDLE_TIMEOUT_SECONDS, DEFAULT_IDLE_TIMEOUT_SECONDS);
    }

    public static int getShutdownTimeoutSeconds() {
        return positiveInt(SHUTDOWN_TIMEOUT_SECONDS, DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    /**
     * Logs the effective configuration, one line per setting.
     */
    public static void printStatus() {
        log.info("Listen address:   {}", getListenAddr());
        log.info("Read timeout:     {}s", getReadTimeoutSeconds());
        log.info("Write timeout:    {}s", getWriteTimeoutSeconds());
        log.info("Idle timeout:     {}s", getIdleTimeoutSeconds());
        log.info("Shutdown timeout: {}s", getShutdownTimeoutSeconds());
    }

    private static int positiveInt(String key, int def) {
        loadIfNeeded();
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            int parsed = Integer.parseInt(v.trim());
            if (parsed > 0) {
                return parsed;
            }
            log.warn("Ignoring non-positive {}={}, using {}", key, v, def);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid {}={}, using {}", key, v, def);
        }
        return def;
    }
}
