package Server;

import com.gracefulserve.Config;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings for one server session.
 */
public record ServerSettings(
        InetSocketAddress listenAddress,
        Duration readTimeout,
        Duration writeTimeout,
        Duration idleTimeout,
        Duration shutdownTimeout
) {

    public ServerSettings {
        Objects.requireNonNull(listenAddress, "listenAddress");
        requirePositive(readTimeout, "readTimeout");
        requirePositive(writeTimeout, "writeTimeout");
        requirePositive(idleTimeout, "idleTimeout");
        requirePositive(shutdownTimeout, "shutdownTimeout");
    }

    public static ServerSettings fromConfig() {
        return new ServerSettings(
                parseListenAddress(Config.getListenAddr()),
                Duration.ofSeconds(Config.getReadTimeoutSeconds()),
                Duration.ofSeconds(Config.getWriteTimeoutSeconds()),
                Duration.ofSeconds(Config.getIdleTimeoutSeconds()),
                Duration.ofSeconds(Config.getShutdownTimeoutSeconds()));
    }

    public static ServerSettings defaults() {
        return new ServerSettings(
                parseListenAddress(Config.DEFAULT_LISTEN_ADDR),
                Duration.ofSeconds(Config.DEFAULT_READ_TIMEOUT_SECONDS),
                Duration.ofSeconds(Config.DEFAULT_WRITE_TIMEOUT_SECONDS),
                Duration.ofSeconds(Config.DEFAULT_IDLE_TIMEOUT_SECONDS),
                Duration.ofSeconds(Config.DEFAULT_SHUTDOWN_TIMEOUT_SECONDS));
    }

    public ServerSettings withListenAddress(InetSocketAddress address) {
        return new ServerSettings(address, readTimeout, writeTimeout, idleTimeout, shutdownTimeout);
    }

    public ServerSettings withShutdownTimeout(Duration timeout) {
        return new ServerSettings(listenAddress, readTimeout, writeTimeout, idleTimeout, timeout);
    }

    /**
     * Parses {@code host:port} or {@code :port}. An empty host binds all interfaces.
     *
     * @throws IllegalArgumentException if the value has no port or the port is out of range
     */
    public static InetSocketAddress parseListenAddress(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Listen address must not be empty");
        }
        String trimmed = value.trim();
        int idx = trimmed.lastIndexOf(':');
        if (idx < 0) {
            throw new IllegalArgumentException("Listen address must be host:port, got '" + trimmed + "'");
        }
        String host = trimmed.substring(0, idx);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(trimmed.substring(idx + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in listen address '" + trimmed + "'", e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range in listen address '" + trimmed + "'");
        }
        return host.isEmpty() ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
