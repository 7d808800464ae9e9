package com.netra.health.config;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Connection settings for one dependency, read from a {@link ConfigurationSource}.
 * <p>
 * Values are parsed eagerly so malformed configuration fails at construction time rather
 * than surfacing later as a dependency failure.
 *
 * @param prefix   key prefix (e.g., "REDIS")
 * @param host     host name, or null
 * @param port     port number, or null to use the dependency's default
 * @param user     user name, or null
 * @param password password, or null
 * @param url      full connection URL; takes precedence over host and port
 * @param required whether the dependency is critical for this deployment
 * @param secure   whether to connect over TLS
 * @param mode     operating mode (e.g., "disabled", "mock"), or null
 */
public record DependencySettings(
        String prefix,
        String host,
        Integer port,
        String user,
        String password,
        String url,
        boolean required,
        boolean secure,
        String mode
) {

    /** Modes that mark a dependency as switched off. */
    private static final Set<String> DISABLED_MODES = Set.of("disabled", "mock");

    public DependencySettings {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be null or blank");
        }
        if (port != null && (port < 1 || port > 65535)) {
            throw new IllegalArgumentException(prefix + "_PORT out of range: " + port);
        }
        host = blankToNull(host);
        user = blankToNull(user);
        password = blankToNull(password);
        url = blankToNull(url);
        mode = mode == null || mode.isBlank() ? null : mode.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Reads the settings for {@code prefix} from the source.
     *
     * @throws IllegalArgumentException if a port or flag value cannot be parsed
     */
    public static DependencySettings from(ConfigurationSource source, String prefix) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        return new DependencySettings(
                prefix,
                source.get(prefix + "_HOST").orElse(null),
                parsePort(prefix, source.get(prefix + "_PORT")),
                source.get(prefix + "_USER").orElse(null),
                source.get(prefix + "_PASSWORD").orElse(null),
                source.get(prefix + "_URL").orElse(null),
                parseFlag(prefix + "_REQUIRED", source.get(prefix + "_REQUIRED")),
                parseFlag(prefix + "_SECURE", source.get(prefix + "_SECURE")),
                source.get(prefix + "_MODE").orElse(null));
    }

    /** Creates settings with nothing configured. */
    public static DependencySettings unconfigured(String prefix) {
        return new DependencySettings(prefix, null, null, null, null, null, false, false, null);
    }

    /**
     * Returns true when a host or URL is set and the mode does not switch the dependency off.
     */
    public boolean isConfigured() {
        return (host != null || url != null) && !isDisabled();
    }

    /** Returns true when the mode is {@code disabled} or {@code mock}. */
    public boolean isDisabled() {
        return mode != null && DISABLED_MODES.contains(mode);
    }

    /** Returns a copy with the required flag replaced. */
    public DependencySettings withRequired(boolean newRequired) {
        return new DependencySettings(prefix, host, port, user, password, url, newRequired, secure, mode);
    }

    @Override
    public String toString() {
        return "DependencySettings[prefix=" + prefix + ", host=" + host + ", port=" + port
                + ", user=" + user + ", password=" + (password == null ? null : "[REDACTED]")
                + ", url=" + (url == null ? null : "[REDACTED]")
                + ", required=" + required + ", secure=" + secure + ", mode=" + mode + "]";
    }

    private static Integer parsePort(String prefix, Optional<String> raw) {
        if (raw.isEmpty() || raw.get().isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.get().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + prefix + "_PORT: " + raw.get(), e);
        }
    }

    private static boolean parseFlag(String key, Optional<String> raw) {
        if (raw.isEmpty() || raw.get().isBlank()) {
            return false;
        }
        String value = raw.get().trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new IllegalArgumentException("Invalid " + key + ": " + raw.get());
        };
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
