package net.covers1624.ddnsconfig;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Map;

/**
 * Process level settings, resolved once from the environment at startup.
 * <p>
 * Created by covers1624 on 19/10/26.
 */
public record ServerSettings(
        // The json file holding the managed config.
        Path configFile,
        String bindAddress,
        int port
) {

    public static final String CONFIG_FILE_ENV = "DDNS_CONFIG_FILE";
    public static final String BIND_ADDRESS_ENV = "DDNS_BIND_ADDRESS";
    public static final String PORT_ENV = "DDNS_PORT";

    public static ServerSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static ServerSettings fromEnvironment(Map<String, String> env) {
        return new ServerSettings(
                Path.of(orDefault(env.get(CONFIG_FILE_ENV), "./config.json")).toAbsolutePath().normalize(),
                orDefault(env.get(BIND_ADDRESS_ENV), "0.0.0.0"),
                parsePort(orDefault(env.get(PORT_ENV), "8000"))
        );
    }

    private static int parsePort(String str) {
        int port;
        try {
            port = Integer.parseInt(str.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(PORT_ENV + " must be a number. Got: " + str, ex);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(PORT_ENV + " must be between 0 and 65535. Got: " + port);
        }
        return port;
    }

    private static String orDefault(@Nullable String value, String _default) {
        return value == null || value.isBlank() ? _default : value;
    }
}
