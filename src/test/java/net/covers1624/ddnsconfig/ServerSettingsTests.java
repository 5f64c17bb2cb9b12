package net.covers1624.ddnsconfig;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Created by covers1624 on 19/10/26.
 */
public class ServerSettingsTests {

    @Test
    public void testDefaults() {
        ServerSettings settings = ServerSettings.fromEnvironment(Map.of());
        assertEquals(Path.of("./config.json").toAbsolutePath().normalize(), settings.configFile());
        assertEquals("0.0.0.0", settings.bindAddress());
        assertEquals(8000, settings.port());
    }

    @Test
    public void testOverrides() {
        ServerSettings settings = ServerSettings.fromEnvironment(Map.of(
                ServerSettings.CONFIG_FILE_ENV, "/data/ddns.json",
                ServerSettings.BIND_ADDRESS_ENV, "127.0.0.1",
                ServerSettings.PORT_ENV, " 9090 "
        ));
        assertEquals(Path.of("/data/ddns.json"), settings.configFile());
        assertEquals("127.0.0.1", settings.bindAddress());
        assertEquals(9090, settings.port());
    }

    @Test
    public void testInvalidPort() {
        assertThrows(IllegalArgumentException.class, () -> ServerSettings.fromEnvironment(Map.of(ServerSettings.PORT_ENV, "http")));
        assertThrows(IllegalArgumentException.class, () -> ServerSettings.fromEnvironment(Map.of(ServerSettings.PORT_ENV, "70000")));
    }
}
