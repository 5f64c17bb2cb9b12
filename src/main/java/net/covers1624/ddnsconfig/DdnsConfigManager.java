package net.covers1624.ddnsconfig;

import net.covers1624.ddnsconfig.config.ConfigFile;
import net.covers1624.ddnsconfig.config.ConfigStore;
import net.covers1624.ddnsconfig.http.ApiServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.InetSocketAddress;

/**
 * Serves the management api for the accounts, zones and subdomains
 * kept up to date by the DNS agent.
 * <p>
 * Created by covers1624 on 1/11/23.
 */
public class DdnsConfigManager {

    private static final Logger LOGGER = LogManager.getLogger();

    public static void main(String[] args) {
        int exit = new DdnsConfigManager().mainI();
        if (exit != 0) {
            System.exit(exit);
        }
    }

    private int mainI() {
        ServerSettings settings;
        try {
            settings = ServerSettings.fromEnvironment();
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Invalid settings. {}", ex.getMessage());
            return 1;
        }
        LOGGER.info("Using config file {}", settings.configFile());

        ConfigStore store;
        try {
            store = ConfigStore.load(new ConfigFile(settings.configFile()));
        } catch (Throwable ex) {
            LOGGER.error("Failed to load config.", ex);
            return 1;
        }

        ApiServer server;
        try {
            server = new ApiServer(new InetSocketAddress(settings.bindAddress(), settings.port()), store);
        } catch (Throwable ex) {
            LOGGER.error("Failed to bind {}:{}", settings.bindAddress(), settings.port(), ex);
            return 1;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "Shutdown"));
        server.start();
        return 0;
    }
}
