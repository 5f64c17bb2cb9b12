package net.covers1624.ddnsconfig.http;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.sun.net.httpserver.HttpServer;
import net.covers1624.ddnsconfig.config.ConfigStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Embedded http server exposing the management api.
 * <p>
 * Created by covers1624 on 19/10/26.
 */
public class ApiServer {

    private static final Logger LOGGER = LogManager.getLogger();

    private final HttpServer server;
    private final ExecutorService executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder().setDaemon(true).setNameFormat("HTTP Worker %d").build());

    public ApiServer(InetSocketAddress address, ConfigStore store) throws IOException {
        server = HttpServer.create(address, 0);
        server.createContext("/", new ApiHandler(store));
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        LOGGER.info("Listening on {}", server.getAddress());
    }

    public void stop() {
        LOGGER.info("Stopping http server.");
        server.stop(1);
        executor.shutdown();
    }

    /**
     * @return The port actually bound, useful when started on port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }
}
