package net.covers1624.ddnsconfig.http;

import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import net.covers1624.ddnsconfig.config.ConfigDecoder;
import net.covers1624.ddnsconfig.config.ConfigException;
import net.covers1624.ddnsconfig.config.ConfigStore;
import net.covers1624.ddnsconfig.config.Zone;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps the account and zone routes onto {@link ConfigStore} operations.
 * <p>
 * Created by covers1624 on 19/10/26.
 */
public class ApiHandler implements HttpHandler {

    private static final Logger LOGGER = LogManager.getLogger();

    private static final Gson GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private static final Pattern ACCOUNTS = Pattern.compile("^/accounts/?$");
    private static final Pattern ACCOUNT = Pattern.compile("^/accounts/(?<account>[^/]+)/?$");
    private static final Pattern ACCOUNT_AUTH = Pattern.compile("^/accounts/(?<account>[^/]+)/auth/?$");
    private static final Pattern ZONES = Pattern.compile("^/accounts/(?<account>[^/]+)/zones/?$");
    private static final Pattern ZONE = Pattern.compile("^/accounts/(?<account>[^/]+)/zones/(?<zone>[^/]+)/?$");

    private final List<Route> routes;

    // Routes taking a body look up their target first, so a missing record wins over a bad payload.
    public ApiHandler(ConfigStore store) {
        routes = List.of(
                new Route("GET", ACCOUNTS, (m, body) -> ApiResponse.success(
                        ImmutableMap.of("accounts", store.listAccounts()),
                        "Accounts retrieved successfully"
                )),
                new Route("POST", ACCOUNTS, (m, body) -> ApiResponse.success(
                        ImmutableMap.of("account", store.createAccount(ConfigDecoder.decodeAccount(ConfigDecoder.parse(body)))),
                        "Account added successfully"
                )),
                new Route("GET", ACCOUNT, (m, body) -> ApiResponse.success(
                        ImmutableMap.of("account", store.getAccount(m.group("account"))),
                        "Account retrieved successfully"
                )),
                new Route("PUT", ACCOUNT, (m, body) -> {
                    String accountId = m.group("account");
                    store.getAccount(accountId);
                    return ApiResponse.success(
                            ImmutableMap.of("account", store.updateAccount(accountId, ConfigDecoder.decodeAccount(ConfigDecoder.parse(body)))),
                            "Account updated successfully"
                    );
                }),
                new Route("DELETE", ACCOUNT, (m, body) -> {
                    store.deleteAccount(m.group("account"));
                    return ApiResponse.success(null, "Account deleted successfully");
                }),
                new Route("PUT", ACCOUNT_AUTH, (m, body) -> {
                    String accountId = m.group("account");
                    store.getAccount(accountId);
                    return ApiResponse.success(
                            ImmutableMap.of("auth", store.updateAuthentication(accountId, ConfigDecoder.decodeAuthentication(ConfigDecoder.parse(body)))),
                            "Authentication updated successfully"
                    );
                }),
                new Route("GET", ZONES, (m, body) -> ApiResponse.success(
                        ImmutableMap.of("zones", store.listZones(m.group("account"))),
                        "Zones retrieved successfully"
                )),
                new Route("POST", ZONES, (m, body) -> {
                    String accountId = m.group("account");
                    store.getAccount(accountId);
                    Zone zone = store.createZone(accountId, ConfigDecoder.decodeZoneCreate(ConfigDecoder.parse(body)));
                    return ApiResponse.success(ImmutableMap.of("zone", zone), "Zone created successfully");
                }),
                new Route("GET", ZONE, (m, body) -> ApiResponse.success(
                        ImmutableMap.of("zone", store.getZone(m.group("account"), m.group("zone"))),
                        "Zone retrieved successfully"
                )),
                new Route("PUT", ZONE, (m, body) -> {
                    String accountId = m.group("account");
                    String zoneId = m.group("zone");
                    store.getZone(accountId, zoneId);
                    return ApiResponse.success(
                            ImmutableMap.of("zone", store.updateZone(accountId, zoneId, ConfigDecoder.decodeZone(ConfigDecoder.parse(body)))),
                            "Zone updated successfully"
                    );
                }),
                new Route("DELETE", ZONE, (m, body) -> {
                    store.deleteZone(m.group("account"), m.group("zone"));
                    return ApiResponse.success(null, "Zone deleted successfully");
                })
        );
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            String method = exchange.getRequestMethod();
            String path = exchange.getRequestURI().getPath();

            int status;
            ApiResponse response;
            try {
                status = 200;
                response = dispatch(method, path, exchange);
            } catch (ConfigException ex) {
                status = ex.getKind().status;
                if (ex.getKind() == ConfigException.Kind.INTERNAL) {
                    LOGGER.error("{} {} failed.", method, path, ex);
                    response = ApiResponse.failure("Internal Server Error", ex.getMessage());
                } else {
                    LOGGER.warn("{} {} rejected: {}", method, path, ex.getMessage());
                    response = ApiResponse.failure(ex.getMessage(), ex.getMessage());
                }
            } catch (RouteException ex) {
                status = ex.status;
                LOGGER.warn("{} {} rejected: {}", method, path, ex.getMessage());
                response = ApiResponse.failure(ex.getMessage(), ex.getMessage());
            } catch (Throwable ex) {
                status = 500;
                LOGGER.error("{} {} failed unexpectedly.", method, path, ex);
                response = ApiResponse.failure("Internal Server Error", String.valueOf(ex));
            }
            send(exchange, status, response);
        } finally {
            exchange.close();
        }
    }

    private ApiResponse dispatch(String method, String path, HttpExchange exchange) throws IOException {
        boolean pathMatched = false;
        for (Route route : routes) {
            Matcher matcher = route.pattern.matcher(path);
            if (!matcher.matches()) continue;

            pathMatched = true;
            if (!route.method.equals(method)) continue;

            return route.action.handle(matcher, readBody(exchange));
        }
        if (pathMatched) {
            throw new RouteException(405, "Method Not Allowed");
        }
        throw new RouteException(404, "Not Found");
    }

    private static @Nullable String readBody(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            byte[] bytes = is.readAllBytes();
            return bytes.length == 0 ? null : new String(bytes, StandardCharsets.UTF_8);
        }
    }

    private static void send(HttpExchange exchange, int status, ApiResponse response) throws IOException {
        byte[] bytes = GSON.toJson(response).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private record Route(String method, Pattern pattern, Action action) { }

    private interface Action {

        ApiResponse handle(Matcher matcher, @Nullable String body) throws IOException;
    }

    private static class RouteException extends RuntimeException {

        private final int status;

        RouteException(int status, String message) {
            super(message);
            this.status = status;
        }
    }
}
