package net.covers1624.ddnsconfig.http;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import net.covers1624.ddnsconfig.config.Config;
import net.covers1624.ddnsconfig.config.ConfigFile;
import net.covers1624.ddnsconfig.config.ConfigStore;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Created by covers1624 on 19/10/26.
 */
public class ApiServerTests {

    private static final String ZONE_A = "0123456789abcdef0123456789abcdef";

    @TempDir
    public Path tempDir;

    private final HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    private ConfigFile file;
    private ApiServer server;

    @BeforeEach
    public void setup() throws IOException {
        file = new ConfigFile(tempDir.resolve("config.json"));
        server = new ApiServer(new InetSocketAddress("127.0.0.1", 0), ConfigStore.load(file));
        server.start();
    }

    @AfterEach
    public void teardown() {
        server.stop();
    }

    @Test
    public void testCreateAccountAndDuplicateToken() throws Exception {
        Reply created = send("POST", "/accounts", "{\"authentication\":{\"api_token\":\"tok1\"},\"zones\":[]}");
        assertEquals(200, created.status);
        assertFalse(created.body.get("error").getAsBoolean());
        assertEquals("Account added successfully", created.body.get("message").getAsString());
        JsonObject account = created.data().getAsJsonObject("account");
        assertFalse(account.get("id").getAsString().isEmpty());
        assertEquals(0, account.getAsJsonArray("zones").size());

        Config persisted = file.load();
        assertEquals(1, persisted.cloudflare().size());
        assertEquals(account.get("id").getAsString(), persisted.cloudflare().get(0).id());

        Reply duplicate = send("POST", "/accounts", "{\"authentication\":{\"api_token\":\"tok1\"},\"zones\":[]}");
        assertEquals(400, duplicate.status);
        assertTrue(duplicate.body.get("error").getAsBoolean());
        assertTrue(duplicate.body.get("message").getAsString().contains("already exists"));
        assertEquals("API Token already exists", duplicate.data().get("detail").getAsString());
        assertEquals(1, file.load().cloudflare().size());
    }

    @Test
    public void testAccountLifecycle() throws Exception {
        String id = send("POST", "/accounts", "{\"authentication\":{\"api_token\":\"tok1\"}}")
                .data().getAsJsonObject("account").get("id").getAsString();

        Reply list = send("GET", "/accounts", null);
        assertEquals(200, list.status);
        assertEquals(1, list.data().getAsJsonArray("accounts").size());

        Reply get = send("GET", "/accounts/" + id, null);
        assertEquals(200, get.status);
        assertEquals("tok1", get.data().getAsJsonObject("account").getAsJsonObject("authentication").get("api_token").getAsString());

        Reply update = send("PUT", "/accounts/" + id, "{\"id\":\"other\",\"authentication\":{\"api_token\":\"tok2\"},\"zones\":[]}");
        assertEquals(200, update.status);
        assertEquals(id, update.data().getAsJsonObject("account").get("id").getAsString());

        Reply auth = send("PUT", "/accounts/" + id + "/auth", "{\"api_key\":{\"api_key\":\"key\",\"account_email\":\"me@example.com\"}}");
        assertEquals(200, auth.status);
        assertTrue(auth.data().getAsJsonObject("auth").get("api_token").isJsonNull());
        assertEquals("me@example.com", auth.data().getAsJsonObject("auth").getAsJsonObject("api_key").get("account_email").getAsString());

        Reply delete = send("DELETE", "/accounts/" + id, null);
        assertEquals(200, delete.status);
        assertTrue(delete.body.get("data").isJsonNull());
        assertEquals("Account deleted successfully", delete.body.get("message").getAsString());

        assertEquals(404, send("DELETE", "/accounts/" + id, null).status);
        assertEquals(404, send("GET", "/accounts/" + id, null).status);
    }

    @Test
    public void testZoneLifecycle() throws Exception {
        String accountId = send("POST", "/accounts", "{\"authentication\":{\"api_token\":\"tok1\"}}")
                .data().getAsJsonObject("account").get("id").getAsString();
        String zones = "/accounts/" + accountId + "/zones";

        Reply created = send("POST", zones, "{\"zone_id\":\"" + ZONE_A + "\",\"domain\":\"example.com\",\"subdomains\":[{\"name\":\"www\",\"proxied\":true,\"ttl\":120}]}");
        assertEquals(200, created.status);
        JsonObject zone = created.data().getAsJsonObject("zone");
        String zoneId = zone.get("id").getAsString();
        assertEquals(ZONE_A, zone.get("zone_id").getAsString());
        assertFalse(zone.getAsJsonArray("subdomains").get(0).getAsJsonObject().get("id").getAsString().isEmpty());

        Reply duplicate = send("POST", zones, "{\"zone_id\":\"" + ZONE_A + "\",\"domain\":\"example.com\"}");
        assertEquals(400, duplicate.status);

        Reply dupSub = send("POST", zones, "{\"zone_id\":\"fedcba9876543210fedcba9876543210\",\"domain\":\"example.org\",\"subdomains\":[{\"name\":\"a\"},{\"name\":\"a\"}]}");
        assertEquals(400, dupSub.status);
        assertEquals(1, send("GET", zones, null).data().getAsJsonArray("zones").size());

        Reply get = send("GET", zones + "/" + zoneId, null);
        assertEquals(200, get.status);
        assertEquals("example.com", get.data().getAsJsonObject("zone").get("domain").getAsString());

        Reply update = send("PUT", zones + "/" + zoneId, "{\"zone_id\":\"" + ZONE_A + "\",\"domain\":\"example.net\",\"subdomains\":[]}");
        assertEquals(200, update.status);
        assertEquals(zoneId, update.data().getAsJsonObject("zone").get("id").getAsString());

        assertEquals(200, send("DELETE", zones + "/" + zoneId, null).status);
        assertEquals(404, send("GET", zones + "/" + zoneId, null).status);

        Reply missingAccount = send("GET", "/accounts/nope/zones/" + zoneId, null);
        assertEquals(404, missingAccount.status);
        assertEquals("Account nope not found", missingAccount.data().get("detail").getAsString());
    }

    @Test
    public void testValidationErrors() throws Exception {
        Reply extra = send("POST", "/accounts", "{\"authentication\":{},\"unexpected\":1}");
        assertEquals(422, extra.status);
        assertEquals("Field 'unexpected': Extra inputs are not permitted", extra.body.get("message").getAsString());

        Reply malformed = send("POST", "/accounts", "{");
        assertEquals(422, malformed.status);

        Reply empty = send("POST", "/accounts", null);
        assertEquals(422, empty.status);

        String accountId = send("POST", "/accounts", "{\"authentication\":{\"api_token\":\"tok1\"}}")
                .data().getAsJsonObject("account").get("id").getAsString();
        Reply ttl = send("POST", "/accounts/" + accountId + "/zones", "{\"zone_id\":\"" + ZONE_A + "\",\"domain\":\"example.com\",\"subdomains\":[{\"name\":\"www\",\"ttl\":59}]}");
        assertEquals(422, ttl.status);
        assertEquals("TTL must be between 60 and 86400 seconds", ttl.data().get("detail").getAsString());

        Reply badZoneId = send("POST", "/accounts/" + accountId + "/zones", "{\"zone_id\":\"ABC\",\"domain\":\"example.com\"}");
        assertEquals(422, badZoneId.status);
    }

    @Test
    public void testMissingTargetReportedBeforeBadPayload() throws Exception {
        Reply account = send("PUT", "/accounts/nope", "{");
        assertEquals(404, account.status);
        assertEquals("Account nope not found", account.data().get("detail").getAsString());

        assertEquals(404, send("PUT", "/accounts/nope/auth", "{\"unexpected\":1}").status);
        assertEquals(404, send("PUT", "/accounts/nope/zones/z", "{").status);

        String accountId = send("POST", "/accounts", "{\"authentication\":{\"api_token\":\"tok1\"}}")
                .data().getAsJsonObject("account").get("id").getAsString();
        Reply zone = send("PUT", "/accounts/" + accountId + "/zones/z", "{");
        assertEquals(404, zone.status);
        assertEquals("Zone z not found", zone.data().get("detail").getAsString());

        // With the target present the payload is validated as usual.
        assertEquals(422, send("PUT", "/accounts/" + accountId, "{").status);
    }

    @Test
    public void testUnknownRoutes() throws Exception {
        assertEquals(404, send("GET", "/nothing", null).status);
        assertEquals(405, send("PATCH", "/accounts", "{}").status);
        assertEquals(405, send("POST", "/accounts/abc", "{}").status);
    }

    private Reply send(String method, String path, @Nullable String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                .method(method, body != null ? HttpRequest.BodyPublishers.ofString(body) : HttpRequest.BodyPublishers.noBody())
                .header("Content-Type", "application/json")
                .build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        return new Reply(response.statusCode(), JsonParser.parseString(response.body()).getAsJsonObject());
    }

    private record Reply(int status, JsonObject body) {

        JsonObject data() {
            return body.getAsJsonObject("data");
        }
    }
}
