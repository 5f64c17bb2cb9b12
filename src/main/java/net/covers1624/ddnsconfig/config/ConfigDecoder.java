package net.covers1624.ddnsconfig.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Strict decoding of untrusted JSON into configuration entities.
 * <p>
 * Unknown keys, missing required keys and values of the wrong type are rejected
 * with a {@link ConfigException.Kind#VALIDATION} error naming the offending field.
 * Record ids are optional in every payload, a decoded entity without one has a {@code null} id
 * which {@link ConfigStore} fills in.
 * <p>
 * Created by covers1624 on 19/10/26.
 */
public class ConfigDecoder {

    private static final Set<String> CONFIG_KEYS = ImmutableSet.of("cloudflare", "a", "aaaa", "purgeUnknownRecords", "ttl");
    private static final Set<String> ACCOUNT_KEYS = ImmutableSet.of("id", "authentication", "zones");
    private static final Set<String> AUTH_KEYS = ImmutableSet.of("api_token", "api_key");
    private static final Set<String> API_KEY_KEYS = ImmutableSet.of("api_key", "account_email");
    private static final Set<String> ZONE_KEYS = ImmutableSet.of("id", "zone_id", "domain", "subdomains");
    private static final Set<String> ZONE_CREATE_KEYS = ImmutableSet.of("zone_id", "domain", "subdomains");
    private static final Set<String> SUBDOMAIN_KEYS = ImmutableSet.of("id", "name", "proxied", "ttl");
    private static final Set<String> SUBDOMAIN_CREATE_KEYS = ImmutableSet.of("name", "proxied", "ttl");

    /**
     * Parses a request body or file into a json tree.
     *
     * @param body The raw text.
     * @return The parsed tree.
     * @throws ConfigException If the body is empty or not valid json.
     */
    public static JsonElement parse(@Nullable String body) {
        if (body == null || body.isBlank()) {
            throw ConfigException.validation(fieldError("", "Field required"));
        }
        try {
            return JsonParser.parseString(body);
        } catch (JsonParseException ex) {
            throw ConfigException.validation(fieldError("", "Invalid JSON: " + ex.getMessage()));
        }
    }

    public static Config decodeConfig(JsonElement json) {
        StrictObject obj = new StrictObject(json, "", CONFIG_KEYS);
        return new Config(
                obj.list("cloudflare", ConfigDecoder::readAccount),
                obj.bool("a", Config.DEFAULT_A),
                obj.bool("aaaa", Config.DEFAULT_AAAA),
                obj.bool("purgeUnknownRecords", Config.DEFAULT_PURGE_UNKNOWN_RECORDS),
                obj.integer("ttl", Config.DEFAULT_TTL)
        );
    }

    public static CloudflareAccount decodeAccount(JsonElement json) {
        return readAccount(json, "");
    }

    public static Authentication decodeAuthentication(JsonElement json) {
        return readAuthentication(json, "");
    }

    public static Zone decodeZone(JsonElement json) {
        return readZone(json, "");
    }

    /**
     * Decodes the payload used to create a zone, ids are not accepted anywhere within it.
     */
    public static Zone decodeZoneCreate(JsonElement json) {
        StrictObject obj = new StrictObject(json, "", ZONE_CREATE_KEYS);
        return new Zone(
                null,
                obj.string("zone_id"),
                obj.string("domain"),
                obj.list("subdomains", (e, path) -> readSubDomain(e, path, SUBDOMAIN_CREATE_KEYS))
        );
    }

    private static CloudflareAccount readAccount(JsonElement json, String path) {
        StrictObject obj = new StrictObject(json, path, ACCOUNT_KEYS);
        return new CloudflareAccount(
                obj.nullableString("id"),
                readAuthentication(obj.required("authentication"), obj.child("authentication")),
                obj.list("zones", ConfigDecoder::readZone)
        );
    }

    private static Authentication readAuthentication(JsonElement json, String path) {
        StrictObject obj = new StrictObject(json, path, AUTH_KEYS);
        JsonElement apiKey = obj.get("api_key");
        return new Authentication(
                obj.nullableString("api_token"),
                apiKey != null ? readApiKey(apiKey, obj.child("api_key")) : null
        );
    }

    private static Authentication.ApiKey readApiKey(JsonElement json, String path) {
        StrictObject obj = new StrictObject(json, path, API_KEY_KEYS);
        return new Authentication.ApiKey(
                obj.string("api_key"),
                obj.string("account_email")
        );
    }

    private static Zone readZone(JsonElement json, String path) {
        StrictObject obj = new StrictObject(json, path, ZONE_KEYS);
        return new Zone(
                obj.nullableString("id"),
                obj.string("zone_id"),
                obj.string("domain"),
                obj.list("subdomains", (e, p) -> readSubDomain(e, p, SUBDOMAIN_KEYS))
        );
    }

    private static SubDomain readSubDomain(JsonElement json, String path, Set<String> keys) {
        StrictObject obj = new StrictObject(json, path, keys);
        return new SubDomain(
                keys.contains("id") ? obj.nullableString("id") : null,
                obj.string("name"),
                obj.bool("proxied", false),
                // Omitted TTLs take the config wide default, the range check still applies to explicit values.
                obj.integer("ttl", Config.DEFAULT_TTL)
        );
    }

    static String fieldError(String path, String message) {
        return "Field '" + (path.isEmpty() ? "body" : path) + "': " + message;
    }

    private static final class StrictObject {

        private final JsonObject json;
        private final String path;

        StrictObject(JsonElement element, String path, Set<String> allowed) {
            this.path = path;
            if (!element.isJsonObject()) {
                throw ConfigException.validation(fieldError(path, "Input should be a valid dictionary"));
            }
            json = element.getAsJsonObject();
            for (String key : json.keySet()) {
                if (!allowed.contains(key)) {
                    throw ConfigException.validation(fieldError(child(key), "Extra inputs are not permitted"));
                }
            }
        }

        String child(String key) {
            return path.isEmpty() ? key : path + " -> " + key;
        }

        // Absent and explicit null are treated the same.
        @Nullable JsonElement get(String key) {
            JsonElement element = json.get(key);
            return element == null || element.isJsonNull() ? null : element;
        }

        JsonElement required(String key) {
            JsonElement element = get(key);
            if (element == null) {
                throw ConfigException.validation(fieldError(child(key), json.has(key) ? "Input should not be null" : "Field required"));
            }
            return element;
        }

        String string(String key) {
            return asString(required(key), child(key));
        }

        @Nullable String nullableString(String key) {
            JsonElement element = get(key);
            return element != null ? asString(element, child(key)) : null;
        }

        boolean bool(String key, boolean _default) {
            if (!json.has(key)) return _default;
            JsonElement element = json.get(key);
            if (!isPrimitive(element) || !element.getAsJsonPrimitive().isBoolean()) {
                throw ConfigException.validation(fieldError(child(key), "Input should be a valid boolean"));
            }
            return element.getAsBoolean();
        }

        int integer(String key, int _default) {
            if (!json.has(key)) return _default;
            JsonElement element = json.get(key);
            if (!isPrimitive(element) || !element.getAsJsonPrimitive().isNumber()) {
                throw ConfigException.validation(fieldError(child(key), "Input should be a valid integer"));
            }
            try {
                BigDecimal value = element.getAsBigDecimal();
                return value.intValueExact();
            } catch (NumberFormatException | ArithmeticException ex) {
                throw ConfigException.validation(fieldError(child(key), "Input should be a valid integer"));
            }
        }

        <T> List<T> list(String key, BiFunction<JsonElement, String, T> decoder) {
            if (!json.has(key)) return ImmutableList.of();
            JsonElement element = json.get(key);
            if (!element.isJsonArray()) {
                throw ConfigException.validation(fieldError(child(key), "Input should be a valid list"));
            }
            JsonArray array = element.getAsJsonArray();
            ImmutableList.Builder<T> builder = ImmutableList.builder();
            for (int i = 0; i < array.size(); i++) {
                builder.add(decoder.apply(array.get(i), child(key) + " -> " + i));
            }
            return builder.build();
        }

        private static String asString(JsonElement element, String path) {
            if (!isPrimitive(element) || !element.getAsJsonPrimitive().isString()) {
                throw ConfigException.validation(fieldError(path, "Input should be a valid string"));
            }
            return element.getAsString();
        }

        private static boolean isPrimitive(JsonElement element) {
            return element instanceof JsonPrimitive;
        }
    }
}
