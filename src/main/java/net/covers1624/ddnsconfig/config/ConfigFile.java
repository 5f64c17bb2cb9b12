package net.covers1624.ddnsconfig.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Reads and writes the {@link Config} tree as human editable json.
 * <p>
 * Created by covers1624 on 1/11/23.
 */
public class ConfigFile {

    private static final Logger LOGGER = LogManager.getLogger();

    public static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private final Path path;

    public ConfigFile(Path path) {
        this.path = path.toAbsolutePath().normalize();
    }

    public Path getPath() {
        return path;
    }

    /**
     * Load the config from disk.
     * <p>
     * Records written by older versions may be missing their ids, these are generated
     * before the tree is decoded and validated.
     *
     * @return The loaded config, or the defaults if the file does not exist.
     * @throws IOException     If the file could not be read.
     * @throws ConfigException If the file is not a valid config.
     */
    public Config load() throws IOException {
        if (!Files.exists(path)) {
            LOGGER.info("Config file {} does not exist, using defaults.", path);
            return Config.defaults();
        }

        JsonElement json = ConfigDecoder.parse(Files.readString(path, StandardCharsets.UTF_8));
        int backfilled = backfillIds(json);
        if (backfilled > 0) {
            LOGGER.info("Generated {} missing record ids.", backfilled);
        }

        Config config = ConfigDecoder.decodeConfig(json);
        ConfigValidator.validateConfig(config).throwIfInvalid();
        LOGGER.info("Loaded {} accounts from {}", config.cloudflare().size(), path);
        return config;
    }

    /**
     * Write the config to disk, replacing the existing file.
     * <p>
     * The tree is written to a sibling temp file first and moved into place,
     * so a failed write never leaves a truncated config behind. The temp file is
     * synced before the move and removed if anything fails.
     *
     * @param config The config to write.
     * @throws IOException If the file could not be written.
     */
    public void save(Config config) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        ByteBuffer bytes = ByteBuffer.wrap((GSON.toJson(config) + "\n").getBytes(StandardCharsets.UTF_8));
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                while (bytes.hasRemaining()) {
                    channel.write(bytes);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException ex2) {
                ex.addSuppressed(ex2);
            }
            throw ex;
        }
    }

    // Walks the raw tree, adding ids to any account, zone or subdomain without one.
    static int backfillIds(JsonElement json) {
        int count = 0;
        for (JsonObject account : objects(json, "cloudflare")) {
            count += backfill(account);
            for (JsonObject zone : objects(account, "zones")) {
                count += backfill(zone);
                for (JsonObject subDomain : objects(zone, "subdomains")) {
                    count += backfill(subDomain);
                }
            }
        }
        return count;
    }

    private static int backfill(JsonObject obj) {
        JsonElement id = obj.get("id");
        if (id != null && !id.isJsonNull()) return 0;

        obj.addProperty("id", UUID.randomUUID().toString());
        return 1;
    }

    // Anything malformed is skipped here and reported by the decoder.
    private static Iterable<JsonObject> objects(JsonElement parent, String key) {
        if (!parent.isJsonObject()) return List.of();
        JsonElement element = parent.getAsJsonObject().get(key);
        if (element == null || !element.isJsonArray()) return List.of();

        JsonArray array = element.getAsJsonArray();
        List<JsonObject> objects = new ArrayList<>(array.size());
        for (JsonElement e : array) {
            if (e.isJsonObject()) {
                objects.add(e.getAsJsonObject());
            }
        }
        return objects;
    }
}
