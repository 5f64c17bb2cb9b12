package net.covers1624.ddnsconfig.config;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Owns the live {@link Config} tree and applies all account and zone operations to it.
 * <p>
 * Mutations are serialized on a single lock. Each one validates its input, builds a new tree,
 * writes it to disk and only then publishes it, all while holding the lock. A rejected or failed
 * mutation therefore leaves both the in memory tree and the file untouched.
 * <p>
 * Reads return the currently published tree and never block on writers.
 * <p>
 * Created by covers1624 on 19/10/26.
 */
public class ConfigStore {

    private static final Logger LOGGER = LogManager.getLogger();

    private final Object lock = new Object();
    private final ConfigFile file;
    private final Supplier<String> idGenerator;

    private volatile Config config;

    public ConfigStore(ConfigFile file, Config config) {
        this(file, config, () -> UUID.randomUUID().toString());
    }

    public ConfigStore(ConfigFile file, Config config, Supplier<String> idGenerator) {
        this.file = file;
        this.config = config;
        this.idGenerator = idGenerator;
    }

    public static ConfigStore load(ConfigFile file) throws IOException {
        return new ConfigStore(file, file.load());
    }

    /**
     * @return The current config tree.
     */
    public Config config() {
        return config;
    }

    // region Accounts

    public List<CloudflareAccount> listAccounts() {
        return config.cloudflare();
    }

    public CloudflareAccount getAccount(String id) {
        return findAccount(config, id);
    }

    /**
     * Add a new account.
     * <p>
     * The account, and all of its zones and subdomains, are given new ids.
     *
     * @param candidate The account to add.
     * @return The added account.
     * @throws ConfigException If the account is invalid, or its credentials are already used by another account.
     */
    public CloudflareAccount createAccount(CloudflareAccount candidate) {
        synchronized (lock) {
            Config current = config;
            ConfigValidator.validateAccount(candidate)
                    .and(() -> ConfigValidator.uniqueCredentials(candidate.authentication(), current.cloudflare()))
                    .throwIfInvalid();

            CloudflareAccount account = new CloudflareAccount(
                    newId(),
                    candidate.authentication(),
                    ImmutableList.copyOf(candidate.zones().stream().map(this::withNewIds).iterator())
            );
            commit(current.withAccounts(append(current.cloudflare(), account)));
            LOGGER.info("Added account {}", account.id());
            return account;
        }
    }

    /**
     * Replace an account.
     * <p>
     * The id of the existing account is kept, as is the zone id of any zone record
     * carried over by id. Credentials are not checked against
     * other accounts here, unlike {@link #createAccount}.
     *
     * @param id        The id of the account to replace.
     * @param candidate The replacement.
     * @return The stored account.
     * @throws ConfigException If the account does not exist or the replacement is invalid.
     */
    public CloudflareAccount updateAccount(String id, CloudflareAccount candidate) {
        synchronized (lock) {
            Config current = config;
            int index = indexOfAccount(current, id);
            ConfigValidator.validateAccount(candidate).throwIfInvalid();
            // Zones keep their Cloudflare zone id for as long as the record exists.
            for (Zone existing : current.cloudflare().get(index).zones()) {
                for (Zone zone : candidate.zones()) {
                    if (existing.id().equals(zone.id()) && !existing.zoneId().equals(zone.zoneId())) {
                        throw ConfigException.conflict("Zone ID cannot be changed");
                    }
                }
            }

            CloudflareAccount account = new CloudflareAccount(
                    id,
                    candidate.authentication(),
                    ImmutableList.copyOf(candidate.zones().stream().map(this::withMissingIds).iterator())
            );
            commit(current.withAccounts(replace(current.cloudflare(), index, account)));
            LOGGER.info("Updated account {}", id);
            return account;
        }
    }

    public void deleteAccount(String id) {
        synchronized (lock) {
            Config current = config;
            int index = indexOfAccount(current, id);

            commit(current.withAccounts(remove(current.cloudflare(), index)));
            LOGGER.info("Deleted account {}", id);
        }
    }

    /**
     * Replace only the credentials of an account.
     * <p>
     * As with {@link #updateAccount}, credentials are not checked against other accounts.
     */
    public Authentication updateAuthentication(String id, Authentication authentication) {
        synchronized (lock) {
            Config current = config;
            int index = indexOfAccount(current, id);

            CloudflareAccount account = current.cloudflare().get(index).withAuthentication(authentication);
            commit(current.withAccounts(replace(current.cloudflare(), index, account)));
            LOGGER.info("Updated authentication for account {}", id);
            return authentication;
        }
    }
    // endregion

    // region Zones

    public List<Zone> listZones(String accountId) {
        return findAccount(config, accountId).zones();
    }

    public Zone getZone(String accountId, String id) {
        CloudflareAccount account = findAccount(config, accountId);
        return account.zones().get(indexOfZone(account, id));
    }

    /**
     * Add a new zone to an account.
     * <p>
     * The zone and its subdomains are given new ids.
     *
     * @param accountId The account to add the zone to.
     * @param candidate The zone to add.
     * @return The added zone.
     * @throws ConfigException If the account does not exist, the zone is invalid,
     *                         or the account already has a zone with the same zone id.
     */
    public Zone createZone(String accountId, Zone candidate) {
        synchronized (lock) {
            Config current = config;
            int accountIndex = indexOfAccount(current, accountId);
            CloudflareAccount account = current.cloudflare().get(accountIndex);

            ConfigValidator.validateZone(candidate).throwIfInvalid();
            for (Zone zone : account.zones()) {
                if (zone.zoneId().equals(candidate.zoneId())) {
                    throw ConfigException.conflict("Zone " + candidate.zoneId() + " already exists");
                }
            }

            Zone zone = withNewIds(candidate);
            account = account.withZones(append(account.zones(), zone));
            commit(current.withAccounts(replace(current.cloudflare(), accountIndex, account)));
            LOGGER.info("Added zone {} to account {}", zone.id(), accountId);
            return zone;
        }
    }

    /**
     * Replace a zone.
     * <p>
     * The record id is kept and the Cloudflare zone id may not change.
     * Subdomains without an id are given one.
     */
    public Zone updateZone(String accountId, String id, Zone candidate) {
        synchronized (lock) {
            Config current = config;
            int accountIndex = indexOfAccount(current, accountId);
            CloudflareAccount account = current.cloudflare().get(accountIndex);
            int zoneIndex = indexOfZone(account, id);

            ConfigValidator.validateZone(candidate).throwIfInvalid();
            if (!account.zones().get(zoneIndex).zoneId().equals(candidate.zoneId())) {
                throw ConfigException.conflict("Zone ID cannot be changed");
            }

            Zone zone = withMissingIds(candidate.withId(id));
            account = account.withZones(replace(account.zones(), zoneIndex, zone));
            commit(current.withAccounts(replace(current.cloudflare(), accountIndex, account)));
            LOGGER.info("Updated zone {} in account {}", id, accountId);
            return zone;
        }
    }

    public void deleteZone(String accountId, String id) {
        synchronized (lock) {
            Config current = config;
            int accountIndex = indexOfAccount(current, accountId);
            CloudflareAccount account = current.cloudflare().get(accountIndex);
            int zoneIndex = indexOfZone(account, id);

            account = account.withZones(remove(account.zones(), zoneIndex));
            commit(current.withAccounts(replace(current.cloudflare(), accountIndex, account)));
            LOGGER.info("Deleted zone {} from account {}", id, accountId);
        }
    }
    // endregion

    // Must be called with the lock held.
    private void commit(Config next) {
        try {
            file.save(next);
        } catch (IOException ex) {
            LOGGER.error("Failed to save config to {}", file.getPath(), ex);
            throw ConfigException.internal("Failed to save config: " + ex, ex);
        }
        config = next;
    }

    private String newId() {
        return idGenerator.get();
    }

    private Zone withNewIds(Zone zone) {
        return new Zone(
                newId(),
                zone.zoneId(),
                zone.domain(),
                ImmutableList.copyOf(zone.subdomains().stream().map(e -> e.withId(newId())).iterator())
        );
    }

    private Zone withMissingIds(Zone zone) {
        return new Zone(
                idOrNew(zone.id()),
                zone.zoneId(),
                zone.domain(),
                ImmutableList.copyOf(zone.subdomains().stream().map(e -> e.withId(idOrNew(e.id()))).iterator())
        );
    }

    private String idOrNew(@Nullable String id) {
        return id != null ? id : newId();
    }

    private static CloudflareAccount findAccount(Config config, String id) {
        return config.cloudflare().get(indexOfAccount(config, id));
    }

    private static int indexOfAccount(Config config, String id) {
        List<CloudflareAccount> accounts = config.cloudflare();
        for (int i = 0; i < accounts.size(); i++) {
            if (accounts.get(i).id().equals(id)) return i;
        }
        throw ConfigException.notFound("Account " + id + " not found");
    }

    private static int indexOfZone(CloudflareAccount account, String id) {
        List<Zone> zones = account.zones();
        for (int i = 0; i < zones.size(); i++) {
            if (zones.get(i).id().equals(id)) return i;
        }
        throw ConfigException.notFound("Zone " + id + " not found");
    }

    private static <T> List<T> append(List<T> list, T value) {
        return ImmutableList.<T>builder().addAll(list).add(value).build();
    }

    private static <T> List<T> replace(List<T> list, int index, T value) {
        ImmutableList.Builder<T> builder = ImmutableList.builder();
        for (int i = 0; i < list.size(); i++) {
            builder.add(i == index ? value : list.get(i));
        }
        return builder.build();
    }

    private static <T> List<T> remove(List<T> list, int index) {
        ImmutableList.Builder<T> builder = ImmutableList.builder();
        for (int i = 0; i < list.size(); i++) {
            if (i != index) builder.add(list.get(i));
        }
        return builder.build();
    }
}
