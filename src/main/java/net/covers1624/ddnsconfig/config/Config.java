package net.covers1624.ddnsconfig.config;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The root of the configuration tree read by the DNS agent.
 * <p>
 * Instances are immutable, every mutation made through {@link ConfigStore} produces a new tree.
 * <p>
 * Created by covers1624 on 1/11/23.
 */
public record Config(
        List<CloudflareAccount> cloudflare,
        // Update A records.
        boolean a,
        // Update AAAA records.
        boolean aaaa,
        // Remove records in managed zones which are not configured here.
        boolean purgeUnknownRecords,
        // Default TTL for records.
        int ttl
) {

    public static final boolean DEFAULT_A = true;
    public static final boolean DEFAULT_AAAA = true;
    public static final boolean DEFAULT_PURGE_UNKNOWN_RECORDS = false;
    public static final int DEFAULT_TTL = 300;

    public static Config defaults() {
        return new Config(ImmutableList.of(), DEFAULT_A, DEFAULT_AAAA, DEFAULT_PURGE_UNKNOWN_RECORDS, DEFAULT_TTL);
    }

    public Config withAccounts(List<CloudflareAccount> cloudflare) {
        return new Config(cloudflare, a, aaaa, purgeUnknownRecords, ttl);
    }
}
