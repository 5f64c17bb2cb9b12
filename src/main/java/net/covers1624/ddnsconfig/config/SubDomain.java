package net.covers1624.ddnsconfig.config;

/**
 * A DNS record within a {@link Zone} which the DNS agent keeps pointed at the current address.
 * <p>
 * Created by covers1624 on 19/10/26.
 */
public record SubDomain(
        String id,
        // The record name relative to the zone, '@' for the zone apex.
        String name,
        // If traffic should be routed through Cloudflare.
        boolean proxied,
        int ttl
) {

    public SubDomain withId(String id) {
        return new SubDomain(id, name, proxied, ttl);
    }
}
