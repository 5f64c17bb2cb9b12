package net.covers1624.ddnsconfig.config;

import java.util.List;

/**
 * Created by covers1624 on 19/10/26.
 */
public record CloudflareAccount(
        String id,
        Authentication authentication,
        List<Zone> zones
) {

    public CloudflareAccount withAuthentication(Authentication authentication) {
        return new CloudflareAccount(id, authentication, zones);
    }

    public CloudflareAccount withZones(List<Zone> zones) {
        return new CloudflareAccount(id, authentication, zones);
    }
}
