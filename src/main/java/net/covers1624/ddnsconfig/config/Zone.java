package net.covers1624.ddnsconfig.config;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Created by covers1624 on 19/10/26.
 */
public record Zone(
        String id,
        // The Cloudflare assigned zone identifier.
        @SerializedName ("zone_id") String zoneId,
        String domain,
        List<SubDomain> subdomains
) {

    public Zone withId(String id) {
        return new Zone(id, zoneId, domain, subdomains);
    }
}
