package net.covers1624.ddnsconfig.config;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Field rules and uniqueness checks for the configuration tree.
 * <p>
 * Each entity is checked field by field first, then for duplicates among its children.
 * The first failure wins.
 * <p>
 * Created by covers1624 on 19/10/26.
 */
public class ConfigValidator {

    public static final int MIN_TTL = 60;
    public static final int MAX_TTL = 86400;
    public static final int MAX_NAME_LENGTH = 63;

    private static final String LABEL = "[a-zA-Z0-9](?:[a-zA-Z0-9-]*[a-zA-Z0-9])?";
    private static final Pattern SUBDOMAIN_NAME = Pattern.compile("^(?:@|" + LABEL + "(?:\\." + LABEL + ")*)$");
    private static final Pattern ZONE_ID = Pattern.compile("^[a-f0-9]{32}$");

    public static ValidationResult validateSubDomainName(String name) {
        if (!SUBDOMAIN_NAME.matcher(name).matches()) {
            return ValidationResult.invalid("Invalid subdomain name: " + name);
        }
        if (name.length() > MAX_NAME_LENGTH) {
            return ValidationResult.invalid("Subdomain name must be less than 63 characters");
        }
        return ValidationResult.ok();
    }

    public static ValidationResult validateTtl(int ttl) {
        if (ttl < MIN_TTL || ttl > MAX_TTL) {
            return ValidationResult.invalid("TTL must be between 60 and 86400 seconds");
        }
        return ValidationResult.ok();
    }

    public static ValidationResult validateZoneId(String zoneId) {
        if (!ZONE_ID.matcher(zoneId).matches()) {
            return ValidationResult.invalid("Zone ID must be a 32-character hexadecimal string");
        }
        return ValidationResult.ok();
    }

    public static ValidationResult validateSubDomain(SubDomain subDomain) {
        return validateSubDomainName(subDomain.name())
                .and(() -> validateTtl(subDomain.ttl()));
    }

    public static ValidationResult validateZone(Zone zone) {
        ValidationResult result = validateZoneId(zone.zoneId());
        for (SubDomain subDomain : zone.subdomains()) {
            result = result.and(() -> validateSubDomain(subDomain));
        }
        return result
                .and(() -> uniqueSubDomainNames(zone.subdomains()))
                .and(() -> uniqueIds(zone.subdomains(), SubDomain::id));
    }

    public static ValidationResult validateAccount(CloudflareAccount account) {
        ValidationResult result = ValidationResult.ok();
        for (Zone zone : account.zones()) {
            result = result.and(() -> validateZone(zone));
        }
        return result
                .and(() -> uniqueZoneIds(account.zones()))
                .and(() -> uniqueIds(account.zones(), Zone::id));
    }

    public static ValidationResult validateConfig(Config config) {
        ValidationResult result = validateTtl(config.ttl());
        for (CloudflareAccount account : config.cloudflare()) {
            result = result.and(() -> validateAccount(account));
        }
        return result.and(() -> uniqueIds(config.cloudflare(), CloudflareAccount::id));
    }

    public static ValidationResult uniqueSubDomainNames(List<SubDomain> subDomains) {
        Set<String> seen = new HashSet<>();
        for (SubDomain subDomain : subDomains) {
            if (!seen.add(subDomain.name())) {
                return ValidationResult.conflict("Duplicate subdomain name: " + subDomain.name());
            }
        }
        return ValidationResult.ok();
    }

    public static ValidationResult uniqueZoneIds(List<Zone> zones) {
        Set<String> seen = new HashSet<>();
        for (Zone zone : zones) {
            if (!seen.add(zone.zoneId())) {
                return ValidationResult.conflict("Duplicate zone ID: " + zone.zoneId());
            }
        }
        return ValidationResult.ok();
    }

    /**
     * Checks that no two siblings share a record id. Records without an id are ignored.
     */
    public static <T> ValidationResult uniqueIds(List<T> records, Function<T, String> idFunc) {
        Set<String> seen = new HashSet<>();
        for (T record : records) {
            String id = idFunc.apply(record);
            if (id != null && !seen.add(id)) {
                return ValidationResult.conflict("Duplicate record id: " + id);
            }
        }
        return ValidationResult.ok();
    }

    /**
     * Checks the candidate credentials against those of every existing account.
     * <p>
     * For each account the token is checked first, then the key, then the email.
     * Absent credentials never match.
     */
    public static ValidationResult uniqueCredentials(Authentication candidate, List<CloudflareAccount> existing) {
        for (CloudflareAccount account : existing) {
            Authentication other = account.authentication();
            if (candidate.apiToken() != null && Objects.equals(candidate.apiToken(), other.apiToken())) {
                return ValidationResult.conflict("API Token already exists");
            }
            Authentication.ApiKey key = candidate.apiKey();
            Authentication.ApiKey otherKey = other.apiKey();
            if (key == null || otherKey == null) continue;

            if (key.apiKey().equals(otherKey.apiKey())) {
                return ValidationResult.conflict("API Key already exists");
            }
            if (key.accountEmail().equals(otherKey.accountEmail())) {
                return ValidationResult.conflict("Account email already exists");
            }
        }
        return ValidationResult.ok();
    }
}
