package net.covers1624.ddnsconfig.config;

import com.google.gson.annotations.SerializedName;
import org.jetbrains.annotations.Nullable;

/**
 * Credentials used by the DNS agent to talk to Cloudflare.
 * <p>
 * Either form, or both, may be present.
 * <p>
 * Created by covers1624 on 19/10/26.
 */
public record Authentication(
        @SerializedName ("api_token") @Nullable String apiToken,
        @SerializedName ("api_key") @Nullable ApiKey apiKey
) {

    public record ApiKey(
            @SerializedName ("api_key") String apiKey,
            @SerializedName ("account_email") String accountEmail
    ) {

        @Override
        public String toString() {
            // Never leak the key into logs.
            return "ApiKey[accountEmail=" + accountEmail + "]";
        }
    }

    @Override
    public String toString() {
        return "Authentication[apiToken=" + (apiToken != null ? "<set>" : null) + ", apiKey=" + apiKey + "]";
    }
}
