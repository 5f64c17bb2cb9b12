package net.covers1624.ddnsconfig.config;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown by {@link ConfigStore} and {@link ConfigFile} when an operation is rejected or fails.
 * <p>
 * The tree is never modified when one of these escapes a mutating operation.
 * <p>
 * Created by covers1624 on 19/10/26.
 */
public class ConfigException extends RuntimeException {

    private final Kind kind;

    public ConfigException(Kind kind, String message) {
        this(kind, message, null);
    }

    public ConfigException(Kind kind, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ConfigException validation(String message) {
        return new ConfigException(Kind.VALIDATION, message);
    }

    public static ConfigException conflict(String message) {
        return new ConfigException(Kind.CONFLICT, message);
    }

    public static ConfigException notFound(String message) {
        return new ConfigException(Kind.NOT_FOUND, message);
    }

    public static ConfigException internal(String message, Throwable cause) {
        return new ConfigException(Kind.INTERNAL, message, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public enum Kind {
        // Malformed or out of range input.
        VALIDATION(422),
        // Duplicate credential, zone id, or subdomain name.
        CONFLICT(400),
        NOT_FOUND(404),
        // Persistence failure or unexpected fault.
        INTERNAL(500);

        public final int status;

        Kind(int status) {
            this.status = status;
        }
    }
}
