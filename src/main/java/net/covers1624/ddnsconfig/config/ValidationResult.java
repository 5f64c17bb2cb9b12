package net.covers1624.ddnsconfig.config;

import org.jetbrains.annotations.Nullable;

import java.util.function.Supplier;

/**
 * The outcome of a validation check, either ok or a categorized failure.
 * <p>
 * Created by covers1624 on 19/10/26.
 */
public record ValidationResult(@Nullable ConfigException.Kind kind, @Nullable String message) {

    private static final ValidationResult OK = new ValidationResult(null, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(String message) {
        return new ValidationResult(ConfigException.Kind.VALIDATION, message);
    }

    public static ValidationResult conflict(String message) {
        return new ValidationResult(ConfigException.Kind.CONFLICT, message);
    }

    public boolean isValid() {
        return kind == null;
    }

    /**
     * Chains another check, only evaluated if this one passed.
     */
    public ValidationResult and(Supplier<ValidationResult> next) {
        return isValid() ? next.get() : this;
    }

    public void throwIfInvalid() {
        if (kind != null) {
            throw new ConfigException(kind, String.valueOf(message));
        }
    }
}
