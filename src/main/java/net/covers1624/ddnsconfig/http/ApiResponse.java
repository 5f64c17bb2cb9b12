package net.covers1624.ddnsconfig.http;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.Nullable;

/**
 * The envelope every endpoint responds with.
 * <p>
 * Created by covers1624 on 19/10/26.
 */
public record ApiResponse(
        boolean error,
        @Nullable Object data,
        String message
) {

    public static ApiResponse success(@Nullable Object data, String message) {
        return new ApiResponse(false, data, message);
    }

    public static ApiResponse failure(String message, String detail) {
        return new ApiResponse(true, ImmutableMap.of("detail", detail), message);
    }
}
