package com.example.roster.common;

import java.util.Collections;
import java.util.Map;

/**
 * ロスターAPIの共通レスポンス。
 * {@code meta} には反復回数や違反件数など、本体に含めない補足情報を入れる。
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, null, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
