package com.mdtodo.web;

/**
 * Envelope for every JSON response: {@code {"success": .., "data": .., "error": ..}}.
 * Exactly one of {@code data} and {@code error} is set; the other is serialized as {@code null}.
 */
public record ApiResponse<T>(boolean success, T data, String error) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> error(String message) {
        return new ApiResponse<>(false, null, message);
    }
}
