package com.temple.booking.web.common;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 모든 응답의 공통 봉투 { statusCode, message, code, data }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        int statusCode,
        String message,
        String code,
        T data
) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(200, "OK", null, data);
    }

    public static <T> ApiResponse<T> of(int statusCode, String code, String message, T data) {
        return new ApiResponse<>(statusCode, message, code, data);
    }

    public static ApiResponse<Void> error(int statusCode, String code, String message) {
        return new ApiResponse<>(statusCode, message, code, null);
    }
}
