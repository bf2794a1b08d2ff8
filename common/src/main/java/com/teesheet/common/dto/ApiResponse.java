package com.teesheet.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 공통 API 응답 envelope
 *
 * <p>성공 시 {@code data}, 실패 시 {@code errorInfo}만 채워진다.
 * {@code warning}은 성공했지만 운영자 확인이 필요한 경우(예: 슬롯 레코드 누락 상태에서의 예약 해제)에만 채워진다.</p>
 */
@Builder
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;
    private T data;
    private ErrorInfo errorInfo;
    private String warning;

    public static <T> ApiResponse<T> success() {
        return ApiResponse.<T>builder()
                .success(true)
                .build();
    }

    public static <T> ApiResponse<T> success(T data) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> successWithWarning(T data, String warning) {
        return ApiResponse.<T>builder()
                .success(true)
                .data(data)
                .warning(warning)
                .build();
    }

    public static <T> ApiResponse<T> fail(String code, String message) {
        return ApiResponse.<T>builder()
                .success(false)
                .errorInfo(ErrorInfo.of(code, message))
                .build();
    }

    public static <T> ApiResponse<T> fail(ErrorInfo errorInfo) {
        return ApiResponse.<T>builder()
                .success(false)
                .errorInfo(errorInfo)
                .build();
    }

    /**
     * 실패 응답이지만 현재 상태 등 부가 데이터를 함께 내려줄 때 사용
     */
    public static <T> ApiResponse<T> fail(ErrorInfo errorInfo, T data) {
        return ApiResponse.<T>builder()
                .success(false)
                .errorInfo(errorInfo)
                .data(data)
                .build();
    }
}
