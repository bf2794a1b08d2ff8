package com.teesheet.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Builder
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorInfo {

    private String code;
    private String message;

    /** 사용자에게 보여줄 추가 설명 (예: "잔여 1명, 요청 3명") */
    private String detail;

    public static ErrorInfo of(String code, String message) {
        return ErrorInfo.builder()
                .code(code)
                .message(message)
                .build();
    }

    public static ErrorInfo of(String code, String message, String detail) {
        return ErrorInfo.builder()
                .code(code)
                .message(message)
                .detail(detail)
                .build();
    }
}
