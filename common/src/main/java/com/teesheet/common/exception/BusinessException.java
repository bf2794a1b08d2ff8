package com.teesheet.common.exception;

import com.teesheet.common.dto.ErrorInfo;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class BusinessException extends RuntimeException {
    private final ErrorInfo errorInfo;
    private final HttpStatus httpStatus;

    public BusinessException(ErrorInfo errorInfo) {
        super(errorInfo.getMessage());
        this.errorInfo = errorInfo;
        this.httpStatus = HttpStatus.BAD_REQUEST;
    }

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorInfo = errorCode.toErrorInfo();
        this.httpStatus = errorCode.getHttpStatus();
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(errorCode.getMessage() + " (" + detail + ")");
        this.errorInfo = errorCode.toErrorInfo(detail);
        this.httpStatus = errorCode.getHttpStatus();
    }

    public boolean is(ErrorCode errorCode) {
        return errorCode.getCode().equals(errorInfo.getCode());
    }
}
