package com.teesheet.common.exception;

import com.teesheet.common.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 전역 예외 처리기
 *
 * <h2>예외 분류</h2>
 * <pre>
 * 1. BusinessException: 비즈니스 규칙 위반 (ErrorCode에 정의된 상태 코드, 기본 400)
 * 2. 요청 파라미터 오류: 누락/형식 오류 (400)
 * 3. ConcurrencyFailureException: 락 타임아웃, 낙관적 락 충돌 등 동시성 충돌 (409)
 * 4. 기타 Exception: 시스템 오류 (500)
 * </pre>
 *
 * 예약 상태 변경 API는 결과 객체(StatusChangeResult)로 실패를 돌려주므로
 * 여기까지 올라오는 것은 조회/등록 계열의 예외뿐이다.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 비즈니스 예외 처리
     * <p>
     * 예: 예약 없음, 슬롯 없음, 잘못된 인원 수 등
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        log.warn("비즈니스 예외 발생: code={}, message={}",
                e.getErrorInfo().getCode(), e.getMessage());

        return ResponseEntity
                .status(e.getHttpStatus())
                .body(ApiResponse.fail(e.getErrorInfo()));
    }

    /**
     * 요청 파라미터 누락/형식 오류 (400 Bad Request)
     */
    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleInvalidInput(Exception e) {
        log.warn("잘못된 요청: {}", e.getMessage());

        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.fail(ErrorCode.INVALID_INPUT.toErrorInfo(e.getMessage())));
    }

    /**
     * 동시성 충돌 처리 (409 Conflict)
     * <p>
     * 행 잠금 대기 시간 초과, 데드락 희생, @Version 충돌 등.
     * 클라이언트는 다시 조회한 뒤 재시도해야 한다.
     */
    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<ApiResponse<Void>> handleConcurrencyFailure(ConcurrencyFailureException e) {
        log.warn("동시성 충돌 발생: {}", e.getMessage());

        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(ApiResponse.fail("CONCURRENT_UPDATE_CONFLICT",
                        "다른 요청이 먼저 처리되었습니다. 다시 시도해주세요."));
    }

    /**
     * 기타 모든 예외 처리 (500 Internal Server Error)
     * <p>
     * 주의: 예외 메시지를 클라이언트에 노출하지 않는다.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("예외 발생: ", e);

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.fail(ErrorCode.INTERNAL_ERROR.toErrorInfo()));
    }
}
