package com.teesheet.common.exception;


import com.teesheet.common.dto.ErrorInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum ErrorCode {
    // ========================================
    // 공통
    // ========================================
    INVALID_INPUT("COMMON_001", "잘못된 입력입니다", HttpStatus.BAD_REQUEST),
    INTERNAL_ERROR("COMMON_002", "내부 서버 오류가 발생했습니다", HttpStatus.INTERNAL_SERVER_ERROR),

    // ========================================
    // 예약 (bookings)
    // ========================================
    BOOKING_NOT_FOUND("BOOKING_001", "예약을 찾을 수 없습니다", HttpStatus.NOT_FOUND),

    /** 현재 상태에서 요청한 상태로 갈 수 없음 (같은 상태 재진입 포함) */
    INVALID_STATUS_TRANSITION("BOOKING_002", "현재 예약 상태에서는 요청한 상태로 변경할 수 없습니다", HttpStatus.BAD_REQUEST),

    /** 조건부 상태 변경이 0건 - 다른 요청이 먼저 상태를 바꿨음 */
    BOOKING_STATUS_CONFLICT("BOOKING_003", "다른 요청이 먼저 예약 상태를 변경했습니다. 다시 조회한 뒤 시도해주세요.", HttpStatus.CONFLICT),

    /** 날짜/시간이 없는 예약을 확정하려 함 */
    MISSING_SLOT_ASSIGNMENT("BOOKING_004", "예약에 날짜와 티타임이 지정되지 않았습니다", HttpStatus.BAD_REQUEST),

    // ========================================
    // 티타임 슬롯 (tee_times)
    // ========================================
    SLOT_NOT_FOUND("SLOT_001", "해당 티타임 슬롯이 존재하지 않습니다", HttpStatus.NOT_FOUND),

    /** 잔여 인원 부족 (동시 확정 경쟁에서 진 경우 포함) */
    INSUFFICIENT_CAPACITY("SLOT_002", "티타임 잔여 인원이 부족합니다. 다른 시간을 선택해주세요.", HttpStatus.CONFLICT),
    ;

    private final String code;
    private final String message;
    private final HttpStatus httpStatus;

    public ErrorInfo toErrorInfo() {
        return ErrorInfo.of(this.code, this.message);
    }

    public ErrorInfo toErrorInfo(String detail) {
        return ErrorInfo.of(this.code, this.message, detail);
    }
}
