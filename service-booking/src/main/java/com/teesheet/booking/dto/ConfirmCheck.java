package com.teesheet.booking.dto;

import com.teesheet.common.exception.ErrorCode;

/**
 * 확정 가능 여부 사전 점검 결과 (대시보드 표시용, 실제 점유 없음)
 */
public record ConfirmCheck(
        boolean confirmable,
        ErrorCode errorCode,
        String reason,
        SlotAvailability availability
) {
    public static ConfirmCheck ok(SlotAvailability availability) {
        return new ConfirmCheck(true, null,
                "예약 가능 - 잔여 " + availability.availableCapacity() + "명", availability);
    }

    public static ConfirmCheck rejected(ErrorCode errorCode, String reason, SlotAvailability availability) {
        return new ConfirmCheck(false, errorCode, reason, availability);
    }
}
