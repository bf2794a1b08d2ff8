package com.teesheet.booking.dto;

import com.teesheet.booking.entity.BookingStatus;
import com.teesheet.booking.policy.SlotEffect;
import com.teesheet.common.exception.ErrorCode;

/**
 * 예약 상태 변경 결과
 *
 * <p>상태 변경의 실패는 예외가 아니라 이 결과로 돌려준다.
 * 재시도 여부는 호출자가 {@link #errorCode()}를 보고 결정한다.</p>
 * <ul>
 *   <li>INSUFFICIENT_CAPACITY - 같은 슬롯으로 재시도해도 소용없음, 게스트에게 마감 안내</li>
 *   <li>BOOKING_STATUS_CONFLICT - 다시 조회해 현재 상태를 확인한 뒤 판단</li>
 * </ul>
 *
 * @param previousStatus    변경 전 상태 (예약이 없으면 null)
 * @param requestedStatus   요청한 대상 상태
 * @param slotEffect        적용된 슬롯 영향 (실패 시 null)
 * @param availableCapacity 슬롯을 건드린 경우 변경 후 잔여 인원
 * @param warning           성공했지만 확인이 필요한 경우의 경고 (슬롯 레코드 누락 등)
 */
public record StatusChangeResult(
        String bookingId,
        boolean success,
        BookingStatus previousStatus,
        BookingStatus requestedStatus,
        SlotEffect slotEffect,
        Integer availableCapacity,
        ErrorCode errorCode,
        String detail,
        String warning
) {

    public static StatusChangeResult applied(String bookingId, BookingStatus previous, BookingStatus requested,
                                             SlotEffect effect, Integer availableCapacity) {
        return new StatusChangeResult(bookingId, true, previous, requested, effect, availableCapacity,
                null, null, null);
    }

    public static StatusChangeResult appliedWithWarning(String bookingId, BookingStatus previous,
                                                        BookingStatus requested, SlotEffect effect,
                                                        String warning) {
        return new StatusChangeResult(bookingId, true, previous, requested, effect, null,
                null, null, warning);
    }

    public static StatusChangeResult failed(String bookingId, BookingStatus previous, BookingStatus requested,
                                            ErrorCode errorCode, String detail) {
        return new StatusChangeResult(bookingId, false, previous, requested, null, null,
                errorCode, detail, null);
    }

    public boolean hasWarning() {
        return warning != null;
    }

    public boolean failedWith(ErrorCode code) {
        return !success && errorCode == code;
    }
}
