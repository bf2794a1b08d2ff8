package com.teesheet.booking.entity;

import java.util.Locale;

/**
 * 예약 상태
 * <p>
 * 상태 전이 규칙과 슬롯 점유 여부는 {@link com.teesheet.booking.policy.TransitionPolicy}가 단독으로 관리한다.
 */
public enum BookingStatus {
    INQUIRY("Inquiry"),       // 문의 접수 (최초 상태)
    PENDING("Pending"),       // 게스트 추가 정보 대기
    REQUESTED("Requested"),   // 게스트가 특정 티타임을 요청
    CONFIRMED("Confirmed"),   // 직원 확정 (슬롯 점유)
    BOOKED("Booked"),         // 결제 완료 (슬롯 점유 유지)
    CANCELLED("Cancelled"),   // 취소 (종료)
    REJECTED("Rejected");     // 거절 (종료)

    private final String label;

    BookingStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * "Confirmed", "CONFIRMED", "confirmed" 모두 허용
     */
    public static BookingStatus from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("예약 상태가 비어 있습니다");
        }
        try {
            return BookingStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("알 수 없는 예약 상태: " + value, e);
        }
    }
}
