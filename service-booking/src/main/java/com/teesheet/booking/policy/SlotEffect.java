package com.teesheet.booking.policy;

/**
 * 상태 전이가 티타임 잔여 인원에 주는 영향
 */
public enum SlotEffect {
    NONE,     // 잔여 인원 변화 없음
    RESERVE,  // 비점유 → 점유: 잔여 인원 차감
    RELEASE   // 점유 → 비점유: 잔여 인원 복구
}
