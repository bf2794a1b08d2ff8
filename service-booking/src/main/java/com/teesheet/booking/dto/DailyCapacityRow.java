package com.teesheet.booking.dto;

import java.time.LocalDate;

/**
 * 날짜별 슬롯 집계 행 (JPQL 생성자 표현식 대상)
 */
public record DailyCapacityRow(LocalDate date, Long slotCount, Long totalCapacity, Long totalAvailable) {
}
