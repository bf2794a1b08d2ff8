package com.teesheet.booking.dto;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * 날짜별 가용 현황 리포트 행
 *
 * @param utilizationPct booked / capacity * 100 (소수 첫째 자리 반올림, 수용 인원 0이면 0.0)
 */
public record DailyAvailability(
        LocalDate date,
        DayOfWeek dayOfWeek,
        long slotCount,
        long totalCapacity,
        long totalAvailable,
        long totalBooked,
        double utilizationPct
) {
    public static DailyAvailability from(DailyCapacityRow row) {
        long capacity = row.totalCapacity() != null ? row.totalCapacity() : 0L;
        long available = row.totalAvailable() != null ? row.totalAvailable() : 0L;
        long booked = capacity - available;
        double utilization = capacity > 0 ? Math.round(booked * 1000.0 / capacity) / 10.0 : 0.0;
        return new DailyAvailability(
                row.date(),
                row.date().getDayOfWeek(),
                row.slotCount() != null ? row.slotCount() : 0L,
                capacity,
                available,
                booked,
                utilization
        );
    }
}
