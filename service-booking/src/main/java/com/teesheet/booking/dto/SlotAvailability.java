package com.teesheet.booking.dto;

import com.teesheet.booking.entity.Slot;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 슬롯 잔여 인원 스냅샷 (읽기 전용)
 */
public record SlotAvailability(
        String resourceId,
        LocalDate date,
        LocalTime time,
        int maxCapacity,
        int availableCapacity,
        boolean bookable,
        BigDecimal greenFee
) {
    public static SlotAvailability from(Slot slot) {
        return new SlotAvailability(
                slot.getResourceId(),
                slot.getDate(),
                slot.getTime(),
                slot.getMaxCapacity(),
                slot.getAvailableCapacity(),
                Boolean.TRUE.equals(slot.getBookable()),
                slot.getGreenFee()
        );
    }

    public boolean canAccommodate(int players) {
        return bookable && availableCapacity >= players;
    }
}
