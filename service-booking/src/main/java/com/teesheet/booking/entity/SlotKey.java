package com.teesheet.booking.entity;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * 티타임 슬롯 식별자 (코스, 날짜, 시각)
 */
public record SlotKey(String resourceId, LocalDate date, LocalTime time) {

    public SlotKey {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(time, "time");
    }

    @Override
    public String toString() {
        return resourceId + "/" + date + "/" + time;
    }
}
