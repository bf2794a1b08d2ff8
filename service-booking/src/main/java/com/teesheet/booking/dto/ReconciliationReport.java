package com.teesheet.booking.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 잔여 인원 정합성 복구 결과
 */
public record ReconciliationReport(
        String resourceId,
        LocalDate date,
        int slotsChecked,
        List<Correction> corrections
) {
    public boolean hasCorrections() {
        return !corrections.isEmpty();
    }

    /**
     * 보정된 슬롯 하나
     */
    public record Correction(LocalTime time, int maxCapacity, int availableBefore, int availableAfter,
                             long reservedPlayers) {
    }
}
