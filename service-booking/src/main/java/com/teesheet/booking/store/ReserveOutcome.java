package com.teesheet.booking.store;

/**
 * {@link SlotStore#tryReserve} 결과
 */
public enum ReserveOutcome {
    RESERVED,
    INSUFFICIENT_CAPACITY,
    SLOT_NOT_FOUND
}
