package com.teesheet.booking.policy;

import com.teesheet.booking.entity.BookingStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.teesheet.booking.entity.BookingStatus.*;

/**
 * 예약 상태 전이 정책 (상태 없음, I/O 없음)
 *
 * <h3>전이 표</h3>
 * <pre>
 * Inquiry            → Pending                      (추가 정보 대기)
 * Inquiry/Pending    → Requested                    (게스트가 티타임 요청)
 * Inquiry/Pending/Requested → Confirmed             (직원 확정, RESERVE)
 * Confirmed          → Booked                       (결제 완료, 이미 점유 중)
 * Confirmed/Booked   → Requested | Cancelled        (되돌리기, RELEASE)
 * Inquiry/Pending/Requested → Rejected              (거절)
 * 종료 상태가 아닌 모든 상태 → Cancelled             (점유 중이면 RELEASE)
 * </pre>
 *
 * 같은 상태로의 재진입은 허용하지 않는다. Inquiry로 들어오는 전이는 없다 (최초 상태 전용).
 */
public final class TransitionPolicy {

    private static final Set<BookingStatus> RESERVING = Collections.unmodifiableSet(EnumSet.of(CONFIRMED, BOOKED));

    private static final Set<BookingStatus> TERMINAL = Collections.unmodifiableSet(EnumSet.of(CANCELLED, REJECTED));

    private static final Map<BookingStatus, Set<BookingStatus>> LEGAL_SOURCES = new EnumMap<>(BookingStatus.class);

    static {
        LEGAL_SOURCES.put(INQUIRY, EnumSet.noneOf(BookingStatus.class));
        LEGAL_SOURCES.put(PENDING, EnumSet.of(INQUIRY));
        LEGAL_SOURCES.put(REQUESTED, EnumSet.of(INQUIRY, PENDING, CONFIRMED, BOOKED));
        LEGAL_SOURCES.put(CONFIRMED, EnumSet.of(INQUIRY, PENDING, REQUESTED));
        LEGAL_SOURCES.put(BOOKED, EnumSet.of(CONFIRMED));
        LEGAL_SOURCES.put(CANCELLED, EnumSet.of(INQUIRY, PENDING, REQUESTED, CONFIRMED, BOOKED));
        LEGAL_SOURCES.put(REJECTED, EnumSet.of(INQUIRY, PENDING, REQUESTED));
        LEGAL_SOURCES.replaceAll((target, sources) -> Collections.unmodifiableSet(sources));
    }

    private TransitionPolicy() {
    }

    /**
     * 슬롯 인원을 점유하는 상태인지 (Confirmed, Booked)
     */
    public static boolean isReserving(BookingStatus status) {
        return RESERVING.contains(status);
    }

    public static boolean isTerminal(BookingStatus status) {
        return TERMINAL.contains(status);
    }

    public static Set<BookingStatus> reservingStatuses() {
        return RESERVING;
    }

    /**
     * 점유하지도 종료되지도 않은 상태 (슬롯 재지정이 가능한 상태)
     */
    public static Set<BookingStatus> openStatuses() {
        EnumSet<BookingStatus> open = EnumSet.allOf(BookingStatus.class);
        open.removeAll(RESERVING);
        open.removeAll(TERMINAL);
        return Collections.unmodifiableSet(open);
    }

    /**
     * targetStatus로 들어올 수 있는 상태 집합
     */
    public static Set<BookingStatus> legalSources(BookingStatus targetStatus) {
        if (targetStatus == null) {
            return Collections.emptySet();
        }
        return LEGAL_SOURCES.get(targetStatus);
    }

    public static boolean canTransition(BookingStatus from, BookingStatus to) {
        return from != null && legalSources(to).contains(from);
    }

    /**
     * 전이에 따른 슬롯 영향
     * <p>
     * 점유 → 점유(Confirmed → Booked)는 NONE이다.
     */
    public static SlotEffect slotEffect(BookingStatus from, BookingStatus to) {
        boolean fromReserving = isReserving(from);
        boolean toReserving = isReserving(to);
        if (!fromReserving && toReserving) {
            return SlotEffect.RESERVE;
        }
        if (fromReserving && !toReserving) {
            return SlotEffect.RELEASE;
        }
        return SlotEffect.NONE;
    }
}
