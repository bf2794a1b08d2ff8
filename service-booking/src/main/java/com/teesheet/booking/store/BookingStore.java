package com.teesheet.booking.store;

import com.teesheet.booking.entity.Booking;
import com.teesheet.booking.entity.BookingStatus;
import com.teesheet.booking.entity.SlotKey;
import com.teesheet.booking.policy.TransitionPolicy;
import com.teesheet.booking.repository.BookingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 예약 저장소
 *
 * <p>상태 변경은 {@link #setStatus}의 조건부 UPDATE로만 한다.</p>
 */
@Component
@RequiredArgsConstructor
public class BookingStore {

    private final BookingRepository bookingRepository;

    public Optional<Booking> get(String bookingId) {
        return bookingRepository.findByBookingId(bookingId);
    }

    public boolean exists(String bookingId) {
        return bookingRepository.existsByBookingId(bookingId);
    }

    public Booking create(Booking booking) {
        return bookingRepository.save(booking);
    }

    /**
     * 현재 상태가 expectedCurrentStatuses 중 하나일 때만 newStatus로 변경
     *
     * @return false: 예약이 없거나 다른 요청이 먼저 상태를 바꿈 (NoMatch)
     */
    public boolean setStatus(String bookingId, BookingStatus newStatus,
                             Set<BookingStatus> expectedCurrentStatuses, String actor) {
        if (expectedCurrentStatuses.isEmpty()) {
            return false;
        }
        LocalDateTime now = LocalDateTime.now();
        int updated = newStatus == BookingStatus.CONFIRMED
                ? bookingRepository.updateStatusAndConfirmedAtIfCurrent(
                        bookingId, newStatus, expectedCurrentStatuses, actor, now)
                : bookingRepository.updateStatusIfCurrent(
                        bookingId, newStatus, expectedCurrentStatuses, actor, now);
        return updated == 1;
    }

    /**
     * {@link #setStatus}와 같지만 예약의 티타임이 slotKey와 같을 때만 변경 (점유 전이용)
     *
     * @return false: 상태가 바뀌었거나 그 사이 티타임이 재지정됨 (NoMatch)
     */
    public boolean setStatusOnSlot(String bookingId, BookingStatus newStatus,
                                   Set<BookingStatus> expectedCurrentStatuses, SlotKey slotKey, String actor) {
        if (expectedCurrentStatuses.isEmpty()) {
            return false;
        }
        LocalDateTime now = LocalDateTime.now();
        int updated = newStatus == BookingStatus.CONFIRMED
                ? bookingRepository.updateStatusAndConfirmedAtIfCurrentOnSlot(
                        bookingId, newStatus, expectedCurrentStatuses,
                        slotKey.resourceId(), slotKey.date(), slotKey.time(), actor, now)
                : bookingRepository.updateStatusIfCurrentOnSlot(
                        bookingId, newStatus, expectedCurrentStatuses,
                        slotKey.resourceId(), slotKey.date(), slotKey.time(), actor, now);
        return updated == 1;
    }

    /**
     * 점유 중이 아니고 종료되지 않은 예약에만 날짜/시간을 지정
     *
     * @return false: 예약이 없거나 이미 점유/종료 상태
     */
    public boolean assignSlot(String bookingId, LocalDate date, LocalTime time, String actor) {
        int updated = bookingRepository.assignSlotIfStatusIn(
                bookingId, date, time, TransitionPolicy.openStatuses(), actor, LocalDateTime.now());
        return updated == 1;
    }

    /**
     * 슬롯을 점유 중인 예약들의 인원 합계
     */
    public long sumReservedPlayers(SlotKey key) {
        Long sum = bookingRepository.sumPlayersOnSlot(
                key.resourceId(), key.date(), key.time(), TransitionPolicy.reservingStatuses());
        return sum != null ? sum : 0L;
    }

    public List<Booking> list(String resourceId, BookingStatus status) {
        if (status == null) {
            return bookingRepository.findByResourceIdOrderByCreatedAtDesc(resourceId);
        }
        return bookingRepository.findByResourceIdAndStatusOrderByCreatedAtDesc(resourceId, status);
    }
}
