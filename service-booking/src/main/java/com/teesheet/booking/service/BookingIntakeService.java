package com.teesheet.booking.service;

import com.teesheet.booking.dto.StatusChangeResult;
import com.teesheet.booking.entity.Booking;
import com.teesheet.booking.entity.BookingStatus;
import com.teesheet.booking.policy.TransitionPolicy;
import com.teesheet.booking.store.BookingStore;
import com.teesheet.common.exception.BusinessException;
import com.teesheet.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

/**
 * 예약 접수 서비스
 *
 * <p>메일 봇/웹 폼에서 넘어온 구조화된 값(코스, 날짜, 인원, 게스트)으로 예약을 만든다.
 * 상태 변경은 직접 하지 않고 {@link AvailabilityManager}에 위임한다.</p>
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class BookingIntakeService {

    private static final int MAX_ID_ATTEMPTS = 5;

    private final BookingStore bookingStore;
    private final AvailabilityManager availabilityManager;

    @Value("${teesheet.default-resource-id:royalportrush}")
    private String defaultResourceId;

    /**
     * 문의 접수 - Inquiry 상태로 생성
     *
     * @param resourceId 코스 ID (null이면 기본 코스)
     * @param date       희망 날짜 (없을 수 있음)
     * @param players    인원 (1 이상)
     */
    @Transactional
    public Booking createInquiry(String resourceId, LocalDate date, int players,
                                 String guestEmail, String guestName) {
        if (players <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "players=" + players);
        }

        Booking booking = Booking.builder()
                .bookingId(generateBookingId())
                .resourceId(resolveResourceId(resourceId))
                .date(date)
                .players(players)
                .status(BookingStatus.INQUIRY)
                .guestEmail(guestEmail)
                .guestName(guestName)
                .build();

        Booking saved = bookingStore.create(booking);
        log.info("문의 접수 완료: bookingId={}, resourceId={}, date={}, players={}",
                saved.getBookingId(), saved.getResourceId(), date, players);
        return saved;
    }

    /**
     * 날짜/티타임 지정 (점유 중이 아니고 종료되지 않은 예약만)
     */
    @Transactional
    public Booking assignSlot(String bookingId, LocalDate date, LocalTime time, String actor) {
        Booking booking = getBooking(bookingId);

        if (!bookingStore.assignSlot(bookingId, date, time, actor)) {
            BookingStatus status = getBooking(bookingId).getStatus();
            if (TransitionPolicy.isReserving(status) || TransitionPolicy.isTerminal(status)) {
                throw new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
                        status.getLabel() + " 상태에서는 티타임을 바꿀 수 없습니다");
            }
            throw new BusinessException(ErrorCode.BOOKING_STATUS_CONFLICT, "조회 시점 상태: " + booking.getStatus().getLabel());
        }

        log.info("티타임 지정: bookingId={}, date={}, time={}, actor={}", bookingId, date, time, actor);
        return getBooking(bookingId);
    }

    /**
     * 게스트의 "Book Now" - 티타임 지정 후 Requested로 전이
     * <p>
     * 이미 Requested면 티타임만 바꾼다. 전이가 거부되면 티타임 지정도 롤백된다.
     */
    @Transactional
    public Booking requestSlot(String bookingId, LocalDate date, LocalTime time, String actor) {
        Booking booking = assignSlot(bookingId, date, time, actor);

        if (booking.getStatus() != BookingStatus.REQUESTED) {
            StatusChangeResult result = availabilityManager.changeStatus(bookingId, BookingStatus.REQUESTED, actor);
            if (!result.success()) {
                throw new BusinessException(result.errorCode(),
                        result.detail() != null ? result.detail() : bookingId);
            }
        }
        return getBooking(bookingId);
    }

    public Booking getBooking(String bookingId) {
        return bookingStore.get(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND, bookingId));
    }

    public List<Booking> listBookings(String resourceId, BookingStatus status) {
        return bookingStore.list(resolveResourceId(resourceId), status);
    }

    private String resolveResourceId(String resourceId) {
        return resourceId == null || resourceId.isBlank() ? defaultResourceId : resourceId;
    }

    private String generateBookingId() {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String candidate = "BK-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
            if (!bookingStore.exists(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("예약 ID 생성 실패 (" + MAX_ID_ATTEMPTS + "회 충돌)");
    }
}
