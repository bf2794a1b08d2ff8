package com.teesheet.booking.service;

import com.teesheet.booking.dto.ConfirmCheck;
import com.teesheet.booking.dto.DailyAvailability;
import com.teesheet.booking.dto.SlotAvailability;
import com.teesheet.booking.dto.StatusChangeResult;
import com.teesheet.booking.entity.Booking;
import com.teesheet.booking.entity.BookingStatus;
import com.teesheet.booking.entity.SlotKey;
import com.teesheet.booking.policy.SlotEffect;
import com.teesheet.booking.policy.TransitionPolicy;
import com.teesheet.booking.repository.SlotRepository;
import com.teesheet.booking.store.BookingStore;
import com.teesheet.booking.store.ReserveOutcome;
import com.teesheet.booking.store.SlotStore;
import com.teesheet.common.exception.BusinessException;
import com.teesheet.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 티타임 잔여 인원 관리자
 *
 * <p>예약 상태 변경의 유일한 진입점이다. 예약 상태와 슬롯 잔여 인원이 항상 맞물리도록 보장한다.</p>
 *
 * <h3>불변식</h3>
 * <pre>
 * availableCapacity = maxCapacity - Σ(점유 상태 예약의 players)
 * 0 <= availableCapacity <= maxCapacity
 * </pre>
 *
 * <h3>처리 단위</h3>
 * <ul>
 *   <li>상태 변경 한 건 = 트랜잭션 하나 (TransactionTemplate, 모든 종료 경로에서 커넥션 반환)</li>
 *   <li>RESERVE: 조건부 차감 → 조건부 상태 변경. 상태 변경이 0건이면 트랜잭션 전체 롤백</li>
 *   <li>RELEASE: 조건부 상태 변경 → 복구. 상태 가드를 먼저 통과한 요청만 복구하므로 중복 복구 없음</li>
 * </ul>
 *
 * <p>내부 재시도는 하지 않는다. 재시도 판단은 호출자 몫이다.
 * 이 클래스는 알림을 보내지 않는다. 호출자가 성공 결과를 받은 뒤 보낸다.</p>
 */
@Service
@Slf4j
public class AvailabilityManager {

    private static final int TRANSACTION_TIMEOUT_SECONDS = 30;

    private final BookingStore bookingStore;
    private final SlotStore slotStore;
    private final SlotRepository slotRepository;
    private final TransactionTemplate transactionTemplate;

    @Value("${teesheet.closed-days:WEDNESDAY,SATURDAY,SUNDAY}")
    private Set<DayOfWeek> closedDays = EnumSet.noneOf(DayOfWeek.class);

    public AvailabilityManager(BookingStore bookingStore,
                               SlotStore slotStore,
                               SlotRepository slotRepository,
                               PlatformTransactionManager transactionManager) {
        this.bookingStore = bookingStore;
        this.slotStore = slotStore;
        this.slotRepository = slotRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(TRANSACTION_TIMEOUT_SECONDS);
    }

    // ========================================
    // 상태 변경 (유일한 쓰기 경로)
    // ========================================

    /**
     * 예약 상태 변경
     *
     * @param bookingId    예약 ID
     * @param targetStatus 대상 상태
     * @param actor        변경한 사람 (직원 이메일, "guest", "system" 등)
     * @return 결과 (실패도 결과로 반환)
     */
    public StatusChangeResult changeStatus(String bookingId, BookingStatus targetStatus, String actor) {
        if (targetStatus == null) {
            return StatusChangeResult.failed(bookingId, null, null,
                    ErrorCode.INVALID_STATUS_TRANSITION, "대상 상태가 비어 있습니다");
        }
        try {
            StatusChangeResult result = transactionTemplate.execute(
                    tx -> applyTransition(bookingId, targetStatus, actor, tx));
            logResult(result, actor);
            return result;
        } catch (ConcurrencyFailureException e) {
            // 행 잠금 대기 초과, 데드락 희생 등 - 경쟁에서 진 것으로 본다
            log.warn("상태 변경 동시성 충돌: bookingId={}, target={}, cause={}",
                    bookingId, targetStatus, e.getMessage());
            return StatusChangeResult.failed(bookingId, null, targetStatus,
                    ErrorCode.BOOKING_STATUS_CONFLICT, "저장소 잠금 충돌");
        }
    }

    /**
     * 직원 확정 (RESERVE)
     */
    public StatusChangeResult confirm(String bookingId, String actor) {
        return changeStatus(bookingId, BookingStatus.CONFIRMED, actor);
    }

    /**
     * 확정 되돌리기 (기본: Requested)
     */
    public StatusChangeResult release(String bookingId, String actor) {
        return release(bookingId, actor, BookingStatus.REQUESTED);
    }

    /**
     * 점유 해제 후 비점유 상태로 변경 (Requested 또는 Cancelled)
     */
    public StatusChangeResult release(String bookingId, String actor, BookingStatus targetStatus) {
        if (TransitionPolicy.isReserving(targetStatus)) {
            return StatusChangeResult.failed(bookingId, null, targetStatus,
                    ErrorCode.INVALID_STATUS_TRANSITION, "해제 대상 상태는 비점유 상태여야 합니다: " + targetStatus.getLabel());
        }
        return changeStatus(bookingId, targetStatus, actor);
    }

    private StatusChangeResult applyTransition(String bookingId, BookingStatus target, String actor,
                                               TransactionStatus tx) {
        Optional<Booking> found = bookingStore.get(bookingId);
        if (found.isEmpty()) {
            return StatusChangeResult.failed(bookingId, null, target, ErrorCode.BOOKING_NOT_FOUND, null);
        }

        Booking booking = found.get();
        BookingStatus current = booking.getStatus();

        if (!TransitionPolicy.canTransition(current, target)) {
            return StatusChangeResult.failed(bookingId, current, target, ErrorCode.INVALID_STATUS_TRANSITION,
                    current.getLabel() + " → " + target.getLabel());
        }

        SlotEffect effect = TransitionPolicy.slotEffect(current, target);
        return switch (effect) {
            case NONE -> applyStatusOnly(booking, target, actor);
            case RESERVE -> reserveAndApply(booking, target, actor, tx);
            case RELEASE -> releaseAndApply(booking, target, actor);
        };
    }

    private StatusChangeResult applyStatusOnly(Booking booking, BookingStatus target, String actor) {
        BookingStatus current = booking.getStatus();
        if (!bookingStore.setStatus(booking.getBookingId(), target, EnumSet.of(current), actor)) {
            return conflict(booking, target);
        }
        return StatusChangeResult.applied(booking.getBookingId(), current, target, SlotEffect.NONE, null);
    }

    private StatusChangeResult reserveAndApply(Booking booking, BookingStatus target, String actor,
                                               TransactionStatus tx) {
        BookingStatus current = booking.getStatus();
        Optional<SlotKey> slotKey = booking.getSlotKey();
        if (slotKey.isEmpty()) {
            return StatusChangeResult.failed(booking.getBookingId(), current, target,
                    ErrorCode.MISSING_SLOT_ASSIGNMENT, "date=" + booking.getDate() + ", time=" + booking.getTime());
        }

        SlotKey key = slotKey.get();
        int players = booking.getPlayers();

        // 1. 조건부 차감 (잔여 >= players 일 때만)
        ReserveOutcome outcome = slotStore.tryReserve(key, players);
        if (outcome == ReserveOutcome.SLOT_NOT_FOUND) {
            return StatusChangeResult.failed(booking.getBookingId(), current, target,
                    ErrorCode.SLOT_NOT_FOUND, key.toString());
        }
        if (outcome == ReserveOutcome.INSUFFICIENT_CAPACITY) {
            int available = slotStore.getCapacity(key).map(SlotAvailability::availableCapacity).orElse(0);
            return StatusChangeResult.failed(booking.getBookingId(), current, target,
                    ErrorCode.INSUFFICIENT_CAPACITY, "잔여 " + available + "명, 요청 " + players + "명");
        }

        // 2. 조건부 상태 변경 (상태 + 차감한 티타임) - 실패하면 1의 차감까지 롤백
        if (!bookingStore.setStatusOnSlot(booking.getBookingId(), target, EnumSet.of(current), key, actor)) {
            tx.setRollbackOnly();
            return conflict(booking, target);
        }

        Integer available = slotStore.getCapacity(key).map(SlotAvailability::availableCapacity).orElse(null);
        return StatusChangeResult.applied(booking.getBookingId(), current, target, SlotEffect.RESERVE, available);
    }

    private StatusChangeResult releaseAndApply(Booking booking, BookingStatus target, String actor) {
        BookingStatus current = booking.getStatus();

        // 1. 조건부 상태 변경 - 중복 해제 요청은 여기서 걸러진다
        if (!bookingStore.setStatus(booking.getBookingId(), target, EnumSet.of(current), actor)) {
            return conflict(booking, target);
        }

        // 2. 복구 - 슬롯 레코드가 없어도 상태 변경은 유지한다
        Optional<SlotKey> slotKey = booking.getSlotKey();
        if (slotKey.isEmpty()) {
            log.warn("점유 중인 예약에 슬롯 키가 없음 - 상태만 변경: bookingId={}", booking.getBookingId());
            return StatusChangeResult.appliedWithWarning(booking.getBookingId(), current, target,
                    SlotEffect.RELEASE, "예약에 날짜/시간이 없어 잔여 인원을 복구하지 못했습니다");
        }

        SlotKey key = slotKey.get();
        Optional<Integer> available = slotStore.release(key, booking.getPlayers());
        if (available.isEmpty()) {
            log.warn("슬롯 레코드 없음 - 상태만 변경: bookingId={}, slot={}", booking.getBookingId(), key);
            return StatusChangeResult.appliedWithWarning(booking.getBookingId(), current, target,
                    SlotEffect.RELEASE, "티타임 슬롯 레코드가 없어 잔여 인원을 복구하지 못했습니다: " + key);
        }

        return StatusChangeResult.applied(booking.getBookingId(), current, target, SlotEffect.RELEASE,
                available.get());
    }

    private StatusChangeResult conflict(Booking booking, BookingStatus target) {
        return StatusChangeResult.failed(booking.getBookingId(), booking.getStatus(), target,
                ErrorCode.BOOKING_STATUS_CONFLICT, "조회 시점 상태: " + booking.getStatus().getLabel());
    }

    private void logResult(StatusChangeResult result, String actor) {
        if (result == null) {
            return;
        }
        if (!result.success()) {
            log.warn("예약 상태 변경 거부: bookingId={}, {} → {}, code={}, detail={}",
                    result.bookingId(), result.previousStatus(), result.requestedStatus(),
                    result.errorCode(), result.detail());
        } else if (result.hasWarning()) {
            log.warn("예약 상태 변경 (경고): bookingId={}, {} → {}, actor={}, warning={}",
                    result.bookingId(), result.previousStatus(), result.requestedStatus(), actor, result.warning());
        } else {
            log.info("예약 상태 변경: bookingId={}, {} → {}, effect={}, available={}, actor={}",
                    result.bookingId(), result.previousStatus(), result.requestedStatus(),
                    result.slotEffect(), result.availableCapacity(), actor);
        }
    }

    // ========================================
    // 조회 (부작용 없음)
    // ========================================

    /**
     * 슬롯 잔여 인원 스냅샷
     */
    @Transactional(readOnly = true)
    public SlotAvailability getAvailability(String resourceId, LocalDate date, LocalTime time) {
        SlotKey key = new SlotKey(resourceId, date, time);
        return slotStore.getCapacity(key)
                .orElseThrow(() -> new BusinessException(ErrorCode.SLOT_NOT_FOUND, key.toString()));
    }

    /**
     * 기간별 일자 리포트 (슬롯이 없는 날짜는 포함하지 않음)
     */
    @Transactional(readOnly = true)
    public List<DailyAvailability> getAvailabilityReport(String resourceId, LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "from(" + from + ")이 to(" + to + ")보다 늦습니다");
        }
        return slotRepository.summarizeByDate(resourceId, from, to).stream()
                .map(DailyAvailability::from)
                .toList();
    }

    /**
     * 특정 날짜에 minPlayers 명 이상 받을 수 있는 티타임
     */
    @Transactional(readOnly = true)
    public List<SlotAvailability> getAvailableTimes(String resourceId, LocalDate date, int minPlayers) {
        return slotRepository.findBookable(resourceId, date, Math.max(minPlayers, 1)).stream()
                .map(SlotAvailability::from)
                .toList();
    }

    /**
     * 문의 응답용 - 요청한 날짜들 중 휴무 요일을 빼고 players 명을 받을 수 있는 티타임
     */
    @Transactional(readOnly = true)
    public List<SlotAvailability> findOpenSlots(String resourceId, Collection<LocalDate> dates, int players) {
        List<LocalDate> openDates = dates.stream()
                .filter(date -> !closedDays.contains(date.getDayOfWeek()))
                .distinct()
                .toList();

        if (openDates.isEmpty()) {
            log.info("문의 날짜가 모두 휴무일: resourceId={}, dates={}", resourceId, dates);
            return List.of();
        }

        return slotRepository.findBookableOnDates(resourceId, openDates, Math.max(players, 1)).stream()
                .map(SlotAvailability::from)
                .toList();
    }

    /**
     * 확정 가능 여부 사전 점검 (실제 점유 없음)
     * <p>
     * 결과는 조회 시점 기준이다. 실제 확정은 {@link #confirm}의 조건부 차감이 최종 판단한다.
     */
    @Transactional(readOnly = true)
    public ConfirmCheck canConfirm(String bookingId) {
        Booking booking = bookingStore.get(bookingId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BOOKING_NOT_FOUND, bookingId));

        BookingStatus current = booking.getStatus();
        if (!TransitionPolicy.canTransition(current, BookingStatus.CONFIRMED)) {
            return ConfirmCheck.rejected(ErrorCode.INVALID_STATUS_TRANSITION,
                    "현재 상태(" + current.getLabel() + ")에서는 확정할 수 없습니다", null);
        }

        Optional<SlotKey> slotKey = booking.getSlotKey();
        if (slotKey.isEmpty()) {
            return ConfirmCheck.rejected(ErrorCode.MISSING_SLOT_ASSIGNMENT, "예약에 날짜/시간이 없습니다", null);
        }

        Optional<SlotAvailability> availability = slotStore.getCapacity(slotKey.get());
        if (availability.isEmpty()) {
            return ConfirmCheck.rejected(ErrorCode.SLOT_NOT_FOUND, "티타임 슬롯이 등록되어 있지 않습니다", null);
        }

        SlotAvailability slot = availability.get();
        if (!slot.canAccommodate(booking.getPlayers())) {
            return ConfirmCheck.rejected(ErrorCode.INSUFFICIENT_CAPACITY,
                    "잔여 " + slot.availableCapacity() + "명, 요청 " + booking.getPlayers() + "명", slot);
        }
        return ConfirmCheck.ok(slot);
    }
}
