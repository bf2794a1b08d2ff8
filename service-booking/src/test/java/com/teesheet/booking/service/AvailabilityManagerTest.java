package com.teesheet.booking.service;

import com.teesheet.booking.dto.ConfirmCheck;
import com.teesheet.booking.dto.DailyAvailability;
import com.teesheet.booking.dto.SlotAvailability;
import com.teesheet.booking.dto.StatusChangeResult;
import com.teesheet.booking.entity.Booking;
import com.teesheet.booking.entity.BookingStatus;
import com.teesheet.booking.entity.Slot;
import com.teesheet.booking.policy.SlotEffect;
import com.teesheet.booking.repository.BookingRepository;
import com.teesheet.booking.repository.SlotRepository;
import com.teesheet.booking.store.BookingStore;
import com.teesheet.booking.store.SlotStore;
import com.teesheet.common.exception.BusinessException;
import com.teesheet.common.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({AvailabilityManager.class, SlotStore.class, BookingStore.class})
class AvailabilityManagerTest {

    private static final String R1 = "royalportrush";
    private static final LocalDate MONDAY = LocalDate.of(2025, 11, 24);
    private static final LocalDate WEDNESDAY = LocalDate.of(2025, 11, 26);
    private static final LocalTime TEN = LocalTime.of(10, 0);

    @Autowired
    private AvailabilityManager availabilityManager;

    @Autowired
    private SlotRepository slotRepository;

    @Autowired
    private BookingRepository bookingRepository;

    @BeforeEach
    void setUp() {
        slot(MONDAY, TEN, 4);
    }

    private void slot(LocalDate date, LocalTime time, int max) {
        slotRepository.save(Slot.builder()
                .resourceId(R1)
                .date(date)
                .time(time)
                .maxCapacity(max)
                .build());
    }

    private void booking(String id, BookingStatus status, LocalTime time, int players) {
        bookingRepository.save(Booking.builder()
                .bookingId(id)
                .resourceId(R1)
                .date(MONDAY)
                .time(time)
                .players(players)
                .status(status)
                .build());
    }

    private SlotAvailability slotAt(LocalTime time) {
        return availabilityManager.getAvailability(R1, MONDAY, time);
    }

    private BookingStatus statusOf(String bookingId) {
        return bookingRepository.findByBookingId(bookingId).orElseThrow().getStatus();
    }

    @Nested
    @DisplayName("확정 (RESERVE)")
    class Confirm {

        @Test
        @DisplayName("4인 예약 확정 시 잔여 0, 예약 불가가 된다")
        void confirm_fillsSlot() {
            booking("B1", BookingStatus.REQUESTED, TEN, 4);

            StatusChangeResult result = availabilityManager.confirm("B1", "staff@club");

            assertThat(result.success()).isTrue();
            assertThat(result.slotEffect()).isEqualTo(SlotEffect.RESERVE);
            assertThat(result.availableCapacity()).isZero();
            assertThat(slotAt(TEN).availableCapacity()).isZero();
            assertThat(slotAt(TEN).bookable()).isFalse();
            assertThat(statusOf("B1")).isEqualTo(BookingStatus.CONFIRMED);
        }

        @Test
        @DisplayName("재확정은 INVALID_STATUS_TRANSITION, 잔여 인원은 그대로")
        void reconfirm_rejected() {
            booking("B1", BookingStatus.REQUESTED, TEN, 2);
            availabilityManager.confirm("B1", "staff@club");

            StatusChangeResult again = availabilityManager.confirm("B1", "staff@club");

            assertThat(again.failedWith(ErrorCode.INVALID_STATUS_TRANSITION)).isTrue();
            assertThat(again.previousStatus()).isEqualTo(BookingStatus.CONFIRMED);
            assertThat(slotAt(TEN).availableCapacity()).isEqualTo(2);
        }

        @Test
        @DisplayName("잔여 부족이면 INSUFFICIENT_CAPACITY, 상태와 잔여 인원 모두 그대로")
        void confirm_insufficient() {
            booking("B1", BookingStatus.REQUESTED, TEN, 3);
            booking("B2", BookingStatus.REQUESTED, TEN, 3);
            availabilityManager.confirm("B1", "staff@club");

            StatusChangeResult result = availabilityManager.confirm("B2", "staff@club");

            assertThat(result.failedWith(ErrorCode.INSUFFICIENT_CAPACITY)).isTrue();
            assertThat(result.detail()).contains("잔여 1명");
            assertThat(statusOf("B2")).isEqualTo(BookingStatus.REQUESTED);
            assertThat(slotAt(TEN).availableCapacity()).isEqualTo(1);
        }

        @Test
        @DisplayName("티타임이 지정되지 않은 예약은 MISSING_SLOT_ASSIGNMENT")
        void confirm_missingSlotAssignment() {
            booking("B1", BookingStatus.INQUIRY, null, 2);

            StatusChangeResult result = availabilityManager.confirm("B1", "staff@club");

            assertThat(result.failedWith(ErrorCode.MISSING_SLOT_ASSIGNMENT)).isTrue();
            assertThat(statusOf("B1")).isEqualTo(BookingStatus.INQUIRY);
        }

        @Test
        @DisplayName("슬롯 레코드가 없으면 SLOT_NOT_FOUND")
        void confirm_slotNotFound() {
            booking("B1", BookingStatus.REQUESTED, LocalTime.of(7, 30), 2);

            StatusChangeResult result = availabilityManager.confirm("B1", "staff@club");

            assertThat(result.failedWith(ErrorCode.SLOT_NOT_FOUND)).isTrue();
            assertThat(statusOf("B1")).isEqualTo(BookingStatus.REQUESTED);
        }

        @Test
        @DisplayName("없는 예약은 BOOKING_NOT_FOUND")
        void confirm_bookingNotFound() {
            StatusChangeResult result = availabilityManager.confirm("NOPE", "staff@club");

            assertThat(result.failedWith(ErrorCode.BOOKING_NOT_FOUND)).isTrue();
            assertThat(result.previousStatus()).isNull();
        }
    }

    @Nested
    @DisplayName("해제 (RELEASE)")
    class Release {

        @Test
        @DisplayName("확정 후 취소하면 잔여 인원이 원래대로 돌아온다")
        void confirmThenCancel_roundTrip() {
            booking("B1", BookingStatus.REQUESTED, TEN, 4);
            availabilityManager.confirm("B1", "staff@club");

            StatusChangeResult result = availabilityManager.release("B1", "staff@club", BookingStatus.CANCELLED);

            assertThat(result.success()).isTrue();
            assertThat(result.slotEffect()).isEqualTo(SlotEffect.RELEASE);
            assertThat(result.availableCapacity()).isEqualTo(4);
            assertThat(slotAt(TEN).bookable()).isTrue();
            assertThat(statusOf("B1")).isEqualTo(BookingStatus.CANCELLED);
        }

        @Test
        @DisplayName("기본 해제 대상은 Requested")
        void release_defaultsToRequested() {
            booking("B1", BookingStatus.REQUESTED, TEN, 2);
            availabilityManager.confirm("B1", "staff@club");

            StatusChangeResult result = availabilityManager.release("B1", "staff@club");

            assertThat(result.success()).isTrue();
            assertThat(statusOf("B1")).isEqualTo(BookingStatus.REQUESTED);
            assertThat(slotAt(TEN).availableCapacity()).isEqualTo(4);
        }

        @Test
        @DisplayName("복구는 최대 인원을 넘지 않는다")
        void release_clamped() {
            // 잔여 = 최대인 상태에서 확정 예약이 존재 (정합성이 깨진 상태)
            booking("B1", BookingStatus.CONFIRMED, TEN, 3);

            StatusChangeResult result = availabilityManager.release("B1", "staff@club", BookingStatus.CANCELLED);

            assertThat(result.success()).isTrue();
            assertThat(slotAt(TEN).availableCapacity()).isEqualTo(4);
        }

        @Test
        @DisplayName("이미 해제된 예약을 다시 해제하면 거부되고 잔여 인원은 두 번 늘지 않는다")
        void doubleRelease() {
            booking("B1", BookingStatus.REQUESTED, TEN, 2);
            booking("B2", BookingStatus.REQUESTED, TEN, 2);
            availabilityManager.confirm("B1", "staff@club");
            availabilityManager.confirm("B2", "staff@club");

            availabilityManager.release("B1", "staff@club", BookingStatus.CANCELLED);
            StatusChangeResult again = availabilityManager.release("B1", "staff@club", BookingStatus.CANCELLED);

            assertThat(again.failedWith(ErrorCode.INVALID_STATUS_TRANSITION)).isTrue();
            assertThat(slotAt(TEN).availableCapacity()).isEqualTo(2);
        }

        @Test
        @DisplayName("슬롯 레코드가 사라졌어도 상태는 바뀌고 경고가 남는다")
        void release_slotMissing_warning() {
            booking("B1", BookingStatus.CONFIRMED, LocalTime.of(7, 30), 2);

            StatusChangeResult result = availabilityManager.release("B1", "staff@club", BookingStatus.CANCELLED);

            assertThat(result.success()).isTrue();
            assertThat(result.hasWarning()).isTrue();
            assertThat(result.availableCapacity()).isNull();
            assertThat(statusOf("B1")).isEqualTo(BookingStatus.CANCELLED);
        }

        @Test
        @DisplayName("점유 상태를 해제 대상으로 지정할 수 없다")
        void release_toReservingTarget() {
            booking("B1", BookingStatus.CONFIRMED, TEN, 2);

            StatusChangeResult result = availabilityManager.release("B1", "staff@club", BookingStatus.BOOKED);

            assertThat(result.failedWith(ErrorCode.INVALID_STATUS_TRANSITION)).isTrue();
            assertThat(statusOf("B1")).isEqualTo(BookingStatus.CONFIRMED);
        }

        @Test
        @DisplayName("대상 상태 없이 요청하면 전이 오류로 거절")
        void missingTargetStatus() {
            booking("B1", BookingStatus.CONFIRMED, TEN, 2);

            StatusChangeResult released = availabilityManager.release("B1", "staff@club", null);
            StatusChangeResult changed = availabilityManager.changeStatus("B1", null, "staff@club");

            assertThat(released.failedWith(ErrorCode.INVALID_STATUS_TRANSITION)).isTrue();
            assertThat(changed.failedWith(ErrorCode.INVALID_STATUS_TRANSITION)).isTrue();
            assertThat(statusOf("B1")).isEqualTo(BookingStatus.CONFIRMED);
        }
    }

    @Nested
    @DisplayName("슬롯 영향 없는 전이")
    class NoEffect {

        @Test
        @DisplayName("Inquiry → Rejected는 슬롯을 건드리지 않는다")
        void inquiryToRejected() {
            booking("B1", BookingStatus.INQUIRY, TEN, 4);

            StatusChangeResult result = availabilityManager.changeStatus("B1", BookingStatus.REJECTED, "staff@club");

            assertThat(result.success()).isTrue();
            assertThat(result.slotEffect()).isEqualTo(SlotEffect.NONE);
            assertThat(result.availableCapacity()).isNull();
            assertThat(slotAt(TEN).availableCapacity()).isEqualTo(4);
        }

        @Test
        @DisplayName("Confirmed → Booked는 점유를 유지한다")
        void confirmedToBooked() {
            booking("B1", BookingStatus.REQUESTED, TEN, 3);
            availabilityManager.confirm("B1", "staff@club");

            StatusChangeResult result = availabilityManager.changeStatus("B1", BookingStatus.BOOKED, "payment");

            assertThat(result.success()).isTrue();
            assertThat(slotAt(TEN).availableCapacity()).isEqualTo(1);
            assertThat(statusOf("B1")).isEqualTo(BookingStatus.BOOKED);
        }
    }

    @Nested
    @DisplayName("조회")
    class Queries {

        @Test
        @DisplayName("확정 가능 여부 점검은 잔여 인원을 바꾸지 않는다")
        void canConfirm() {
            booking("B1", BookingStatus.REQUESTED, TEN, 4);
            booking("B2", BookingStatus.REQUESTED, TEN, 5);

            ConfirmCheck ok = availabilityManager.canConfirm("B1");
            ConfirmCheck tooMany = availabilityManager.canConfirm("B2");

            assertThat(ok.confirmable()).isTrue();
            assertThat(tooMany.confirmable()).isFalse();
            assertThat(tooMany.errorCode()).isEqualTo(ErrorCode.INSUFFICIENT_CAPACITY);
            assertThat(slotAt(TEN).availableCapacity()).isEqualTo(4);
        }

        @Test
        @DisplayName("없는 슬롯 조회는 SLOT_NOT_FOUND 예외")
        void getAvailability_missing() {
            assertThatThrownBy(() -> availabilityManager.getAvailability(R1, MONDAY, LocalTime.of(6, 0)))
                    .isInstanceOfSatisfying(BusinessException.class,
                            e -> assertThat(e.is(ErrorCode.SLOT_NOT_FOUND)).isTrue());
        }

        @Test
        @DisplayName("minPlayers 이상 받을 수 있는 티타임만 조회")
        void availableTimes() {
            slot(MONDAY, LocalTime.of(10, 10), 2);

            List<SlotAvailability> forThree = availabilityManager.getAvailableTimes(R1, MONDAY, 3);
            List<SlotAvailability> forTwo = availabilityManager.getAvailableTimes(R1, MONDAY, 2);

            assertThat(forThree).extracting(SlotAvailability::time).containsExactly(TEN);
            assertThat(forTwo).extracting(SlotAvailability::time).containsExactly(TEN, LocalTime.of(10, 10));
        }

        @Test
        @DisplayName("휴무 요일은 문의 응답 검색에서 제외")
        void findOpenSlots_skipsClosedDays() {
            slot(WEDNESDAY, TEN, 4);

            List<SlotAvailability> slots = availabilityManager.findOpenSlots(R1, List.of(MONDAY, WEDNESDAY), 2);
            List<SlotAvailability> closedOnly = availabilityManager.findOpenSlots(R1, List.of(WEDNESDAY), 2);

            assertThat(slots).extracting(SlotAvailability::date).containsExactly(MONDAY);
            assertThat(closedOnly).isEmpty();
        }

        @Test
        @DisplayName("일자 리포트: 이용률은 소수 첫째 자리까지")
        void report() {
            slot(MONDAY, LocalTime.of(10, 10), 2);
            booking("B1", BookingStatus.REQUESTED, TEN, 1);
            availabilityManager.confirm("B1", "staff@club");

            List<DailyAvailability> report = availabilityManager.getAvailabilityReport(R1, MONDAY, MONDAY.plusDays(6));

            assertThat(report).hasSize(1);
            DailyAvailability day = report.get(0);
            assertThat(day.slotCount()).isEqualTo(2);
            assertThat(day.totalCapacity()).isEqualTo(6);
            assertThat(day.totalBooked()).isEqualTo(1);
            assertThat(day.utilizationPct()).isEqualTo(16.7);
        }

        @Test
        @DisplayName("기간이 뒤집히면 INVALID_INPUT")
        void report_invalidRange() {
            assertThatThrownBy(() -> availabilityManager.getAvailabilityReport(R1, MONDAY, MONDAY.minusDays(1)))
                    .isInstanceOf(BusinessException.class);
        }
    }
}
