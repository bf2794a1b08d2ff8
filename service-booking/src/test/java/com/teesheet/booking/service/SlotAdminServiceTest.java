package com.teesheet.booking.service;

import com.teesheet.booking.entity.Slot;
import com.teesheet.booking.entity.SlotKey;
import com.teesheet.booking.repository.SlotRepository;
import com.teesheet.booking.store.SlotStore;
import com.teesheet.common.exception.BusinessException;
import com.teesheet.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({SlotAdminService.class, SlotStore.class})
class SlotAdminServiceTest {

    private static final String R1 = "royalportrush";
    private static final LocalDate MONDAY = LocalDate.of(2025, 11, 24);
    private static final LocalDate SUNDAY = LocalDate.of(2025, 11, 30);
    private static final LocalTime TEN = LocalTime.of(10, 0);

    @Autowired
    private SlotAdminService slotAdminService;

    @Autowired
    private SlotStore slotStore;

    @Autowired
    private SlotRepository slotRepository;

    @Test
    @DisplayName("최대 인원을 생략하면 기본값(4)으로 등록")
    void registerSlot_defaultCapacity() {
        Slot slot = slotAdminService.registerSlot(R1, MONDAY, TEN, null, new BigDecimal("295.00"));

        assertThat(slot.getMaxCapacity()).isEqualTo(4);
        assertThat(slot.getAvailableCapacity()).isEqualTo(4);
        assertThat(slot.getGreenFee()).isEqualByComparingTo("295");
    }

    @Test
    @DisplayName("최대 인원 변경 시 점유 인원은 유지된다")
    void registerSlot_keepsHeldCapacity() {
        slotAdminService.registerSlot(R1, MONDAY, TEN, 4, null);
        slotStore.tryReserve(new SlotKey(R1, MONDAY, TEN), 3);

        Slot grown = slotAdminService.registerSlot(R1, MONDAY, TEN, 6, null);
        assertThat(grown.getAvailableCapacity()).isEqualTo(3);

        Slot shrunk = slotAdminService.registerSlot(R1, MONDAY, TEN, 2, null);
        assertThat(shrunk.getAvailableCapacity()).isZero();
        assertThat(shrunk.getBookable()).isFalse();
    }

    @Test
    @DisplayName("기간 일괄 등록은 휴무 요일과 기존 슬롯을 건너뛴다")
    void registerSlots_skipsClosedDaysAndExisting() {
        List<LocalTime> times = List.of(TEN, LocalTime.of(10, 10));

        int added = slotAdminService.registerSlots(R1, MONDAY, SUNDAY, times, null, null);
        int again = slotAdminService.registerSlots(R1, MONDAY, SUNDAY, times, null, null);

        // 월, 화, 목, 금 x 2
        assertThat(added).isEqualTo(8);
        assertThat(again).isZero();
        assertThat(slotAdminService.listSlots(R1, MONDAY, SUNDAY))
                .extracting(slot -> slot.getDate().getDayOfWeek())
                .doesNotContain(DayOfWeek.WEDNESDAY, DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);
    }

    @Test
    @DisplayName("잘못된 입력은 INVALID_INPUT")
    void registerSlots_invalidInput() {
        assertThatThrownBy(() -> slotAdminService.registerSlots(R1, SUNDAY, MONDAY, List.of(TEN), 4, null))
                .isInstanceOfSatisfying(BusinessException.class,
                        e -> assertThat(e.is(ErrorCode.INVALID_INPUT)).isTrue());
        assertThatThrownBy(() -> slotAdminService.registerSlots(R1, MONDAY, SUNDAY, List.of(), 4, null))
                .isInstanceOf(BusinessException.class);
        assertThatThrownBy(() -> slotAdminService.registerSlot(R1, MONDAY, TEN, 0, null))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("슬롯 삭제")
    void removeSlot() {
        slotAdminService.registerSlot(R1, MONDAY, TEN, 4, null);

        slotAdminService.removeSlot(R1, MONDAY, TEN);

        assertThat(slotRepository.findByKey(R1, MONDAY, TEN)).isEmpty();
        assertThatThrownBy(() -> slotAdminService.removeSlot(R1, MONDAY, TEN))
                .isInstanceOfSatisfying(BusinessException.class,
                        e -> assertThat(e.is(ErrorCode.SLOT_NOT_FOUND)).isTrue());
    }
}
