package com.teesheet.booking.service;

import com.teesheet.booking.dto.StatusChangeResult;
import com.teesheet.booking.entity.Booking;
import com.teesheet.booking.entity.BookingStatus;
import com.teesheet.booking.entity.Slot;
import com.teesheet.booking.repository.BookingRepository;
import com.teesheet.booking.repository.SlotRepository;
import com.teesheet.booking.store.BookingStore;
import com.teesheet.booking.store.SlotStore;
import com.teesheet.common.exception.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doAnswer;

/**
 * 확정 도중 티타임이 재지정되는 경우
 * <p>
 * 재지정은 별도 트랜잭션으로 커밋되어야 하므로 테스트 트랜잭션을 쓰지 않고 직접 정리한다.
 */
@DataJpaTest
@Import({AvailabilityManager.class, SlotStore.class, BookingStore.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class AvailabilityManagerSlotReassignTest {

    private static final String R1 = "royalportrush";
    private static final LocalDate MONDAY = LocalDate.of(2025, 11, 24);
    private static final LocalTime TEN = LocalTime.of(10, 0);
    private static final LocalTime ELEVEN = LocalTime.of(11, 0);

    @Autowired
    private AvailabilityManager availabilityManager;

    @Autowired
    private BookingStore bookingStore;

    @MockitoSpyBean
    private SlotStore slotStore;

    @Autowired
    private SlotRepository slotRepository;

    @Autowired
    private BookingRepository bookingRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @BeforeEach
    void setUp() {
        slot(TEN);
        slot(ELEVEN);
        bookingRepository.save(Booking.builder()
                .bookingId("B1")
                .resourceId(R1)
                .date(MONDAY)
                .time(TEN)
                .players(3)
                .status(BookingStatus.REQUESTED)
                .build());
    }

    @AfterEach
    void tearDown() {
        bookingRepository.deleteAll();
        slotRepository.deleteAll();
    }

    private void slot(LocalTime time) {
        slotRepository.save(Slot.builder()
                .resourceId(R1)
                .date(MONDAY)
                .time(time)
                .maxCapacity(4)
                .build());
    }

    private int available(LocalTime time) {
        return slotRepository.findByKey(R1, MONDAY, time).orElseThrow().getAvailableCapacity();
    }

    @Test
    @DisplayName("차감 직전에 다른 티타임으로 재지정되면 확정 실패, 차감도 롤백")
    void reassignedBeforeStatusUpdate_confirmRejected() {
        // given - 조회 이후, 차감 직전에 게스트가 11:00으로 옮긴다
        TransactionTemplate separate = new TransactionTemplate(transactionManager);
        separate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        doAnswer(invocation -> {
            separate.executeWithoutResult(
                    status -> bookingStore.assignSlot("B1", MONDAY, ELEVEN, "guest"));
            return invocation.callRealMethod();
        }).when(slotStore).tryReserve(any(), anyInt());

        // when
        StatusChangeResult result = availabilityManager.confirm("B1", "staff@club");

        // then
        assertThat(result.failedWith(ErrorCode.BOOKING_STATUS_CONFLICT)).isTrue();

        Booking booking = bookingRepository.findByBookingId("B1").orElseThrow();
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.REQUESTED);
        assertThat(booking.getTime()).isEqualTo(ELEVEN);

        assertThat(available(TEN)).isEqualTo(4);
        assertThat(available(ELEVEN)).isEqualTo(4);
    }
}
