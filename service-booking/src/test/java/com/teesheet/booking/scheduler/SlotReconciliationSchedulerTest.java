package com.teesheet.booking.scheduler;

import com.teesheet.booking.dto.ReconciliationReport;
import com.teesheet.booking.service.SlotReconciliationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SlotReconciliationSchedulerTest {

    @Mock
    private SlotReconciliationService reconciliationService;

    @InjectMocks
    private SlotReconciliationScheduler scheduler;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(scheduler, "resourceId", "royalportrush");
    }

    @Test
    @DisplayName("한 날짜가 실패해도 나머지 날짜는 계속 복구한다")
    void failureOnOneDate_continues() {
        LocalDate today = LocalDate.now();
        when(reconciliationService.reconcile(eq("royalportrush"), any(LocalDate.class)))
                .thenAnswer(invocation -> new ReconciliationReport("royalportrush", invocation.getArgument(1), 0, List.of()));
        doThrow(new IllegalStateException("lock timeout"))
                .when(reconciliationService).reconcile("royalportrush", today);

        scheduler.reconcileUpcomingDays();

        verify(reconciliationService, times(SlotReconciliationScheduler.DAYS_AHEAD + 1))
                .reconcile(eq("royalportrush"), any(LocalDate.class));
    }
}
