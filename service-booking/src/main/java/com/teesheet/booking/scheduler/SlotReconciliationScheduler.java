package com.teesheet.booking.scheduler;

import com.teesheet.booking.dto.ReconciliationReport;
import com.teesheet.booking.service.SlotReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * 잔여 인원 정합성 복구 스케줄러
 *
 * <p>오늘부터 {@value #DAYS_AHEAD}일 뒤까지 날짜별로 복구한다.
 * 날짜 하나가 실패해도 나머지 날짜는 계속 진행한다.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlotReconciliationScheduler {

    /**
     * 복구 대상 기간 (일)
     */
    static final int DAYS_AHEAD = 14;

    private final SlotReconciliationService reconciliationService;

    @Value("${teesheet.default-resource-id:royalportrush}")
    private String resourceId;

    @Scheduled(cron = "${teesheet.reconciliation.cron:0 30 3 * * *}") // 기본: 매일 새벽 3시 30분
    public void reconcileUpcomingDays() {
        LocalDate today = LocalDate.now();
        int corrected = 0;

        for (int offset = 0; offset <= DAYS_AHEAD; offset++) {
            LocalDate date = today.plusDays(offset);
            try {
                ReconciliationReport report = reconciliationService.reconcile(resourceId, date);
                corrected += report.corrections().size();
            } catch (RuntimeException e) {
                log.error("잔여 인원 복구 실패: resourceId={}, date={}", resourceId, date, e);
            }
        }

        if (corrected > 0) {
            log.warn("잔여 인원 복구 완료: resourceId={}, 보정 슬롯 {}개", resourceId, corrected);
        } else {
            log.info("잔여 인원 복구 완료: resourceId={}, 보정 없음", resourceId);
        }
    }
}
