package com.teesheet.booking.service;

import com.teesheet.booking.dto.ReconciliationReport;
import com.teesheet.booking.entity.Slot;
import com.teesheet.booking.repository.SlotRepository;
import com.teesheet.booking.store.BookingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 잔여 인원 정합성 복구
 *
 * <h3>언제 어긋나나</h3>
 * <ul>
 *   <li>관리자가 최대 인원을 점유 인원보다 작게 줄인 경우</li>
 *   <li>점유 중인 슬롯을 삭제 후 다시 등록한 경우</li>
 *   <li>DB를 직접 수정한 경우</li>
 * </ul>
 *
 * <p>날짜 단위로 슬롯 행을 FOR UPDATE로 잡은 뒤
 * {@code available = clamp(max - Σ 점유 예약 인원)}으로 다시 계산한다.
 * 잠금 중에는 같은 슬롯의 확정/해제가 대기한다.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SlotReconciliationService {

    private final SlotRepository slotRepository;
    private final BookingStore bookingStore;

    @Transactional(timeout = 30)
    public ReconciliationReport reconcile(String resourceId, LocalDate date) {
        List<Slot> slots = slotRepository.findByDateForUpdate(resourceId, date);
        List<ReconciliationReport.Correction> corrections = new ArrayList<>();

        for (Slot slot : slots) {
            long reserved = bookingStore.sumReservedPlayers(slot.getKey());
            int before = slot.getAvailableCapacity();

            if (slot.reconcile((int) Math.min(reserved, Integer.MAX_VALUE))) {
                corrections.add(new ReconciliationReport.Correction(
                        slot.getTime(), slot.getMaxCapacity(), before, slot.getAvailableCapacity(), reserved));
                log.warn("잔여 인원 보정: slot={}, max={}, reserved={}, available {} → {}",
                        slot.getKey(), slot.getMaxCapacity(), reserved, before, slot.getAvailableCapacity());
            }
        }

        return new ReconciliationReport(resourceId, date, slots.size(), corrections);
    }
}
