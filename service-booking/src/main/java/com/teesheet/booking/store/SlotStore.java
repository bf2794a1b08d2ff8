package com.teesheet.booking.store;

import com.teesheet.booking.dto.SlotAvailability;
import com.teesheet.booking.entity.SlotKey;
import com.teesheet.booking.repository.SlotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 슬롯 잔여 인원 저장소
 *
 * <p>차감/복구는 모두 단일 조건부 UPDATE 한 번으로 끝난다.
 * 트랜잭션 경계는 호출자(AvailabilityManager)가 잡는다.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlotStore {

    private final SlotRepository slotRepository;

    /**
     * 잔여 인원 조회
     */
    public Optional<SlotAvailability> getCapacity(SlotKey key) {
        return slotRepository.findByKey(key.resourceId(), key.date(), key.time())
                .map(SlotAvailability::from);
    }

    /**
     * 잔여 인원이 count 이상일 때만 차감
     * <p>
     * 동시 요청 두 건이 마지막 잔여분을 두고 경쟁하면 한 건만 RESERVED,
     * 다른 건은 행 잠금 해제 후 조건을 다시 평가해 INSUFFICIENT_CAPACITY가 된다.
     */
    public ReserveOutcome tryReserve(SlotKey key, int count) {
        validateCount(count);

        int updated = slotRepository.decrementIfAvailable(
                key.resourceId(), key.date(), key.time(), count, LocalDateTime.now());

        if (updated == 1) {
            log.debug("[SlotStore] 차감: slot={}, count={}", key, count);
            return ReserveOutcome.RESERVED;
        }

        if (slotRepository.countByKey(key.resourceId(), key.date(), key.time()) == 0) {
            return ReserveOutcome.SLOT_NOT_FOUND;
        }
        return ReserveOutcome.INSUFFICIENT_CAPACITY;
    }

    /**
     * 잔여 인원 복구 (최대 인원 초과 금지)
     *
     * @return 복구 후 잔여 인원, 슬롯 레코드가 없으면 empty
     */
    public Optional<Integer> release(SlotKey key, int count) {
        validateCount(count);

        int updated = slotRepository.incrementClamped(
                key.resourceId(), key.date(), key.time(), count, LocalDateTime.now());

        if (updated == 0) {
            return Optional.empty();
        }

        log.debug("[SlotStore] 복구: slot={}, count={}", key, count);
        return getCapacity(key).map(SlotAvailability::availableCapacity);
    }

    private void validateCount(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("인원 수는 1 이상이어야 합니다: " + count);
        }
    }
}
