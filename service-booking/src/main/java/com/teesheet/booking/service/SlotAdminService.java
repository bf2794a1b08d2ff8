package com.teesheet.booking.service;

import com.teesheet.booking.entity.Slot;
import com.teesheet.booking.repository.SlotRepository;
import com.teesheet.common.exception.BusinessException;
import com.teesheet.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 티타임 슬롯 관리 (관리자용)
 *
 * <p>슬롯 생성/삭제/최대 인원 변경만 담당한다. 예약에 따른 잔여 인원 차감/복구는
 * {@link AvailabilityManager}만 한다.</p>
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class SlotAdminService {

    private final SlotRepository slotRepository;

    @Value("${teesheet.default-max-players:4}")
    private int defaultMaxPlayers;

    @Value("${teesheet.closed-days:WEDNESDAY,SATURDAY,SUNDAY}")
    private Set<DayOfWeek> closedDays = EnumSet.noneOf(DayOfWeek.class);

    /**
     * 슬롯 등록
     * <p>
     * 이미 있으면 최대 인원/그린피만 바꾼다. 점유 인원 수는 유지된다.
     *
     * @param maxCapacity null이면 기본 최대 인원
     */
    @Transactional
    public Slot registerSlot(String resourceId, LocalDate date, LocalTime time,
                             Integer maxCapacity, BigDecimal greenFee) {
        int capacity = resolveCapacity(maxCapacity);

        Optional<Slot> existing = slotRepository.findByKey(resourceId, date, time);
        if (existing.isPresent()) {
            Slot slot = existing.get();
            int before = slot.getAvailableCapacity();
            slot.changeMaxCapacity(capacity, greenFee);
            log.info("티타임 최대 인원 변경: slot={}, max={}, available {} → {}",
                    slot.getKey(), capacity, before, slot.getAvailableCapacity());
            return slot;
        }

        Slot slot = slotRepository.save(Slot.builder()
                .resourceId(resourceId)
                .date(date)
                .time(time)
                .maxCapacity(capacity)
                .greenFee(greenFee)
                .build());
        log.info("티타임 등록: slot={}, max={}", slot.getKey(), capacity);
        return slot;
    }

    /**
     * 기간 일괄 등록 (휴무 요일 제외, 이미 있는 슬롯은 건너뜀)
     *
     * @return 새로 만든 슬롯 수
     */
    @Transactional
    public int registerSlots(String resourceId, LocalDate startDate, LocalDate endDate,
                             Collection<LocalTime> times, Integer maxCapacity, BigDecimal greenFee) {
        if (startDate.isAfter(endDate)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "startDate(" + startDate + ")가 endDate(" + endDate + ")보다 늦습니다");
        }
        if (times == null || times.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "times가 비어 있습니다");
        }

        int capacity = resolveCapacity(maxCapacity);
        int added = 0;

        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            if (closedDays.contains(date.getDayOfWeek())) {
                continue;
            }
            for (LocalTime time : times) {
                if (slotRepository.countByKey(resourceId, date, time) > 0) {
                    continue;
                }
                slotRepository.save(Slot.builder()
                        .resourceId(resourceId)
                        .date(date)
                        .time(time)
                        .maxCapacity(capacity)
                        .greenFee(greenFee)
                        .build());
                added++;
            }
        }

        log.info("티타임 일괄 등록 완료: resourceId={}, {} ~ {}, added={}", resourceId, startDate, endDate, added);
        return added;
    }

    /**
     * 슬롯 삭제
     * <p>
     * 점유 중인 인원이 있어도 삭제한다. 해당 예약을 나중에 해제하면 상태만 바뀌고 경고가 남는다.
     */
    @Transactional
    public void removeSlot(String resourceId, LocalDate date, LocalTime time) {
        Slot slot = slotRepository.findByKey(resourceId, date, time)
                .orElseThrow(() -> new BusinessException(ErrorCode.SLOT_NOT_FOUND,
                        resourceId + "/" + date + "/" + time));

        if (slot.getHeldCapacity() > 0) {
            log.warn("점유 인원이 있는 티타임 삭제: slot={}, held={}", slot.getKey(), slot.getHeldCapacity());
        }
        slotRepository.delete(slot);
        log.info("티타임 삭제: slot={}", slot.getKey());
    }

    public List<Slot> listSlots(String resourceId, LocalDate from, LocalDate to) {
        return slotRepository.findByResourceIdAndDateBetweenOrderByDateAscTimeAsc(resourceId, from, to);
    }

    private int resolveCapacity(Integer maxCapacity) {
        int capacity = maxCapacity != null ? maxCapacity : defaultMaxPlayers;
        if (capacity <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "maxCapacity=" + capacity);
        }
        return capacity;
    }
}
