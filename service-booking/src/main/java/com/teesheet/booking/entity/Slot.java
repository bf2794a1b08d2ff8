package com.teesheet.booking.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 티타임 슬롯
 * <p>
 * 잔여 인원({@code availableCapacity})은 SlotStore의 조건부 UPDATE로만 바뀐다.
 * 엔티티에는 잔여 인원을 바꾸는 메서드를 두지 않는다 (관리자 등록/정합성 복구 제외).
 * 불변식: {@code 0 <= availableCapacity <= maxCapacity}
 */
@Entity
@Table(name = "tee_times",
        uniqueConstraints = @UniqueConstraint(name = "uk_tee_times_slot",
                columnNames = {"resource_id", "slot_date", "slot_time"}),
        indexes = @Index(name = "idx_tee_times_resource_date", columnList = "resource_id, slot_date"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Slot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_id", nullable = false, length = 100)
    private String resourceId;

    @Column(name = "slot_date", nullable = false)
    private LocalDate date;

    @Column(name = "slot_time", nullable = false)
    private LocalTime time;

    @Column(name = "max_capacity", nullable = false)
    private Integer maxCapacity;

    @Column(name = "available_capacity", nullable = false)
    private Integer availableCapacity;

    /** availableCapacity > 0 캐시 */
    @Column(nullable = false)
    private Boolean bookable;

    @Column(name = "green_fee", precision = 10, scale = 2)
    private BigDecimal greenFee;

    @Column(length = 500)
    private String notes;

    @Version
    private Long version;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
        if (this.version == null) {
            this.version = 0L;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 새 슬롯은 비어 있는 상태(잔여 = 최대)로 생성된다
     */
    @Builder
    public Slot(String resourceId, LocalDate date, LocalTime time, Integer maxCapacity,
                BigDecimal greenFee, String notes) {
        if (maxCapacity == null || maxCapacity < 0) {
            throw new IllegalArgumentException("maxCapacity는 0 이상이어야 합니다: " + maxCapacity);
        }
        this.resourceId = resourceId;
        this.date = date;
        this.time = time;
        this.maxCapacity = maxCapacity;
        this.availableCapacity = maxCapacity;
        this.bookable = maxCapacity > 0;
        this.greenFee = greenFee;
        this.notes = notes;
    }

    public SlotKey getKey() {
        return new SlotKey(resourceId, date, time);
    }

    /**
     * 이미 점유된 인원 수
     */
    public int getHeldCapacity() {
        return maxCapacity - availableCapacity;
    }

    /**
     * 관리자 최대 인원 변경
     * <p>
     * 이미 점유된 인원 수는 유지하고, 잔여 인원을 [0, 새 최대]로 맞춘다.
     * 최대를 점유 인원보다 작게 줄이면 잔여는 0이 된다 (초과 점유분은 정합성 복구 대상).
     */
    public void changeMaxCapacity(int newMaxCapacity, BigDecimal newGreenFee) {
        if (newMaxCapacity < 0) {
            throw new IllegalArgumentException("maxCapacity는 0 이상이어야 합니다: " + newMaxCapacity);
        }
        int held = getHeldCapacity();
        this.maxCapacity = newMaxCapacity;
        this.availableCapacity = clamp(newMaxCapacity - held, newMaxCapacity);
        this.bookable = this.availableCapacity > 0;
        if (newGreenFee != null) {
            this.greenFee = newGreenFee;
        }
    }

    /**
     * 정합성 복구: 점유 중인 예약 인원 합계로 잔여 인원을 다시 계산
     *
     * @return 값이 바뀌었으면 true
     */
    public boolean reconcile(int reservedPlayers) {
        int expected = clamp(maxCapacity - reservedPlayers, maxCapacity);
        boolean changed = expected != availableCapacity || bookable != (expected > 0);
        this.availableCapacity = expected;
        this.bookable = expected > 0;
        return changed;
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }
}
