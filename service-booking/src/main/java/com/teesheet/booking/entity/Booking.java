package com.teesheet.booking.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;

/**
 * 티타임 예약
 * <p>
 * 상태({@code status})는 BookingStore의 조건부 UPDATE로만 바뀐다.
 * 종료 상태(Cancelled/Rejected)가 되어도 삭제하지 않는다 (이력 보관).
 */
@Entity
@Table(name = "bookings",
        indexes = {
                @Index(name = "idx_bookings_status", columnList = "status"),
                @Index(name = "idx_bookings_slot", columnList = "resource_id, slot_date, slot_time"),
                @Index(name = "idx_bookings_email", columnList = "guest_email")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_id", nullable = false, unique = true, updatable = false, length = 50)
    private String bookingId;

    @Column(name = "resource_id", nullable = false, length = 100)
    private String resourceId;

    @Column(name = "slot_date")
    private LocalDate date;

    /** Inquiry 단계에서는 비어 있을 수 있다 */
    @Column(name = "slot_time")
    private LocalTime time;

    @Column(nullable = false)
    private Integer players;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private BookingStatus status;

    @Column(name = "guest_email", length = 255)
    private String guestEmail;

    @Column(name = "guest_name", length = 255)
    private String guestName;

    @Column(length = 2000)
    private String note;

    @Column(name = "updated_by", length = 255)
    private String updatedBy;

    @Column(name = "confirmed_at")
    private LocalDateTime confirmedAt;

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
        if (this.status == null) {
            this.status = BookingStatus.INQUIRY;
        }
        if (this.version == null) {
            this.version = 0L;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    @Builder
    public Booking(String bookingId, String resourceId, LocalDate date, LocalTime time, Integer players,
                   BookingStatus status, String guestEmail, String guestName, String note) {
        if (players == null || players <= 0) {
            throw new IllegalArgumentException("players는 1 이상이어야 합니다: " + players);
        }
        this.bookingId = bookingId;
        this.resourceId = resourceId;
        this.date = date;
        this.time = time;
        this.players = players;
        this.status = status != null ? status : BookingStatus.INQUIRY;
        this.guestEmail = guestEmail;
        this.guestName = guestName;
        this.note = note;
    }

    /**
     * 날짜와 시각이 모두 지정된 경우에만 슬롯 키를 돌려준다
     */
    public Optional<SlotKey> getSlotKey() {
        if (resourceId == null || date == null || time == null) {
            return Optional.empty();
        }
        return Optional.of(new SlotKey(resourceId, date, time));
    }
}
