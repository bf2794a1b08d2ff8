package com.teesheet.booking.repository;

import com.teesheet.booking.entity.Booking;
import com.teesheet.booking.entity.BookingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 예약 레포지토리
 *
 * <p>상태 변경은 반드시 {@link #updateStatusIfCurrent} 계열의 조건부 UPDATE로 한다.
 * 같은 이전 상태에서 두 요청이 동시에 전이를 시도하면 한쪽만 1건 갱신된다.</p>
 */
public interface BookingRepository extends JpaRepository<Booking, Long> {

    Optional<Booking> findByBookingId(String bookingId);

    boolean existsByBookingId(String bookingId);

    List<Booking> findByResourceIdOrderByCreatedAtDesc(String resourceId);

    List<Booking> findByResourceIdAndStatusOrderByCreatedAtDesc(String resourceId, BookingStatus status);

    /**
     * 현재 상태가 expected 중 하나일 때만 상태 변경
     *
     * @return 1: 변경됨, 0: 예약 없음 또는 상태가 이미 바뀜
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Booking b SET b.status = :newStatus, b.updatedBy = :actor, b.updatedAt = :now, " +
            "b.version = b.version + 1 " +
            "WHERE b.bookingId = :bookingId AND b.status IN :expected")
    int updateStatusIfCurrent(@Param("bookingId") String bookingId,
                              @Param("newStatus") BookingStatus newStatus,
                              @Param("expected") Collection<BookingStatus> expected,
                              @Param("actor") String actor,
                              @Param("now") LocalDateTime now);

    /**
     * 확정 전이 전용 - 확정 시각을 함께 기록
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Booking b SET b.status = :newStatus, b.updatedBy = :actor, b.updatedAt = :now, " +
            "b.confirmedAt = :now, b.version = b.version + 1 " +
            "WHERE b.bookingId = :bookingId AND b.status IN :expected")
    int updateStatusAndConfirmedAtIfCurrent(@Param("bookingId") String bookingId,
                                            @Param("newStatus") BookingStatus newStatus,
                                            @Param("expected") Collection<BookingStatus> expected,
                                            @Param("actor") String actor,
                                            @Param("now") LocalDateTime now);

    /**
     * 점유 전이 전용 - 상태와 함께 조회 시점의 티타임도 그대로일 때만 확정
     * <p>차감한 슬롯과 예약의 티타임이 어긋나지 않도록, 그 사이 재지정이 있었다면 0건이 된다.</p>
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Booking b SET b.status = :newStatus, b.updatedBy = :actor, b.updatedAt = :now, " +
            "b.confirmedAt = :now, b.version = b.version + 1 " +
            "WHERE b.bookingId = :bookingId AND b.status IN :expected " +
            "AND b.resourceId = :resourceId AND b.date = :date AND b.time = :time")
    int updateStatusAndConfirmedAtIfCurrentOnSlot(@Param("bookingId") String bookingId,
                                                  @Param("newStatus") BookingStatus newStatus,
                                                  @Param("expected") Collection<BookingStatus> expected,
                                                  @Param("resourceId") String resourceId,
                                                  @Param("date") LocalDate date,
                                                  @Param("time") LocalTime time,
                                                  @Param("actor") String actor,
                                                  @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Booking b SET b.status = :newStatus, b.updatedBy = :actor, b.updatedAt = :now, " +
            "b.version = b.version + 1 " +
            "WHERE b.bookingId = :bookingId AND b.status IN :expected " +
            "AND b.resourceId = :resourceId AND b.date = :date AND b.time = :time")
    int updateStatusIfCurrentOnSlot(@Param("bookingId") String bookingId,
                                    @Param("newStatus") BookingStatus newStatus,
                                    @Param("expected") Collection<BookingStatus> expected,
                                    @Param("resourceId") String resourceId,
                                    @Param("date") LocalDate date,
                                    @Param("time") LocalTime time,
                                    @Param("actor") String actor,
                                    @Param("now") LocalDateTime now);

    /**
     * 슬롯 재지정 (점유 중이 아닌 상태에서만)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Booking b SET b.date = :date, b.time = :time, b.updatedBy = :actor, b.updatedAt = :now, " +
            "b.version = b.version + 1 " +
            "WHERE b.bookingId = :bookingId AND b.status IN :allowed")
    int assignSlotIfStatusIn(@Param("bookingId") String bookingId,
                             @Param("date") LocalDate date,
                             @Param("time") LocalTime time,
                             @Param("allowed") Collection<BookingStatus> allowed,
                             @Param("actor") String actor,
                             @Param("now") LocalDateTime now);

    /**
     * 슬롯을 점유 중인 예약의 인원 합계
     */
    @Query("SELECT COALESCE(SUM(b.players), 0L) FROM Booking b " +
            "WHERE b.resourceId = :resourceId AND b.date = :date AND b.time = :time " +
            "AND b.status IN :reserving")
    Long sumPlayersOnSlot(@Param("resourceId") String resourceId,
                          @Param("date") LocalDate date,
                          @Param("time") LocalTime time,
                          @Param("reserving") Collection<BookingStatus> reserving);
}
