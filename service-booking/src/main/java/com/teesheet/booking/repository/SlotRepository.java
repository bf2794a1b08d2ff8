package com.teesheet.booking.repository;

import com.teesheet.booking.dto.DailyCapacityRow;
import com.teesheet.booking.entity.Slot;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
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
 * 티타임 슬롯 레포지토리
 *
 * <h3>핵심 쿼리</h3>
 * <ul>
 *   <li>{@link #decrementIfAvailable} - 잔여 인원이 충분할 때만 차감하는 단일 조건부 UPDATE</li>
 *   <li>{@link #incrementClamped} - 최대 인원을 넘지 않도록 복구하는 단일 UPDATE</li>
 * </ul>
 *
 * <p>두 쿼리 모두 행 잠금을 잡은 뒤 WHERE 조건을 다시 평가하므로,
 * 동시에 들어온 차감 요청 중 잔여 인원을 넘는 요청은 0건 갱신으로 끝난다.</p>
 */
public interface SlotRepository extends JpaRepository<Slot, Long> {

    @Query("SELECT s FROM Slot s WHERE s.resourceId = :resourceId AND s.date = :date AND s.time = :time")
    Optional<Slot> findByKey(@Param("resourceId") String resourceId,
                             @Param("date") LocalDate date,
                             @Param("time") LocalTime time);

    @Query("SELECT COUNT(s) FROM Slot s WHERE s.resourceId = :resourceId AND s.date = :date AND s.time = :time")
    long countByKey(@Param("resourceId") String resourceId,
                    @Param("date") LocalDate date,
                    @Param("time") LocalTime time);

    /**
     * 잔여 인원 조건부 차감
     *
     * @return 1: 차감 성공, 0: 잔여 부족 또는 슬롯 없음
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Slot s SET " +
            "s.availableCapacity = s.availableCapacity - :count, " +
            "s.bookable = CASE WHEN s.availableCapacity - :count > 0 THEN true ELSE false END, " +
            "s.version = s.version + 1, " +
            "s.updatedAt = :now " +
            "WHERE s.resourceId = :resourceId AND s.date = :date AND s.time = :time " +
            "AND s.availableCapacity >= :count")
    int decrementIfAvailable(@Param("resourceId") String resourceId,
                             @Param("date") LocalDate date,
                             @Param("time") LocalTime time,
                             @Param("count") int count,
                             @Param("now") LocalDateTime now);

    /**
     * 잔여 인원 복구 (최대 인원으로 clamp)
     *
     * @return 1: 복구 성공, 0: 슬롯 없음
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Slot s SET " +
            "s.availableCapacity = CASE WHEN s.availableCapacity + :count > s.maxCapacity " +
            "THEN s.maxCapacity ELSE s.availableCapacity + :count END, " +
            "s.bookable = CASE WHEN s.maxCapacity > 0 THEN true ELSE false END, " +
            "s.version = s.version + 1, " +
            "s.updatedAt = :now " +
            "WHERE s.resourceId = :resourceId AND s.date = :date AND s.time = :time")
    int incrementClamped(@Param("resourceId") String resourceId,
                         @Param("date") LocalDate date,
                         @Param("time") LocalTime time,
                         @Param("count") int count,
                         @Param("now") LocalDateTime now);

    /**
     * 특정 날짜의 예약 가능한 티타임 (minPlayers 이상 수용 가능)
     */
    @Query("SELECT s FROM Slot s WHERE s.resourceId = :resourceId AND s.date = :date " +
            "AND s.bookable = true AND s.availableCapacity >= :minPlayers ORDER BY s.time ASC")
    List<Slot> findBookable(@Param("resourceId") String resourceId,
                            @Param("date") LocalDate date,
                            @Param("minPlayers") int minPlayers);

    /**
     * 여러 날짜에 걸친 예약 가능 티타임 (문의 응답용)
     */
    @Query("SELECT s FROM Slot s WHERE s.resourceId = :resourceId AND s.date IN :dates " +
            "AND s.bookable = true AND s.availableCapacity >= :minPlayers ORDER BY s.date ASC, s.time ASC")
    List<Slot> findBookableOnDates(@Param("resourceId") String resourceId,
                                   @Param("dates") Collection<LocalDate> dates,
                                   @Param("minPlayers") int minPlayers);

    List<Slot> findByResourceIdAndDateBetweenOrderByDateAscTimeAsc(String resourceId, LocalDate from, LocalDate to);

    /**
     * 정합성 복구용 조회 (FOR UPDATE)
     * <p>복구 중에는 같은 날짜 슬롯의 차감/복구가 대기한다.</p>
     */
    @Query("SELECT s FROM Slot s WHERE s.resourceId = :resourceId AND s.date = :date ORDER BY s.time ASC")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    List<Slot> findByDateForUpdate(@Param("resourceId") String resourceId,
                                   @Param("date") LocalDate date);

    /**
     * 날짜별 수용 인원 집계 (리포트용)
     */
    @Query("SELECT new com.teesheet.booking.dto.DailyCapacityRow(" +
            "s.date, COUNT(s), SUM(s.maxCapacity), SUM(s.availableCapacity)) " +
            "FROM Slot s WHERE s.resourceId = :resourceId AND s.date BETWEEN :from AND :to " +
            "GROUP BY s.date ORDER BY s.date ASC")
    List<DailyCapacityRow> summarizeByDate(@Param("resourceId") String resourceId,
                                           @Param("from") LocalDate from,
                                           @Param("to") LocalDate to);
}
