package com.teesheet.booking.controller;

import com.teesheet.booking.dto.DailyAvailability;
import com.teesheet.booking.dto.ReconciliationReport;
import com.teesheet.booking.dto.SlotAvailability;
import com.teesheet.booking.entity.Slot;
import com.teesheet.booking.service.AvailabilityManager;
import com.teesheet.booking.service.SlotAdminService;
import com.teesheet.booking.service.SlotReconciliationService;
import com.teesheet.common.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@RestController
@RequestMapping("/api/tee-times")
@RequiredArgsConstructor
public class TeeTimeController {

    private static final String DEFAULT_RESOURCE = "${teesheet.default-resource-id:royalportrush}";

    private final AvailabilityManager availabilityManager;
    private final SlotAdminService slotAdminService;
    private final SlotReconciliationService reconciliationService;

    @Value(DEFAULT_RESOURCE)
    private String defaultResourceId;

    /**
     * 슬롯 잔여 인원 조회
     */
    @GetMapping("/availability")
    public ApiResponse<SlotAvailability> getAvailability(
            @RequestParam(defaultValue = DEFAULT_RESOURCE) String resourceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam @DateTimeFormat(pattern = "HH:mm") LocalTime time) {
        return ApiResponse.success(availabilityManager.getAvailability(resourceId, date, time));
    }

    /**
     * 특정 날짜의 예약 가능 티타임
     */
    @GetMapping("/available-times")
    public ApiResponse<List<SlotAvailability>> getAvailableTimes(
            @RequestParam(defaultValue = DEFAULT_RESOURCE) String resourceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "1") int minPlayers) {
        return ApiResponse.success(availabilityManager.getAvailableTimes(resourceId, date, minPlayers));
    }

    /**
     * 기간별 가용 현황 리포트
     */
    @GetMapping("/report")
    public ApiResponse<List<DailyAvailability>> getReport(
            @RequestParam(defaultValue = DEFAULT_RESOURCE) String resourceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ApiResponse.success(availabilityManager.getAvailabilityReport(resourceId, from, to));
    }

    /**
     * 문의 응답용 티타임 검색
     */
    @PostMapping("/search")
    public ApiResponse<List<SlotAvailability>> search(@RequestBody SearchRequest request) {
        return ApiResponse.success(availabilityManager.findOpenSlots(
                resolve(request.resourceId()),
                request.dates() != null ? request.dates() : List.of(),
                request.players() != null ? request.players() : 1));
    }

    /**
     * 슬롯 목록 (관리자)
     */
    @GetMapping
    public ApiResponse<List<SlotAvailability>> listSlots(
            @RequestParam(defaultValue = DEFAULT_RESOURCE) String resourceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        List<SlotAvailability> slots = slotAdminService.listSlots(resourceId, from, to).stream()
                .map(SlotAvailability::from)
                .toList();
        return ApiResponse.success(slots);
    }

    /**
     * 슬롯 등록 / 최대 인원 변경 (관리자)
     */
    @PostMapping
    public ApiResponse<SlotAvailability> registerSlot(@RequestBody RegisterSlotRequest request) {
        Slot slot = slotAdminService.registerSlot(
                resolve(request.resourceId()),
                request.date(),
                request.time(),
                request.maxCapacity(),
                request.greenFee());
        return ApiResponse.success(SlotAvailability.from(slot));
    }

    /**
     * 기간 일괄 등록 (관리자)
     */
    @PostMapping("/bulk")
    public ApiResponse<BulkRegisterResponse> registerSlots(@RequestBody BulkRegisterRequest request) {
        int added = slotAdminService.registerSlots(
                resolve(request.resourceId()),
                request.startDate(),
                request.endDate(),
                request.times(),
                request.maxCapacity(),
                request.greenFee());
        return ApiResponse.success(new BulkRegisterResponse(added));
    }

    /**
     * 슬롯 삭제 (관리자)
     */
    @DeleteMapping
    public ApiResponse<Void> removeSlot(
            @RequestParam(defaultValue = DEFAULT_RESOURCE) String resourceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam @DateTimeFormat(pattern = "HH:mm") LocalTime time) {
        slotAdminService.removeSlot(resourceId, date, time);
        return ApiResponse.success();
    }

    /**
     * 잔여 인원 정합성 복구 (관리자, 날짜 단위)
     */
    @PostMapping("/reconcile")
    public ApiResponse<ReconciliationReport> reconcile(
            @RequestParam(defaultValue = DEFAULT_RESOURCE) String resourceId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ApiResponse.success(reconciliationService.reconcile(resourceId, date));
    }

    private String resolve(String resourceId) {
        return resourceId == null || resourceId.isBlank() ? defaultResourceId : resourceId;
    }

    // 요청/응답 DTO
    public record SearchRequest(String resourceId, List<LocalDate> dates, Integer players) {
    }

    public record RegisterSlotRequest(
            String resourceId,
            LocalDate date,
            LocalTime time,
            Integer maxCapacity,
            BigDecimal greenFee
    ) {
    }

    public record BulkRegisterRequest(
            String resourceId,
            LocalDate startDate,
            LocalDate endDate,
            List<LocalTime> times,
            Integer maxCapacity,
            BigDecimal greenFee
    ) {
    }

    public record BulkRegisterResponse(int added) {
    }
}
