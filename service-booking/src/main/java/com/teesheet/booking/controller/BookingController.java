package com.teesheet.booking.controller;

import com.teesheet.booking.dto.ConfirmCheck;
import com.teesheet.booking.dto.StatusChangeResult;
import com.teesheet.booking.entity.Booking;
import com.teesheet.booking.entity.BookingStatus;
import com.teesheet.booking.service.AvailabilityManager;
import com.teesheet.booking.service.BookingIntakeService;
import com.teesheet.common.dto.ApiResponse;
import com.teesheet.common.exception.ErrorCode;
import com.teesheet.common.idempotency.Idempotent;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

@RestController
@RequestMapping("/api/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingIntakeService intakeService;
    private final AvailabilityManager availabilityManager;

    /**
     * 문의 접수 (Inquiry 생성)
     */
    @PostMapping
    public ApiResponse<BookingResponse> createInquiry(@RequestBody InquiryRequest request) {
        Booking booking = intakeService.createInquiry(
                request.resourceId(),
                request.date(),
                request.players() != null ? request.players() : 0,
                request.guestEmail(),
                request.guestName());
        return ApiResponse.success(BookingResponse.from(booking));
    }

    /**
     * 예약 조회
     */
    @GetMapping("/{bookingId}")
    public ApiResponse<BookingResponse> getBooking(@PathVariable String bookingId) {
        return ApiResponse.success(BookingResponse.from(intakeService.getBooking(bookingId)));
    }

    /**
     * 예약 목록 (대시보드)
     */
    @GetMapping
    public ApiResponse<List<BookingResponse>> listBookings(
            @RequestParam(required = false) String resourceId,
            @RequestParam(required = false) String status) {
        BookingStatus filter = status != null ? BookingStatus.from(status) : null;
        List<BookingResponse> responses = intakeService.listBookings(resourceId, filter).stream()
                .map(BookingResponse::from)
                .toList();
        return ApiResponse.success(responses);
    }

    /**
     * 티타임 지정
     * request=true면 게스트 "Book Now"로 보고 Requested까지 전이
     */
    @PutMapping("/{bookingId}/slot")
    public ApiResponse<BookingResponse> assignSlot(
            @PathVariable String bookingId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam @DateTimeFormat(pattern = "HH:mm") LocalTime time,
            @RequestParam(defaultValue = "guest") String actor,
            @RequestParam(defaultValue = "false") boolean request) {
        Booking booking = request
                ? intakeService.requestSlot(bookingId, date, time, actor)
                : intakeService.assignSlot(bookingId, date, time, actor);
        return ApiResponse.success(BookingResponse.from(booking));
    }

    /**
     * 상태 변경 (대시보드 상태 버튼)
     * ★ 멱등성 적용 (선택)
     */
    @PostMapping("/{bookingId}/status")
    @Idempotent(prefix = "booking-status")
    public ResponseEntity<ApiResponse<StatusChangeResponse>> changeStatus(
            @PathVariable String bookingId,
            @RequestParam String status,
            @RequestParam String actor) {
        return toResponse(availabilityManager.changeStatus(bookingId, BookingStatus.from(status), actor));
    }

    /**
     * 직원 확정 (잔여 인원 차감)
     * ★ 멱등성 적용 (선택)
     */
    @PostMapping("/{bookingId}/confirm")
    @Idempotent(prefix = "booking-confirm")
    public ResponseEntity<ApiResponse<StatusChangeResponse>> confirm(
            @PathVariable String bookingId,
            @RequestParam String actor) {
        return toResponse(availabilityManager.confirm(bookingId, actor));
    }

    /**
     * 확정 되돌리기/취소 (잔여 인원 복구)
     * ★ 멱등성 적용 (선택)
     */
    @PostMapping("/{bookingId}/release")
    @Idempotent(prefix = "booking-release")
    public ResponseEntity<ApiResponse<StatusChangeResponse>> release(
            @PathVariable String bookingId,
            @RequestParam String actor,
            @RequestParam(defaultValue = "REQUESTED") String status) {
        return toResponse(availabilityManager.release(bookingId, actor, BookingStatus.from(status)));
    }

    /**
     * 확정 가능 여부 사전 점검
     */
    @GetMapping("/{bookingId}/confirm-check")
    public ApiResponse<ConfirmCheck> confirmCheck(@PathVariable String bookingId) {
        return ApiResponse.success(availabilityManager.canConfirm(bookingId));
    }

    private ResponseEntity<ApiResponse<StatusChangeResponse>> toResponse(StatusChangeResult result) {
        StatusChangeResponse body = StatusChangeResponse.from(result);

        if (result.success()) {
            ApiResponse<StatusChangeResponse> response = result.hasWarning()
                    ? ApiResponse.successWithWarning(body, result.warning())
                    : ApiResponse.success(body);
            return ResponseEntity.ok(response);
        }

        ErrorCode errorCode = result.errorCode();
        return ResponseEntity
                .status(errorCode.getHttpStatus())
                .body(ApiResponse.fail(errorCode.toErrorInfo(result.detail()), body));
    }

    // 요청 DTO
    public record InquiryRequest(
            String resourceId,
            LocalDate date,
            Integer players,
            String guestEmail,
            String guestName
    ) {
    }

    // 응답 DTO
    public record BookingResponse(
            String bookingId,
            String resourceId,
            LocalDate date,
            LocalTime time,
            int players,
            String status,
            String guestEmail,
            String guestName,
            String updatedBy,
            LocalDateTime confirmedAt
    ) {
        public static BookingResponse from(Booking booking) {
            return new BookingResponse(
                    booking.getBookingId(),
                    booking.getResourceId(),
                    booking.getDate(),
                    booking.getTime(),
                    booking.getPlayers(),
                    booking.getStatus().getLabel(),
                    booking.getGuestEmail(),
                    booking.getGuestName(),
                    booking.getUpdatedBy(),
                    booking.getConfirmedAt()
            );
        }
    }

    public record StatusChangeResponse(
            String bookingId,
            String previousStatus,
            String requestedStatus,
            String slotEffect,
            Integer availableCapacity
    ) {
        public static StatusChangeResponse from(StatusChangeResult result) {
            return new StatusChangeResponse(
                    result.bookingId(),
                    result.previousStatus() != null ? result.previousStatus().getLabel() : null,
                    result.requestedStatus() != null ? result.requestedStatus().getLabel() : null,
                    result.slotEffect() != null ? result.slotEffect().name() : null,
                    result.availableCapacity()
            );
        }
    }
}
