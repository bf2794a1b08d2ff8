package com.teesheet.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 요청별 traceId를 MDC에 설정하는 필터
 *
 * 동작:
 * 1. X-Request-ID 헤더가 있으면 → 해당 값 사용 (대시보드/메일 봇에서 전파)
 * 2. 없으면 → 새로 생성
 *
 * MDC 키:
 * - traceId: 요청 추적 ID (X-Request-ID 헤더와 매핑)
 * - bookingId: 예약 ID (/api/bookings/{bookingId} 경로 또는 쿼리 파라미터에서 추출)
 */
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String MDC_TRACE_ID = "traceId";
    public static final String MDC_BOOKING_ID = "bookingId";

    private static final Pattern BOOKING_PATH = Pattern.compile("^/api/bookings/([^/]+)");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        try {
            String traceId = request.getHeader(REQUEST_ID_HEADER);
            if (traceId == null || traceId.isBlank()) {
                traceId = generateTraceId();
            }
            MDC.put(MDC_TRACE_ID, traceId);

            String bookingId = resolveBookingId(request);
            if (bookingId != null) {
                MDC.put(MDC_BOOKING_ID, bookingId);
            }

            response.setHeader(REQUEST_ID_HEADER, traceId);

            filterChain.doFilter(request, response);
        } finally {
            // 스레드 재사용 시 이전 요청 값이 섞이지 않도록 반드시 정리
            MDC.clear();
        }
    }

    private String resolveBookingId(HttpServletRequest request) {
        String param = request.getParameter(MDC_BOOKING_ID);
        if (param != null && !param.isBlank()) {
            return param;
        }
        Matcher matcher = BOOKING_PATH.matcher(request.getRequestURI());
        return matcher.find() ? matcher.group(1) : null;
    }

    private String generateTraceId() {
        return "REQ-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
