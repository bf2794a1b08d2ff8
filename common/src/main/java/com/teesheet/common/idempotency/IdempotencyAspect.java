package com.teesheet.common.idempotency;

import com.teesheet.common.dto.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;

/**
 * @Idempotent 어노테이션 처리 AOP
 *
 * <p>대상 메서드는 {@code ResponseEntity}를 반환해야 응답 상태 코드까지 재현된다.
 * 다른 타입을 반환하면 200으로 기록한다.</p>
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class IdempotencyAspect {

    private static final long CONCURRENT_WAIT_MILLIS = 100;

    private final IdempotencyService idempotencyService;

    @Around("@annotation(idempotent)")
    public Object handleIdempotency(ProceedingJoinPoint joinPoint, Idempotent idempotent) throws
            Throwable {
        String idempotencyKey = extractIdempotencyKey(idempotent.headerName());

        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            if (idempotent.required()) {
                log.warn("[Idempotency] 필수 Key 누락 - header: {}", idempotent.headerName());
                return ResponseEntity
                        .status(HttpStatus.BAD_REQUEST)
                        .body(ApiResponse.fail(
                                "IDEMPOTENCY_KEY_REQUIRED",
                                "Idempotency Key is required. Please provide '" + idempotent.headerName() + "' header."
                        ));
            }
            return joinPoint.proceed();
        }

        String cacheKey = idempotencyService.buildKey(idempotent.prefix(), idempotencyKey);

        Optional<IdempotencyService.CachedResponse> cached = idempotencyService.getIfProcessed(cacheKey);
        if (cached.isPresent()) {
            log.info("[Idempotency] 중복 요청 감지 - key: {}", idempotencyKey);
            return replay(cached.get());
        }

        if (!idempotencyService.markAsProcessing(cacheKey, idempotent.ttlSeconds())) {
            Thread.sleep(CONCURRENT_WAIT_MILLIS);
            cached = idempotencyService.getIfProcessed(cacheKey);
            if (cached.isPresent()) {
                return replay(cached.get());
            }
            log.warn("[Idempotency] 동일 Key 요청이 아직 처리 중 - key: {}", idempotencyKey);
            return ResponseEntity
                    .status(HttpStatus.CONFLICT)
                    .body(ApiResponse.fail("IDEMPOTENCY_IN_PROGRESS",
                            "같은 요청이 처리 중입니다. 잠시 후 다시 조회해주세요."));
        }

        Object result;
        try {
            result = joinPoint.proceed();
        } catch (Throwable t) {
            idempotencyService.clear(cacheKey);
            throw t;
        }

        if (result instanceof ResponseEntity<?> entity) {
            idempotencyService.saveResponse(cacheKey, entity.getStatusCode().value(), entity.getBody(),
                    idempotent.ttlSeconds());
        } else {
            idempotencyService.saveResponse(cacheKey, HttpStatus.OK.value(), result, idempotent.ttlSeconds());
        }

        return result;
    }

    private ResponseEntity<Object> replay(IdempotencyService.CachedResponse cached) {
        return ResponseEntity.status(cached.status()).body(cached.body());
    }

    private String extractIdempotencyKey(String headerName) {
        ServletRequestAttributes attributes =
                (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();

        if (attributes == null) {
            return null;
        }

        HttpServletRequest request = attributes.getRequest();
        return request.getHeader(headerName);
    }
}
