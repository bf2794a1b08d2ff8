package com.teesheet.common.idempotency;


import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Idempotency Key 관리 서비스
 *
 * <p>Redis 값은 두 가지 형태 중 하나다.</p>
 * <ul>
 *   <li>{@code PROCESSING} - 첫 요청이 아직 처리 중</li>
 *   <li>{@code {"status":200,"body":{...}}} - 처리 완료된 응답</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotencyService {

    static final String PROCESSING = "PROCESSING";

    private final RedissonClient redissonClient;
    private final ObjectMapper objectMapper;

    /**
     * 처리 완료된 응답이 있으면 반환 (처리 중이면 empty)
     */
    public Optional<CachedResponse> getIfProcessed(String key) {
        RBucket<String> bucket = redissonClient.getBucket(key);
        String cached = bucket.get();

        if (cached == null || PROCESSING.equals(cached)) {
            return Optional.empty();
        }

        try {
            JsonNode node = objectMapper.readTree(cached);
            log.info("[Idempotency] 캐시된 응답 반환 - key: {}", key);
            return Optional.of(new CachedResponse(node.path("status").asInt(200), node.path("body")));
        } catch (JsonProcessingException e) {
            log.error("[Idempotency] 캐시 응답 파싱 실패 - key: {}", key, e);
            return Optional.empty();
        }
    }

    /**
     * 처리 결과를 캐시에 저장
     */
    public void saveResponse(String key, int status, Object body, long ttlSeconds) {
        try {
            String json = objectMapper.writeValueAsString(
                    objectMapper.createObjectNode()
                            .put("status", status)
                            .set("body", objectMapper.valueToTree(body)));
            RBucket<String> bucket = redissonClient.getBucket(key);
            bucket.set(json, Duration.ofSeconds(ttlSeconds));
            log.info("[Idempotency] 응답 캐시 저장 - key: {}, status: {}, ttl: {}초", key, status, ttlSeconds);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            // 캐시 저장 실패는 요청 결과에 영향을 주지 않는다. 마킹만 지워 재요청이 가능하게 한다.
            log.error("[Idempotency] 응답 직렬화 실패 - key: {}", key, e);
            clear(key);
        }
    }

    /**
     * 처리 중 상태로 마킹
     * @return true: 첫 요청, false: 이미 처리 중이거나 처리 완료
     */
    public boolean markAsProcessing(String key, long ttlSeconds) {
        RBucket<String> bucket = redissonClient.getBucket(key);
        boolean success = bucket.setIfAbsent(PROCESSING, Duration.ofSeconds(ttlSeconds));

        if (success) {
            log.debug("[Idempotency] 처리 시작 마킹 - key: {}", key);
        } else {
            log.warn("[Idempotency] 이미 처리 중이거나 완료된 요청 - key: {}", key);
        }

        return success;
    }

    /**
     * 처리 중 예외가 나면 마킹을 지워 같은 키로 재시도할 수 있게 한다
     */
    public void clear(String key) {
        redissonClient.getBucket(key).delete();
    }

    public String buildKey(String prefix, String idempotencyKey) {
        return prefix + ":" + idempotencyKey;
    }

    public record CachedResponse(int status, JsonNode body) {
    }
}
