package com.teesheet.common.idempotency;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 멱등성 보장 어노테이션
 *
 * 같은 Idempotency Key로 다시 호출되면 비즈니스 로직을 실행하지 않고
 * 처음 응답(상태 코드 포함)을 그대로 돌려준다.
 * 직원이 "확정" 버튼을 두 번 누르거나 대시보드가 타임아웃 후 재전송하는 경우를 막기 위함.
 *
 * @see <a href="https://datatracker.ietf.org/doc/draft-ietf-httpapi-idempotency-key-header/">IETF Idempotency-Key Header</a>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Idempotent {

    /**
     * Idempotency Key를 추출할 헤더 이름
     */
    String headerName() default "X-Idempotency-Key";

    /**
     * 캐시 유지 시간 (초), 기본 24시간
     */
    long ttlSeconds() default 86400;

    /**
     * Key prefix (Redis key 구분용)
     */
    String prefix() default "idempotency";

    /**
     * Idempotency Key 필수 여부
     *
     * true: Key가 없으면 400 Bad Request
     * false: Key가 없으면 멱등성 체크 없이 실행
     */
    boolean required() default false;
}
