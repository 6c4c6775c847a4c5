package com.example.ratelimiter.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 상세 경로(tryAcquireVerbose)의 결과를 담는 클래스
 */
@Getter
@Builder
@AllArgsConstructor
public class RateLimitResult {

    private final boolean allowed; // 요청 허용 여부
    private final RateLimitError error; // 실패 유형 (허용이면 null)
    private final long acquiring; // 요청한 유닛 수
    private final long available; // 판정 시점의 가용 유닛 수
    private final long retryAfterTicks; // 재시도 권장 틱 (추정치)
    private final long capacity; // 설정된 용량 (BEYOND_CAPACITY)
    private final long minAcceptableTick; // 허용 가능한 최소 틱 (EXPIRED_TICK)
    private final String algorithm; // 사용된 알고리즘 이름

    //허용된 요청
    public static RateLimitResult allowed(String algorithm) {
        return RateLimitResult.builder()
                .allowed(true)
                .algorithm(algorithm)
                .build();
    }

    //가용 유닛 부족 (나중에 성공할 수 있음)
    public static RateLimitResult insufficientCapacity(String algorithm, long acquiring, long available,
                                                       long retryAfterTicks) {
        return RateLimitResult.builder()
                .allowed(false)
                .error(RateLimitError.INSUFFICIENT_CAPACITY)
                .acquiring(acquiring)
                .available(available)
                .retryAfterTicks(retryAfterTicks)
                .algorithm(algorithm)
                .build();
    }

    //요청이 용량 자체를 초과 (재시도 불가)
    public static RateLimitResult beyondCapacity(String algorithm, long acquiring, long capacity) {
        return RateLimitResult.builder()
                .allowed(false)
                .error(RateLimitError.BEYOND_CAPACITY)
                .acquiring(acquiring)
                .capacity(capacity)
                .algorithm(algorithm)
                .build();
    }

    //과거 틱
    public static RateLimitResult expiredTick(String algorithm, long minAcceptableTick) {
        return RateLimitResult.builder()
                .allowed(false)
                .error(RateLimitError.EXPIRED_TICK)
                .minAcceptableTick(minAcceptableTick)
                .algorithm(algorithm)
                .build();
    }

    //락 경합
    public static RateLimitResult contentionFailure(String algorithm) {
        return RateLimitResult.builder()
                .allowed(false)
                .error(RateLimitError.CONTENTION_FAILURE)
                .algorithm(algorithm)
                .build();
    }

    /**
     * 단순 경로 결과로 변환한다. BEYOND_CAPACITY는 INSUFFICIENT_CAPACITY로 합쳐진다.
     */
    public AcquireResult toAcquireResult() {
        if (allowed) {
            return AcquireResult.ACQUIRED;
        }
        return switch (error) {
            case INSUFFICIENT_CAPACITY, BEYOND_CAPACITY -> AcquireResult.INSUFFICIENT_CAPACITY;
            case EXPIRED_TICK -> AcquireResult.EXPIRED_TICK;
            case CONTENTION_FAILURE -> AcquireResult.CONTENTION_FAILURE;
        };
    }

    public String getMessage() {
        if (allowed) {
            return "Request allowed";
        }
        return switch (error) {
            case INSUFFICIENT_CAPACITY -> String.format(
                    "Insufficient capacity: tried to acquire %d, available %d, retry after %d tick(s).",
                    acquiring, available, retryAfterTicks);
            case BEYOND_CAPACITY -> String.format(
                    "Request exceeds maximum capacity: tried to acquire %d, capacity %d. This request cannot succeed.",
                    acquiring, capacity);
            case EXPIRED_TICK -> String.format(
                    "Expired tick: minimum acceptable tick is %d.", minAcceptableTick);
            case CONTENTION_FAILURE ->
                    "Contention failure: resource is locked by another operation. Please retry.";
        };
    }

    @Override
    public String toString() {
        return algorithm + ": " + getMessage();
    }
}
