package com.example.ratelimiter.core;

/**
 * 단순 경로(tryAcquire)의 결과
 *
 * 용량 초과(BEYOND_CAPACITY)는 이 경로에서 INSUFFICIENT_CAPACITY로 합쳐진다.
 * 상세 정보가 필요하면 {@link RateLimiter#tryAcquireVerbose(long, long)}를 사용한다.
 */
public enum AcquireResult {

    ACQUIRED(null),
    INSUFFICIENT_CAPACITY(RateLimitError.INSUFFICIENT_CAPACITY),
    EXPIRED_TICK(RateLimitError.EXPIRED_TICK),
    CONTENTION_FAILURE(RateLimitError.CONTENTION_FAILURE);

    private final RateLimitError error;

    AcquireResult(RateLimitError error) {
        this.error = error;
    }

    public boolean isAcquired() {
        return this == ACQUIRED;
    }

    //실패 유형 (성공이면 null)
    public RateLimitError getError() {
        return error;
    }
}
