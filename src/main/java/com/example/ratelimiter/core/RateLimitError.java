package com.example.ratelimiter.core;

/**
 * Rate Limiter 실패 유형
 */
public enum RateLimitError {

    // 지금은 용량이 부족하지만 시간이 지나면 성공할 수 있음
    INSUFFICIENT_CAPACITY(true),

    // 요청 유닛이 설정된 용량 자체를 넘음 (재시도해도 절대 성공하지 않음)
    BEYOND_CAPACITY(false),

    // 이미 처리된 틱보다 과거 틱이 들어옴 (호출자의 단조성 위반)
    EXPIRED_TICK(false),

    // 락 경합으로 즉시 실패 (용량과 무관)
    CONTENTION_FAILURE(true);

    private final boolean retryable;

    RateLimitError(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
