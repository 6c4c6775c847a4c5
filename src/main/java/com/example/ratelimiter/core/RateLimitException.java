package com.example.ratelimiter.core;

import lombok.Getter;

/**
 * 남은 용량 조회가 실패했을 때 던지는 예외
 */
@Getter
public class RateLimitException extends RuntimeException {

    private final RateLimitError error;
    private final long minAcceptableTick;

    public RateLimitException(RateLimitError error, String message) {
        this(error, message, 0);
    }

    public RateLimitException(RateLimitError error, String message, long minAcceptableTick) {
        super(message);
        this.error = error;
        this.minAcceptableTick = minAcceptableTick;
    }

    public static RateLimitException expiredTick(long minAcceptableTick) {
        return new RateLimitException(RateLimitError.EXPIRED_TICK,
                "Expired tick: minimum acceptable tick is " + minAcceptableTick + ".", minAcceptableTick);
    }

    public static RateLimitException contentionFailure() {
        return new RateLimitException(RateLimitError.CONTENTION_FAILURE,
                "Contention failure: resource is locked by another operation. Please retry.");
    }
}
