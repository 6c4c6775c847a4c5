package com.example.ratelimiter.config;

import com.example.ratelimiter.algorithm.RateLimitAlgorithm;
import com.example.ratelimiter.algorithm.SlidingWindowCounterRateLimiter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Sliding Window Counter 설정
 */
@Getter
@Builder
@AllArgsConstructor
public class SlidingWindowCounterConfig implements RateLimiterConfig {

    private final long capacity; // 윈도우 내 최대 유닛 수
    private final long bucketTicks; // 버킷 크기 (틱)
    private final int bucketCount; // 버킷 개수

    @Override
    public RateLimitAlgorithm getAlgorithm() {
        return RateLimitAlgorithm.SLIDING_WINDOW_COUNTER;
    }

    @Override
    public SlidingWindowCounterRateLimiter toRateLimiter() {
        return new SlidingWindowCounterRateLimiter(capacity, bucketTicks, bucketCount);
    }
}
