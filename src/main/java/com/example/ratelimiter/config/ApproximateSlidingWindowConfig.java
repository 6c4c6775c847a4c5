package com.example.ratelimiter.config;

import com.example.ratelimiter.algorithm.ApproximateSlidingWindowRateLimiter;
import com.example.ratelimiter.algorithm.RateLimitAlgorithm;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Approximate Sliding Window 설정
 */
@Getter
@Builder
@AllArgsConstructor
public class ApproximateSlidingWindowConfig implements RateLimiterConfig {

    private final long capacity; // 슬라이딩 윈도우 내 최대 유닛 수
    private final long windowTicks; // 윈도우 크기 (틱)

    @Override
    public RateLimitAlgorithm getAlgorithm() {
        return RateLimitAlgorithm.APPROXIMATE_SLIDING_WINDOW;
    }

    @Override
    public ApproximateSlidingWindowRateLimiter toRateLimiter() {
        return new ApproximateSlidingWindowRateLimiter(capacity, windowTicks);
    }
}
