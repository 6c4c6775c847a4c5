package com.example.ratelimiter.config;

import com.example.ratelimiter.algorithm.FixedWindowRateLimiter;
import com.example.ratelimiter.algorithm.RateLimitAlgorithm;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Fixed Window Counter 설정
 */
@Getter
@Builder
@AllArgsConstructor
public class FixedWindowConfig implements RateLimiterConfig {

    private final long capacity; // 윈도우 내 최대 유닛 수
    private final long windowTicks; // 윈도우 크기 (틱)

    @Override
    public RateLimitAlgorithm getAlgorithm() {
        return RateLimitAlgorithm.FIXED_WINDOW;
    }

    @Override
    public FixedWindowRateLimiter toRateLimiter() {
        return new FixedWindowRateLimiter(capacity, windowTicks);
    }
}
