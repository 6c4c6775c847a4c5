package com.example.ratelimiter.config;

import com.example.ratelimiter.algorithm.LeakyBucketRateLimiter;
import com.example.ratelimiter.algorithm.RateLimitAlgorithm;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Leaky Bucket 설정
 */
@Getter
@Builder
@AllArgsConstructor
public class LeakyBucketConfig implements RateLimiterConfig {

    private final long capacity; // 버킷 용량
    private final long leakInterval; // 누출 주기 (틱)
    private final long leakAmount; // 주기마다 빠지는 유닛 수

    @Override
    public RateLimitAlgorithm getAlgorithm() {
        return RateLimitAlgorithm.LEAKY_BUCKET;
    }

    @Override
    public LeakyBucketRateLimiter toRateLimiter() {
        return new LeakyBucketRateLimiter(capacity, leakInterval, leakAmount);
    }
}
