package com.example.ratelimiter.config;

import com.example.ratelimiter.algorithm.RateLimitAlgorithm;
import com.example.ratelimiter.algorithm.TokenBucketRateLimiter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Token Bucket 설정
 */
@Getter
@Builder
@AllArgsConstructor
public class TokenBucketConfig implements RateLimiterConfig {

    private final long capacity; // 버킷 용량 (최대 토큰 수)
    private final long refillInterval; // 보충 주기 (틱)
    private final long refillAmount; // 주기마다 보충되는 토큰 수

    @Override
    public RateLimitAlgorithm getAlgorithm() {
        return RateLimitAlgorithm.TOKEN_BUCKET;
    }

    @Override
    public TokenBucketRateLimiter toRateLimiter() {
        return new TokenBucketRateLimiter(capacity, refillInterval, refillAmount);
    }
}
