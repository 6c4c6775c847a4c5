package com.example.ratelimiter.config;

import com.example.ratelimiter.algorithm.RateLimitAlgorithm;
import com.example.ratelimiter.core.RateLimiter;

/**
 * 알고리즘별 설정 객체의 공통 인터페이스
 *
 * 설정 객체는 생성자 파라미터를 그대로 담으며, 검증은 생성자와 같은 규칙으로 수행된다.
 */
public interface RateLimiterConfig {

    RateLimitAlgorithm getAlgorithm();

    //검증된 Rate Limiter 인스턴스 생성
    RateLimiter toRateLimiter();
}
