package com.example.ratelimiter.config;

import com.example.ratelimiter.algorithm.RateLimitAlgorithm;
import com.example.ratelimiter.core.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rate Limiter 인스턴스를 생성하고 관리하는 팩토리 클래스
 *
 * 같은 이름으로 요청하면 항상 같은 인스턴스(같은 상태)를 돌려준다.
 */
@Slf4j
@RequiredArgsConstructor
public class RateLimiterFactory {

    private final RateLimiterProperties properties;
    private final ConcurrentHashMap<String, RateLimiter> rateLimiterCache = new ConcurrentHashMap<>();

    //설정된 이름의 Rate Limiter 인스턴스 반환
    public RateLimiter getRateLimiter(String name) {
        return rateLimiterCache.computeIfAbsent(name, this::createNamedRateLimiter);
    }

    //설정 파일에 정의된 Rate Limiter 이름 목록
    public Set<String> getRateLimiterNames() {
        return properties.getLimiters().keySet();
    }

    //설정 객체로 새 Rate Limiter 생성 (캐시하지 않음)
    public RateLimiter createRateLimiter(RateLimiterConfig config) {
        RateLimiter rateLimiter = config.toRateLimiter();
        log.info("Creating {} with capacity: {}", rateLimiter.getClass().getSimpleName(), rateLimiter.getCapacity());
        return rateLimiter;
    }

    private RateLimiter createNamedRateLimiter(String name) {
        RateLimiterProperties.LimiterDefinition definition = properties.getLimiters().get(name);
        if (definition == null) {
            throw new IllegalArgumentException("No rate limiter configured with name: " + name);
        }
        RateLimiterConfig config = toConfig(name, definition);
        log.info("Creating rate limiter '{}' - algorithm: {}", name, config.getAlgorithm().getId());
        return createRateLimiter(config);
    }

    //프로퍼티 정의를 알고리즘별 설정 객체로 변환
    static RateLimiterConfig toConfig(String name, RateLimiterProperties.LimiterDefinition definition) {
        RateLimitAlgorithm algorithm = RateLimitAlgorithm.fromId(definition.getAlgorithm());
        long capacity = require(name, "capacity", definition.getCapacity());

        return switch (algorithm) {
            case FIXED_WINDOW -> FixedWindowConfig.builder()
                    .capacity(capacity)
                    .windowTicks(require(name, "window-ticks", definition.getWindowTicks()))
                    .build();
            case LEAKY_BUCKET -> LeakyBucketConfig.builder()
                    .capacity(capacity)
                    .leakInterval(require(name, "leak-interval", definition.getLeakInterval()))
                    .leakAmount(require(name, "leak-amount", definition.getLeakAmount()))
                    .build();
            case TOKEN_BUCKET -> TokenBucketConfig.builder()
                    .capacity(capacity)
                    .refillInterval(require(name, "refill-interval", definition.getRefillInterval()))
                    .refillAmount(require(name, "refill-amount", definition.getRefillAmount()))
                    .build();
            case SLIDING_WINDOW_COUNTER -> SlidingWindowCounterConfig.builder()
                    .capacity(capacity)
                    .bucketTicks(require(name, "bucket-ticks", definition.getBucketTicks()))
                    .bucketCount(require(name, "bucket-count", definition.getBucketCount()))
                    .build();
            case APPROXIMATE_SLIDING_WINDOW -> ApproximateSlidingWindowConfig.builder()
                    .capacity(capacity)
                    .windowTicks(require(name, "window-ticks", definition.getWindowTicks()))
                    .build();
        };
    }

    private static <T> T require(String name, String property, T value) {
        if (value == null) {
            throw new IllegalArgumentException(
                    "rate-limiter.limiters." + name + "." + property + " must be set");
        }
        return value;
    }
}
