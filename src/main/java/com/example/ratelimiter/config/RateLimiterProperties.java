package com.example.ratelimiter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rate Limiter 설정 프로퍼티
 *
 * <pre>
 * rate-limiter:
 *   limiters:
 *     orders-api:
 *       algorithm: token-bucket
 *       capacity: 100
 *       refill-interval: 10
 *       refill-amount: 5
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "rate-limiter")
public class RateLimiterProperties {

    private boolean enabled = true; // Rate Limiter 자동 설정 활성화
    private Map<String, LimiterDefinition> limiters = new LinkedHashMap<>(); // 이름별 Rate Limiter 정의

    /**
     * 이름 붙은 Rate Limiter 하나의 정의. 알고리즘에 필요한 값만 채우면 된다.
     */
    @Data
    public static class LimiterDefinition {
        private String algorithm;

        private Long capacity;

        // Fixed Window, Approximate Sliding Window
        private Long windowTicks;

        // Leaky Bucket
        private Long leakInterval;
        private Long leakAmount;

        // Token Bucket
        private Long refillInterval;
        private Long refillAmount;

        // Sliding Window Counter
        private Long bucketTicks;
        private Integer bucketCount;
    }
}
