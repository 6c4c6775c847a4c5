package com.example.ratelimiter.algorithm;

import java.util.Arrays;
import java.util.Locale;

/**
 * 지원하는 Rate Limiting 알고리즘 목록
 */
public enum RateLimitAlgorithm {

    FIXED_WINDOW("fixed-window"),
    LEAKY_BUCKET("leaky-bucket"),
    TOKEN_BUCKET("token-bucket"),
    SLIDING_WINDOW_COUNTER("sliding-window-counter"),
    APPROXIMATE_SLIDING_WINDOW("approximate-sliding-window");

    private final String id;

    RateLimitAlgorithm(String id) {
        this.id = id;
    }

    //설정 파일에서 쓰는 알고리즘 이름
    public String getId() {
        return id;
    }

    /**
     * 알고리즘 이름(대소문자 무시)으로 찾는다. "token-bucket", "TOKEN_BUCKET" 모두 허용.
     */
    public static RateLimitAlgorithm fromId(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Algorithm name must not be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values())
                .filter(algorithm -> algorithm.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown algorithm: " + name));
    }
}
