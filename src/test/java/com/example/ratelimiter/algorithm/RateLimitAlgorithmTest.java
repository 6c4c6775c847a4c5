package com.example.ratelimiter.algorithm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("알고리즘 이름 매핑 테스트")
class RateLimitAlgorithmTest {

    @Test
    @DisplayName("이름 정규화 - 대소문자와 밑줄을 구분하지 않음")
    void testFromId() {
        assertEquals(RateLimitAlgorithm.TOKEN_BUCKET, RateLimitAlgorithm.fromId("token-bucket"));
        assertEquals(RateLimitAlgorithm.TOKEN_BUCKET, RateLimitAlgorithm.fromId("TOKEN_BUCKET"));
        assertEquals(RateLimitAlgorithm.SLIDING_WINDOW_COUNTER, RateLimitAlgorithm.fromId(" Sliding-Window-Counter "));
    }

    @Test
    @DisplayName("알 수 없는 이름은 예외")
    void testUnknown() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> RateLimitAlgorithm.fromId("sliding-window-log"));
        assertEquals("Unknown algorithm: sliding-window-log", exception.getMessage());
        assertThrows(IllegalArgumentException.class, () -> RateLimitAlgorithm.fromId(null));
    }
}
