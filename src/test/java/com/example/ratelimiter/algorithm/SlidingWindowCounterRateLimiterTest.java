package com.example.ratelimiter.algorithm;

import com.example.ratelimiter.core.AcquireResult;
import com.example.ratelimiter.core.RateLimitError;
import com.example.ratelimiter.core.RateLimitResult;
import com.example.ratelimiter.util.TickMath;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sliding Window Counter Rate Limiter 테스트
 * 버킷 순환과 지연 리셋을 검증합니다.
 */
@Slf4j
@DisplayName("Sliding Window Counter Rate Limiter 테스트")
class SlidingWindowCounterRateLimiterTest {

    private SlidingWindowCounterRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        // 5틱 버킷 4개 = 20틱 윈도우
        rateLimiter = new SlidingWindowCounterRateLimiter(100, 5, 4);
        log.info("Sliding Window Counter Rate Limiter 초기화 완료 - capacity: 100, bucketTicks: 5, bucketCount: 4");
    }

    @Test
    @DisplayName("생성자 검증 - 0 이하의 파라미터는 거부되어야 함")
    void testInvalidParameters() {
        assertEquals("bucketTicks must be greater than 0",
                assertThrows(IllegalArgumentException.class,
                        () -> new SlidingWindowCounterRateLimiter(100, 0, 4)).getMessage());
        assertEquals("bucketCount must be greater than 0",
                assertThrows(IllegalArgumentException.class,
                        () -> new SlidingWindowCounterRateLimiter(100, 5, 0)).getMessage());
        assertEquals(20, rateLimiter.getWindowTicks());
    }

    @Test
    @DisplayName("버킷별 획득 - 윈도우 합계가 용량에 도달하면 거부")
    void testFillAcrossBuckets() {
        log.info("=== Sliding Window Counter 버킷별 획득 테스트 시작 ===");

        for (long tick = 0; tick <= 15; tick += 5) {
            assertEquals(AcquireResult.ACQUIRED, rateLimiter.tryAcquire(tick, 25), "틱 " + tick + "의 25 유닛은 허용되어야 합니다");
        }
        assertEquals(AcquireResult.INSUFFICIENT_CAPACITY, rateLimiter.tryAcquire(15, 1));

        // 틱 25의 윈도우 [6, 25]에는 틱 10, 15 버킷이 남아 있음
        assertEquals(50, rateLimiter.capacityRemaining(25));
        assertEquals(100, rateLimiter.capacityRemaining(35));
    }

    @Test
    @DisplayName("만료 - 한 버킷에 몰린 유닛은 윈도우가 지나면 모두 회복")
    void testSingleBucketExpiry() {
        assertEquals(AcquireResult.ACQUIRED, rateLimiter.tryAcquire(0, 50));

        assertEquals(100, rateLimiter.capacityRemaining(25));
        assertEquals(AcquireResult.ACQUIRED, rateLimiter.tryAcquire(25, 100));
        assertEquals(AcquireResult.INSUFFICIENT_CAPACITY, rateLimiter.tryAcquire(25, 1));
    }

    @Test
    @DisplayName("슬롯 재사용 - 원형 배열의 이전 주기 값은 합산되지 않음")
    void testSlotRotation() {
        log.info("=== Sliding Window Counter 슬롯 재사용 테스트 시작 ===");

        assertEquals(AcquireResult.ACQUIRED, rateLimiter.tryAcquire(2, 30));
        assertEquals(AcquireResult.ACQUIRED, rateLimiter.tryAcquire(7, 30));
        // 틱 22는 틱 2와 같은 슬롯. 틱 7 버킷만 윈도우 [3, 22]에 남음
        assertEquals(AcquireResult.ACQUIRED, rateLimiter.tryAcquire(22, 70));
        assertEquals(AcquireResult.INSUFFICIENT_CAPACITY, rateLimiter.tryAcquire(22, 1));

        // 오랫동안 호출이 없으면 모든 슬롯이 만료
        assertEquals(AcquireResult.ACQUIRED, rateLimiter.tryAcquire(42, 100));
    }

    @Test
    @DisplayName("버킷 2개 - 여러 주기를 돌아도 윈도우 합계를 지킴")
    void testTwoBucketCycles() {
        SlidingWindowCounterRateLimiter limiter = new SlidingWindowCounterRateLimiter(80, 5, 2);

        assertEquals(AcquireResult.ACQUIRED, limiter.tryAcquire(1, 20));
        assertEquals(AcquireResult.ACQUIRED, limiter.tryAcquire(6, 20));
        assertEquals(AcquireResult.ACQUIRED, limiter.tryAcquire(12, 20));
        assertEquals(AcquireResult.ACQUIRED, limiter.tryAcquire(17, 40));
        assertEquals(AcquireResult.ACQUIRED, limiter.tryAcquire(17, 20));
        assertEquals(AcquireResult.INSUFFICIENT_CAPACITY, limiter.tryAcquire(17, 1));
    }

    @Test
    @DisplayName("과거 틱 - 마지막으로 사용한 버킷 시작 이전은 EXPIRED_TICK")
    void testExpiredTick() {
        assertEquals(AcquireResult.ACQUIRED, rateLimiter.tryAcquire(15, 1));

        RateLimitResult result = rateLimiter.tryAcquireVerbose(11, 1);
        assertEquals(RateLimitError.EXPIRED_TICK, result.getError());
        assertEquals(15, result.getMinAcceptableTick());
        assertEquals(AcquireResult.ACQUIRED, rateLimiter.tryAcquire(16, 1));
    }

    @Test
    @DisplayName("남은 용량 조회 - 획득할 때마다 줄어듦")
    void testCapacityRemaining() {
        assertEquals(100, rateLimiter.capacityRemaining(0));
        rateLimiter.tryAcquire(0, 30);
        assertEquals(70, rateLimiter.capacityRemaining(0));
        rateLimiter.tryAcquire(5, 25);
        assertEquals(45, rateLimiter.capacityRemaining(5));
        rateLimiter.tryAcquire(10, 20);
        assertEquals(25, rateLimiter.capacityRemaining(10));
    }

    @Test
    @DisplayName("미리보기 조회 - 미래 틱을 계산해도 상태는 그대로")
    void testCurrentCapacityAt() {
        rateLimiter.tryAcquire(7, 50);
        rateLimiter.tryAcquire(15, 50);

        assertEquals(50, rateLimiter.currentCapacityAt(26), "틱 15 버킷은 아직 윈도우 안에 있어야 합니다");
        assertEquals(100, rateLimiter.currentCapacityAt(35));
        assertEquals(0, rateLimiter.capacityRemaining(15), "미리보기는 슬롯을 리셋하지 않아야 합니다");
    }

    @Test
    @DisplayName("실패 케이스 - 오래된 버킷이 만료되는 시점을 재시도 틱으로 안내")
    void testVerboseInsufficient() {
        log.info("=== Sliding Window Counter 실패 케이스 테스트 시작 ===");
        for (long tick = 0; tick <= 15; tick += 5) {
            rateLimiter.tryAcquire(tick, 25);
        }

        RateLimitResult result = rateLimiter.tryAcquireVerbose(17, 30);
        assertEquals(RateLimitError.INSUFFICIENT_CAPACITY, result.getError());
        assertEquals(0, result.getAvailable());
        // 틱 0, 5 버킷이 모두 빠지는 틱 25까지
        assertEquals(8, result.getRetryAfterTicks());
        assertEquals(AcquireResult.ACQUIRED, rateLimiter.tryAcquire(25, 30));

        log.info("Sliding Window Counter 실패 테스트 완료 - {}", result.getMessage());
    }

    @Test
    @DisplayName("버킷 1개 - 고정 윈도우처럼 동작")
    void testSingleBucket() {
        SlidingWindowCounterRateLimiter limiter = new SlidingWindowCounterRateLimiter(50, 10, 1);

        assertEquals(AcquireResult.ACQUIRED, limiter.tryAcquire(3, 50));
        RateLimitResult result = limiter.tryAcquireVerbose(9, 1);
        assertEquals(RateLimitError.INSUFFICIENT_CAPACITY, result.getError());
        assertEquals(1, result.getRetryAfterTicks());
        assertEquals(AcquireResult.ACQUIRED, limiter.tryAcquire(10, 50));
    }

    @Test
    @DisplayName("최댓값 - 포화 연산으로 동작")
    void testSaturation() {
        SlidingWindowCounterRateLimiter limiter = new SlidingWindowCounterRateLimiter(TickMath.MAX, TickMath.MAX, 1);

        assertEquals(AcquireResult.ACQUIRED, limiter.tryAcquire(0, TickMath.MAX));
        assertEquals(AcquireResult.INSUFFICIENT_CAPACITY, limiter.tryAcquire(1, 1));
        assertEquals(AcquireResult.ACQUIRED, limiter.tryAcquire(TickMath.MAX, TickMath.MAX));
    }

    @Test
    @DisplayName("알고리즘 이름")
    void testAlgorithmName() {
        assertEquals("sliding-window-counter", rateLimiter.getAlgorithmName());
    }
}
