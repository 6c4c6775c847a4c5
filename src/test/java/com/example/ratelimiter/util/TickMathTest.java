package com.example.ratelimiter.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TickMath 테스트")
class TickMathTest {

    @Test
    @DisplayName("포화 덧셈/뺄셈/곱셈")
    void testSaturatingOperations() {
        assertEquals(7, TickMath.saturatingAdd(3, 4));
        assertEquals(TickMath.MAX, TickMath.saturatingAdd(TickMath.MAX, 1));
        assertEquals(TickMath.MAX, TickMath.saturatingAdd(TickMath.MAX, TickMath.MAX));

        assertEquals(1, TickMath.saturatingSub(4, 3));
        assertEquals(0, TickMath.saturatingSub(3, 4), "0 아래로 내려가면 안 됩니다");

        assertEquals(12, TickMath.saturatingMul(3, 4));
        assertEquals(0, TickMath.saturatingMul(0, TickMath.MAX));
        assertEquals(TickMath.MAX, TickMath.saturatingMul(TickMath.MAX, 2));
    }

    @Test
    @DisplayName("곱한 뒤 나누기 - long 범위를 넘는 중간값도 정확히 계산")
    void testMulDiv() {
        assertEquals(2, TickMath.mulDivFloor(3, 4, 5));
        assertEquals(3, TickMath.mulDivCeil(3, 4, 5));
        assertEquals(4, TickMath.mulDivCeil(4, 5, 5));

        assertEquals(TickMath.MAX - 1, TickMath.mulDivFloor(TickMath.MAX - 1, TickMath.MAX, TickMath.MAX));
        assertEquals(TickMath.MAX, TickMath.mulDivCeil(TickMath.MAX, TickMath.MAX, TickMath.MAX));
        assertEquals(TickMath.MAX, TickMath.mulDivFloor(TickMath.MAX, TickMath.MAX, 1), "결과가 넘치면 최댓값");
    }

    @Test
    @DisplayName("정렬과 슬라이딩 윈도우 구간")
    void testWindowHelpers() {
        assertEquals(10, TickMath.alignDown(14, 5));
        assertEquals(0, TickMath.alignDown(4, 5));

        assertEquals(0, TickMath.slidingWindowHead(3, 5));
        assertEquals(1, TickMath.slidingWindowHead(5, 5));
        assertEquals(3, TickMath.slidingWindowHead(7, 5));

        assertEquals(2, TickMath.overlapLength(0, 4, 3, 7));
        assertEquals(0, TickMath.overlapLength(0, 4, 5, 9));
        assertEquals(TickMath.MAX, TickMath.overlapLength(0, TickMath.MAX, 0, TickMath.MAX));
    }

    @Test
    @DisplayName("입력 검증")
    void testValidation() {
        assertEquals(0, TickMath.requireNonNegativeUnits(0));
        assertThrows(IllegalArgumentException.class, () -> TickMath.requireNonNegativeUnits(-1));

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> TickMath.requirePositive(0, "windowTicks"));
        assertEquals("windowTicks must be greater than 0", exception.getMessage());
    }
}
