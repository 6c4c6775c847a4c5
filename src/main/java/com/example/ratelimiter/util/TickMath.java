package com.example.ratelimiter.util;

import java.math.BigInteger;

/**
 * 틱/유닛 연산 유틸리티 클래스
 *
 * 틱과 유닛은 모두 음수가 아닌 long 값으로 표현하며, 모든 연산은 포화(saturating) 연산이다.
 * 결과가 {@link #MAX}를 넘으면 {@link #MAX}, 0 아래로 내려가면 0에 고정된다.
 */
public final class TickMath {

    //틱/유닛 타입의 최댓값
    public static final long MAX = Long.MAX_VALUE;

    private TickMath() {
    }

    //포화 덧셈
    public static long saturatingAdd(long a, long b) {
        long result = a + b;
        if (result < 0) {
            return MAX;
        }
        return result;
    }

    //포화 뺄셈 (0 아래로 내려가지 않음)
    public static long saturatingSub(long a, long b) {
        return a > b ? a - b : 0;
    }

    //포화 곱셈
    public static long saturatingMul(long a, long b) {
        if (a == 0 || b == 0) {
            return 0;
        }
        if (a > MAX / b) {
            return MAX;
        }
        return a * b;
    }

    //올림 나눗셈
    public static long ceilDiv(long dividend, long divisor) {
        long quotient = dividend / divisor;
        return dividend % divisor == 0 ? quotient : quotient + 1;
    }

    /**
     * floor(a * b / divisor). 곱이 long 범위를 넘으면 BigInteger로 계산하고 결과는 {@link #MAX}에서 포화.
     */
    public static long mulDivFloor(long a, long b, long divisor) {
        if (b == 0 || a <= MAX / b) {
            return a * b / divisor;
        }
        BigInteger quotient = BigInteger.valueOf(a).multiply(BigInteger.valueOf(b))
                .divide(BigInteger.valueOf(divisor));
        return clamp(quotient);
    }

    /**
     * ceil(a * b / divisor). 곱이 long 범위를 넘으면 BigInteger로 계산하고 결과는 {@link #MAX}에서 포화.
     */
    public static long mulDivCeil(long a, long b, long divisor) {
        if (b == 0 || a <= MAX / b) {
            return ceilDiv(a * b, divisor);
        }
        BigInteger[] division = BigInteger.valueOf(a).multiply(BigInteger.valueOf(b))
                .divideAndRemainder(BigInteger.valueOf(divisor));
        BigInteger quotient = division[1].signum() == 0 ? division[0] : division[0].add(BigInteger.ONE);
        return clamp(quotient);
    }

    private static long clamp(BigInteger value) {
        return value.bitLength() < Long.SIZE ? value.longValue() : MAX;
    }

    //틱이 속한 정렬 구간의 시작 틱 계산
    public static long alignDown(long tick, long spanTicks) {
        return (tick / spanTicks) * spanTicks;
    }

    /**
     * 슬라이딩 윈도우 [tick - windowTicks + 1, tick]의 시작 틱을 계산한다.
     * 윈도우가 0 이전으로 넘어가면 0을 반환한다.
     */
    public static long slidingWindowHead(long tick, long windowTicks) {
        return tick >= windowTicks ? tick - windowTicks + 1 : 0;
    }

    //두 닫힌 구간 [aStart, aEnd], [bStart, bEnd]의 교집합 길이
    public static long overlapLength(long aStart, long aEnd, long bStart, long bEnd) {
        long start = Math.max(aStart, bStart);
        long end = Math.min(aEnd, bEnd);
        return start <= end ? saturatingAdd(end - start, 1) : 0;
    }

    //요청 유닛 검증
    public static long requireNonNegativeUnits(long units) {
        if (units < 0) {
            throw new IllegalArgumentException("units must not be negative: " + units);
        }
        return units;
    }

    //생성자 파라미터 검증
    public static long requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be greater than 0");
        }
        return value;
    }
}
