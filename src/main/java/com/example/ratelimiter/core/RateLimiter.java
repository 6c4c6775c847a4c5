package com.example.ratelimiter.core;

/**
 * 틱 기반 Rate Limiting 알고리즘의 공통 인터페이스
 *
 * 틱은 호출자가 단조 증가 시계에서 얻어 넘겨주는 값이며, 구현체는 시스템 시계를 읽지 않는다.
 * 모든 연산은 즉시 반환된다. 락을 얻지 못하면 기다리지 않고 CONTENTION_FAILURE로 실패한다.
 */
public interface RateLimiter {

    /**
     * 주어진 틱에 유닛 획득을 시도합니다.
     *
     * @param tick 현재 틱
     * @param units 획득할 유닛 수 (0이면 상태 변경 없이 항상 성공)
     * @return 획득 결과
     */
    AcquireResult tryAcquire(long tick, long units);

    /**
     * 주어진 틱에 유닛 획득을 시도하고, 실패 시 진단 정보를 함께 반환합니다.
     *
     * @param tick 현재 틱
     * @param units 획득할 유닛 수
     * @return 상세 결과 (재시도 권장 틱, 가용 유닛 등)
     */
    RateLimitResult tryAcquireVerbose(long tick, long units);

    /**
     * 주어진 틱 기준으로 지금 획득 가능한 유닛 수를 반환합니다.
     * 지연된 상태 전이(윈도우 리셋, 누출, 보충)는 이 호출에서 적용됩니다.
     *
     * @param tick 현재 틱
     * @return 남은 용량
     * @throws RateLimitException 과거 틱이거나 락 경합이 발생한 경우
     */
    long capacityRemaining(long tick);

    /**
     * {@link #capacityRemaining(long)}과 같지만 실패하지 않습니다. 오류가 나면 0을 반환합니다.
     */
    default long capacityRemainingOrZero(long tick) {
        try {
            return capacityRemaining(tick);
        } catch (RateLimitException e) {
            return 0;
        }
    }

    /**
     * 상태를 바꾸지 않고 주어진 틱에서의 남은 용량을 계산합니다.
     *
     * @throws RateLimitException 과거 틱이거나 락 경합이 발생한 경우
     */
    long currentCapacityAt(long tick);

    //설정된 최대 용량
    long getCapacity();

    //알고리즘 이름 반환
    String getAlgorithmName();
}
