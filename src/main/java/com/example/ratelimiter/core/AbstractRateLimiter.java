package com.example.ratelimiter.core;

import com.example.ratelimiter.util.TickMath;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 공통 획득 흐름을 구현하는 기반 클래스
 *
 * 판정 순서:
 * 1. units == 0 이면 상태를 건드리지 않고 성공
 * 2. units > capacity 이면 BEYOND_CAPACITY (불변 설정만 보므로 락 전에 판정)
 * 3. tryLock() 한 번 시도, 실패하면 CONTENTION_FAILURE
 * 4. tick이 상태가 허용하는 최소 틱보다 작으면 EXPIRED_TICK
 * 5. 지연 상태 전이 후 가용량 판정, 성공하면 같은 락 안에서 소비
 *
 * @param <S> 알고리즘별 가변 상태 타입
 */
public abstract class AbstractRateLimiter<S> implements RateLimiter {

    private final long capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final S state;

    protected AbstractRateLimiter(long capacity, S initialState) {
        this.capacity = TickMath.requirePositive(capacity, "capacity");
        this.state = initialState;
    }

    @Override
    public final AcquireResult tryAcquire(long tick, long units) {
        TickMath.requireNonNegativeUnits(units);
        if (units == 0) {
            return AcquireResult.ACQUIRED;
        }
        if (units > capacity) {
            return AcquireResult.INSUFFICIENT_CAPACITY;
        }
        if (!lock.tryLock()) {
            return AcquireResult.CONTENTION_FAILURE;
        }
        try {
            if (tick < minAcceptableTick(state)) {
                return AcquireResult.EXPIRED_TICK;
            }
            advance(state, tick);
            if (units <= available(state, tick)) {
                consume(state, tick, units);
                return AcquireResult.ACQUIRED;
            }
            return AcquireResult.INSUFFICIENT_CAPACITY;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public final RateLimitResult tryAcquireVerbose(long tick, long units) {
        TickMath.requireNonNegativeUnits(units);
        if (units == 0) {
            return RateLimitResult.allowed(getAlgorithmName());
        }
        if (units > capacity) {
            return RateLimitResult.beyondCapacity(getAlgorithmName(), units, capacity);
        }
        if (!lock.tryLock()) {
            return RateLimitResult.contentionFailure(getAlgorithmName());
        }
        try {
            long minTick = minAcceptableTick(state);
            if (tick < minTick) {
                return RateLimitResult.expiredTick(getAlgorithmName(), minTick);
            }
            advance(state, tick);
            long available = available(state, tick);
            if (units <= available) {
                consume(state, tick, units);
                return RateLimitResult.allowed(getAlgorithmName());
            }
            return RateLimitResult.insufficientCapacity(getAlgorithmName(), units, available,
                    retryAfterTicks(state, tick, units));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public final long capacityRemaining(long tick) {
        if (!lock.tryLock()) {
            throw RateLimitException.contentionFailure();
        }
        try {
            long minTick = minAcceptableTick(state);
            if (tick < minTick) {
                throw RateLimitException.expiredTick(minTick);
            }
            advance(state, tick);
            return available(state, tick);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public final long currentCapacityAt(long tick) {
        if (!lock.tryLock()) {
            throw RateLimitException.contentionFailure();
        }
        try {
            long minTick = minAcceptableTick(state);
            if (tick < minTick) {
                throw RateLimitException.expiredTick(minTick);
            }
            S preview = copyOf(state);
            advance(preview, tick);
            return available(preview, tick);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public final long getCapacity() {
        return capacity;
    }

    //상태가 받아들일 수 있는 최소 틱
    protected abstract long minAcceptableTick(S state);

    //tick 시점으로 지연 상태 전이 적용 (리셋, 누출, 보충)
    protected abstract void advance(S state, long tick);

    //전이가 끝난 상태에서 획득 가능한 유닛 수
    protected abstract long available(S state, long tick);

    //가용량 판정을 통과한 유닛을 상태에 반영
    protected abstract void consume(S state, long tick, long units);

    //용량 부족 시 재시도 권장 틱 추정
    protected abstract long retryAfterTicks(S state, long tick, long units);

    //미리보기 계산용 상태 복사본
    protected abstract S copyOf(S state);
}
