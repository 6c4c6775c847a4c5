package com.example.ratelimiter.algorithm;

import com.example.ratelimiter.core.AbstractRateLimiter;
import com.example.ratelimiter.model.LeakyBucketState;
import com.example.ratelimiter.util.TickMath;
import lombok.extern.slf4j.Slf4j;

/**
 * Leaky Bucket Algorithm
 *
 * 동작 원리:
 * - 빈 버킷으로 시작하고, 획득한 유닛만큼 버킷이 찬다
 * - leakInterval 마다 leakAmount 만큼 일정하게 빠진다 (부분 구간은 누출 없음)
 * - 버킷이 넘치는 요청은 거부
 */
@Slf4j
public class LeakyBucketRateLimiter extends AbstractRateLimiter<LeakyBucketState> {

    private final long leakInterval;
    private final long leakAmount;

    /**
     * @param capacity 버킷 용량
     * @param leakInterval 누출 주기 (틱)
     * @param leakAmount 주기마다 빠지는 유닛 수
     */
    public LeakyBucketRateLimiter(long capacity, long leakInterval, long leakAmount) {
        super(capacity, new LeakyBucketState());
        this.leakInterval = TickMath.requirePositive(leakInterval, "leakInterval");
        this.leakAmount = TickMath.requirePositive(leakAmount, "leakAmount");

        log.debug("LeakyBucketRateLimiter initialized - capacity: {}, leakInterval: {}, leakAmount: {}",
                capacity, leakInterval, leakAmount);
    }

    @Override
    protected long minAcceptableTick(LeakyBucketState state) {
        return state.getLastLeakTick();
    }

    //경과한 전체 주기만큼 누출, 마지막 누출 틱은 주기 단위로만 전진 (위상 유지)
    @Override
    protected void advance(LeakyBucketState state, long tick) {
        long leakTimes = (tick - state.getLastLeakTick()) / leakInterval;
        if (leakTimes > 0) {
            long leaked = TickMath.saturatingMul(leakTimes, leakAmount);
            state.setLevel(TickMath.saturatingSub(state.getLevel(), leaked));
            state.setLastLeakTick(state.getLastLeakTick() + leakTimes * leakInterval);

            log.trace("Bucket leaked - level: {}, leaked: {}, lastLeakTick: {}",
                    state.getLevel(), leaked, state.getLastLeakTick());
        }
    }

    @Override
    protected long available(LeakyBucketState state, long tick) {
        return TickMath.saturatingSub(getCapacity(), state.getLevel());
    }

    @Override
    protected void consume(LeakyBucketState state, long tick, long units) {
        state.setLevel(state.getLevel() + units);
    }

    //넘치는 만큼 빠질 때까지 필요한 주기 수, 현재 주기에서 이미 지난 틱은 뺀다
    @Override
    protected long retryAfterTicks(LeakyBucketState state, long tick, long units) {
        long overflow = TickMath.saturatingSub(TickMath.saturatingAdd(state.getLevel(), units), getCapacity());
        long intervals = TickMath.ceilDiv(overflow, leakAmount);
        long elapsedInInterval = tick - state.getLastLeakTick();
        return TickMath.saturatingSub(TickMath.saturatingMul(intervals, leakInterval), elapsedInInterval);
    }

    @Override
    protected LeakyBucketState copyOf(LeakyBucketState state) {
        return state.copy();
    }

    public long getLeakInterval() {
        return leakInterval;
    }

    public long getLeakAmount() {
        return leakAmount;
    }

    @Override
    public String getAlgorithmName() {
        return RateLimitAlgorithm.LEAKY_BUCKET.getId();
    }
}
