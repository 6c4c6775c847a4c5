package com.example.ratelimiter.algorithm;

import com.example.ratelimiter.core.AbstractRateLimiter;
import com.example.ratelimiter.model.TokenBucketState;
import com.example.ratelimiter.util.TickMath;
import lombok.extern.slf4j.Slf4j;

/**
 * Token Bucket Algorithm
 *
 * 동작 원리:
 * - 가득 찬 버킷으로 시작 (Leaky Bucket과의 차이)
 * - refillInterval 마다 refillAmount 만큼 보충, 용량을 넘지 않음
 * - 토큰이 충분하면 차감하고 허용, 부족하면 거부
 */
@Slf4j
public class TokenBucketRateLimiter extends AbstractRateLimiter<TokenBucketState> {

    private final long refillInterval;
    private final long refillAmount;

    /**
     * @param capacity 버킷 용량 (최대 토큰 수)
     * @param refillInterval 보충 주기 (틱)
     * @param refillAmount 주기마다 보충되는 토큰 수
     */
    public TokenBucketRateLimiter(long capacity, long refillInterval, long refillAmount) {
        super(capacity, TokenBucketState.createFull(capacity));
        this.refillInterval = TickMath.requirePositive(refillInterval, "refillInterval");
        this.refillAmount = TickMath.requirePositive(refillAmount, "refillAmount");

        log.debug("TokenBucketRateLimiter initialized - capacity: {}, refillInterval: {}, refillAmount: {}",
                capacity, refillInterval, refillAmount);
    }

    @Override
    protected long minAcceptableTick(TokenBucketState state) {
        return state.getLastRefillTick();
    }

    //토큰 보충 로직
    @Override
    protected void advance(TokenBucketState state, long tick) {
        long refillTimes = (tick - state.getLastRefillTick()) / refillInterval;
        if (refillTimes > 0) {
            long refilled = TickMath.saturatingMul(refillTimes, refillAmount);
            state.setAvailable(Math.min(getCapacity(), TickMath.saturatingAdd(state.getAvailable(), refilled)));
            state.setLastRefillTick(state.getLastRefillTick() + refillTimes * refillInterval);

            log.trace("Tokens refilled - available: {}, refilled: {}, lastRefillTick: {}",
                    state.getAvailable(), refilled, state.getLastRefillTick());
        }
    }

    @Override
    protected long available(TokenBucketState state, long tick) {
        return state.getAvailable();
    }

    @Override
    protected void consume(TokenBucketState state, long tick, long units) {
        state.setAvailable(state.getAvailable() - units);
    }

    //부족한 토큰이 채워질 때까지 필요한 주기 수, 현재 주기에서 이미 지난 틱은 뺀다
    @Override
    protected long retryAfterTicks(TokenBucketState state, long tick, long units) {
        long missing = units - state.getAvailable();
        long intervals = TickMath.ceilDiv(missing, refillAmount);
        long elapsedInInterval = tick - state.getLastRefillTick();
        return TickMath.saturatingSub(TickMath.saturatingMul(intervals, refillInterval), elapsedInInterval);
    }

    @Override
    protected TokenBucketState copyOf(TokenBucketState state) {
        return state.copy();
    }

    public long getRefillInterval() {
        return refillInterval;
    }

    public long getRefillAmount() {
        return refillAmount;
    }

    @Override
    public String getAlgorithmName() {
        return RateLimitAlgorithm.TOKEN_BUCKET.getId();
    }
}
