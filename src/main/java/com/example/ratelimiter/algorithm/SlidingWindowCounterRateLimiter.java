package com.example.ratelimiter.algorithm;

import com.example.ratelimiter.core.AbstractRateLimiter;
import com.example.ratelimiter.model.SlidingWindowCounterState;
import com.example.ratelimiter.util.TickMath;
import lombok.extern.slf4j.Slf4j;

/**
 * Sliding Window Counter Algorithm
 *
 * 동작 원리:
 * - windowTicks = bucketTicks * bucketCount 크기의 슬라이딩 윈도우를 bucketCount 개의 버킷으로 나눔
 * - 버킷은 원형 배열로 재사용: index = (tick / bucketTicks) % bucketCount
 * - 슬롯은 처음 다시 접근될 때 지연 리셋 (별도 정리 작업 없음)
 * - 시작 틱이 [tick - windowTicks + 1, tick] 안에 있는 버킷만 합산
 */
@Slf4j
public class SlidingWindowCounterRateLimiter extends AbstractRateLimiter<SlidingWindowCounterState> {

    private final long bucketTicks;
    private final int bucketCount;
    private final long windowTicks;

    /**
     * @param capacity 윈도우 내 최대 유닛 수
     * @param bucketTicks 버킷 하나의 크기 (틱)
     * @param bucketCount 버킷 개수
     */
    public SlidingWindowCounterRateLimiter(long capacity, long bucketTicks, int bucketCount) {
        super(capacity, SlidingWindowCounterState.createSlidingWindowCounter(
                (int) TickMath.requirePositive(bucketCount, "bucketCount")));
        this.bucketTicks = TickMath.requirePositive(bucketTicks, "bucketTicks");
        this.bucketCount = bucketCount;
        this.windowTicks = TickMath.saturatingMul(bucketTicks, bucketCount);

        log.debug("SlidingWindowCounterRateLimiter initialized - capacity: {}, bucketTicks: {}, bucketCount: {}, windowTicks: {}",
                capacity, bucketTicks, bucketCount, windowTicks);
    }

    @Override
    protected long minAcceptableTick(SlidingWindowCounterState state) {
        return state.getBucketStarts()[state.getLastBucketIndex()];
    }

    //현재 틱의 슬롯이 이전 주기의 값이면 리셋하고 새 시작 틱을 기록
    @Override
    protected void advance(SlidingWindowCounterState state, long tick) {
        int index = bucketIndex(tick);
        long bucketStart = TickMath.alignDown(tick, bucketTicks);
        long[] starts = state.getBucketStarts();
        if (starts[index] != bucketStart) {
            log.trace("Bucket re-stamped - index: {}, previous start: {}, new start: {}, dropped count: {}",
                    index, starts[index], bucketStart, state.getBuckets()[index]);
            state.getBuckets()[index] = 0;
            starts[index] = bucketStart;
        }
        state.setLastBucketIndex(index);
    }

    @Override
    protected long available(SlidingWindowCounterState state, long tick) {
        return TickMath.saturatingSub(getCapacity(), usedInWindow(state, tick));
    }

    @Override
    protected void consume(SlidingWindowCounterState state, long tick, long units) {
        int index = bucketIndex(tick);
        state.getBuckets()[index] = TickMath.saturatingAdd(state.getBuckets()[index], units);
    }

    /**
     * 오래된 버킷부터 순서대로 만료시키며 요청이 들어갈 자리가 생기는 시점을 찾는다.
     * 버킷은 시작 틱 + windowTicks 에 윈도우를 벗어난다.
     */
    @Override
    protected long retryAfterTicks(SlidingWindowCounterState state, long tick, long units) {
        long windowHead = TickMath.slidingWindowHead(tick, windowTicks);
        long currentIndex = bucketIndex(tick);
        long currentStart = TickMath.alignDown(tick, bucketTicks);
        long[] buckets = state.getBuckets();
        long[] starts = state.getBucketStarts();

        long free = available(state, tick);
        for (int offset = 1; offset <= bucketCount; offset++) {
            int index = (int) ((currentIndex + offset) % bucketCount);
            long distance = TickMath.saturatingMul(bucketCount - offset, bucketTicks);
            if (distance > currentStart) {
                continue;
            }
            long expectedStart = currentStart - distance;
            if (starts[index] != expectedStart || expectedStart < windowHead) {
                continue;
            }
            free = TickMath.saturatingAdd(free, buckets[index]);
            if (free >= units) {
                return TickMath.saturatingSub(TickMath.saturatingAdd(expectedStart, windowTicks), tick);
            }
        }
        return windowTicks;
    }

    @Override
    protected SlidingWindowCounterState copyOf(SlidingWindowCounterState state) {
        return state.copy();
    }

    //윈도우 안에 시작 틱이 있는 버킷 합계
    private long usedInWindow(SlidingWindowCounterState state, long tick) {
        long windowHead = TickMath.slidingWindowHead(tick, windowTicks);
        long[] buckets = state.getBuckets();
        long[] starts = state.getBucketStarts();
        long total = 0;
        for (int i = 0; i < bucketCount; i++) {
            if (starts[i] >= windowHead && starts[i] <= tick) {
                total = TickMath.saturatingAdd(total, buckets[i]);
            }
        }
        return total;
    }

    private int bucketIndex(long tick) {
        return (int) ((tick / bucketTicks) % bucketCount);
    }

    public long getBucketTicks() {
        return bucketTicks;
    }

    public int getBucketCount() {
        return bucketCount;
    }

    public long getWindowTicks() {
        return windowTicks;
    }

    @Override
    public String getAlgorithmName() {
        return RateLimitAlgorithm.SLIDING_WINDOW_COUNTER.getId();
    }
}
