package com.example.ratelimiter.algorithm;

import com.example.ratelimiter.core.AbstractRateLimiter;
import com.example.ratelimiter.model.ApproximateSlidingWindowState;
import com.example.ratelimiter.util.TickMath;
import lombok.extern.slf4j.Slf4j;

/**
 * Approximate Sliding Window Algorithm
 *
 * 동작 원리:
 * - windowTicks 크기의 윈도우 두 개를 (tick / windowTicks) % 2 로 번갈아 사용
 * - 현재 윈도우는 전체 가중치(count * windowTicks)로 계산
 * - 이전 윈도우는 슬라이딩 윈도우 [tick - windowTicks + 1, tick]과 겹치는 틱 수만큼만 가중
 * - 가중 합계가 capacity * windowTicks 이하이면 허용
 *
 * Sliding Window Counter의 O(bucketCount) 상태 대신 O(1) 상태로 슬라이딩 윈도우를 선형 근사한다.
 */
@Slf4j
public class ApproximateSlidingWindowRateLimiter extends AbstractRateLimiter<ApproximateSlidingWindowState> {

    private final long windowTicks;

    /**
     * @param capacity 슬라이딩 윈도우 내 최대 유닛 수 (근사)
     * @param windowTicks 윈도우 크기 (틱)
     */
    public ApproximateSlidingWindowRateLimiter(long capacity, long windowTicks) {
        super(capacity, ApproximateSlidingWindowState.createApproximateSlidingWindow());
        this.windowTicks = TickMath.requirePositive(windowTicks, "windowTicks");

        log.debug("ApproximateSlidingWindowRateLimiter initialized - capacity: {}, windowTicks: {}",
                capacity, windowTicks);
    }

    //두 윈도우 중 더 늦은 시작 틱
    @Override
    protected long minAcceptableTick(ApproximateSlidingWindowState state) {
        return Math.max(state.getWindowStarts()[0], state.getWindowStarts()[1]);
    }

    /**
     * 틱이 속한 윈도우로 전환한다. 슬롯의 시작 틱이 다르면 리셋하고,
     * 반대쪽 윈도우가 한 윈도우 이상 뒤처졌으면 완전히 만료된 것으로 보고 같이 리셋한다.
     */
    @Override
    protected void advance(ApproximateSlidingWindowState state, long tick) {
        int expectedIndex = (int) ((tick / windowTicks) % 2);
        long expectedStart = TickMath.alignDown(tick, windowTicks);
        long[] windows = state.getWindows();
        long[] starts = state.getWindowStarts();

        if (expectedIndex == state.getCurrentIndex() && starts[expectedIndex] == expectedStart) {
            return;
        }
        state.setCurrentIndex(expectedIndex);

        if (starts[expectedIndex] != expectedStart) {
            log.trace("Window switched - index: {}, previous start: {}, new start: {}, dropped count: {}",
                    expectedIndex, starts[expectedIndex], expectedStart, windows[expectedIndex]);
            windows[expectedIndex] = 0;
            starts[expectedIndex] = expectedStart;

            int otherIndex = state.getOtherIndex();
            if (expectedStart > TickMath.saturatingAdd(starts[otherIndex], windowTicks)) {
                log.trace("Other window expired - index: {}, start: {}, dropped count: {}",
                        otherIndex, starts[otherIndex], windows[otherIndex]);
                windows[otherIndex] = 0;
                starts[otherIndex] = expectedStart;
            }
        }
    }

    /**
     * floor((capacity * W - current * W - other * overlap) / W)
     * = capacity - current - ceil(other * overlap / W)
     * 가중치 곱이 포화되지 않도록 두 번째 식으로 계산한다.
     */
    @Override
    protected long available(ApproximateSlidingWindowState state, long tick) {
        long currentCount = state.getWindows()[state.getCurrentIndex()];
        long otherCount = state.getWindows()[state.getOtherIndex()];
        long otherUnits = TickMath.mulDivCeil(otherCount, otherOverlap(state, tick), windowTicks);
        return TickMath.saturatingSub(TickMath.saturatingSub(getCapacity(), currentCount), otherUnits);
    }

    @Override
    protected void consume(ApproximateSlidingWindowState state, long tick, long units) {
        int index = state.getCurrentIndex();
        state.getWindows()[index] = TickMath.saturatingAdd(state.getWindows()[index], units);
    }

    /**
     * 재시도 추정치. 두 가지 감쇠 경로 중 먼저 충분해지는 쪽을 고른다.
     * - 현재 윈도우만으로는 여유가 있으면(current <= capacity - units) 이전 윈도우의 겹침이 줄어드는 틱 수
     * - 아니면 다음 윈도우 전환까지의 틱 + 그 뒤 현재 윈도우가 이전 윈도우가 되어 충분히 줄어드는 틱
     * 부족분이 클수록 추정치도 작아지지 않는다.
     */
    @Override
    protected long retryAfterTicks(ApproximateSlidingWindowState state, long tick, long units) {
        long admissible = getCapacity() - units;
        long currentCount = state.getWindows()[state.getCurrentIndex()];
        long otherCount = state.getWindows()[state.getOtherIndex()];

        if (currentCount <= admissible && otherCount > 0) {
            // other * (overlap - k) <= (admissible - current) * W 를 만족하는 최소 k
            long overlap = otherOverlap(state, tick);
            long allowedOverlap = TickMath.mulDivFloor(admissible - currentCount, windowTicks, otherCount);
            return TickMath.saturatingSub(overlap, allowedOverlap);
        }

        long currentStart = state.getWindowStarts()[state.getCurrentIndex()];
        long untilRollover = TickMath.saturatingSub(TickMath.saturatingAdd(currentStart, windowTicks), tick);
        if (currentCount == 0) {
            return untilRollover;
        }
        // 전환 후 k 틱이 지나면 현재 윈도우의 겹침은 W - 1 - k
        long allowedOverlap = TickMath.mulDivFloor(admissible, windowTicks, currentCount);
        long decayTicks = TickMath.saturatingSub(windowTicks - 1, allowedOverlap);
        return TickMath.saturatingAdd(untilRollover, decayTicks);
    }

    @Override
    protected ApproximateSlidingWindowState copyOf(ApproximateSlidingWindowState state) {
        return state.copy();
    }

    //이전 윈도우 구간과 슬라이딩 윈도우 [tick - W + 1, tick]의 교집합 길이
    private long otherOverlap(ApproximateSlidingWindowState state, long tick) {
        long otherStart = state.getWindowStarts()[state.getOtherIndex()];
        long otherEnd = TickMath.saturatingAdd(otherStart, windowTicks - 1);
        long windowHead = TickMath.slidingWindowHead(tick, windowTicks);
        return TickMath.overlapLength(otherStart, otherEnd, windowHead, tick);
    }

    public long getWindowTicks() {
        return windowTicks;
    }

    @Override
    public String getAlgorithmName() {
        return RateLimitAlgorithm.APPROXIMATE_SLIDING_WINDOW.getId();
    }
}
