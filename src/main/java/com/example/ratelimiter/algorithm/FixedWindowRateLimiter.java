package com.example.ratelimiter.algorithm;

import com.example.ratelimiter.core.AbstractRateLimiter;
import com.example.ratelimiter.model.FixedWindowState;
import com.example.ratelimiter.util.TickMath;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed Window Counter Algorithm
 *
 * 동작 원리:
 * - 틱을 windowTicks 단위의 정렬된 윈도우로 나누고 윈도우 안의 획득 유닛을 카운트
 * - 새 윈도우의 틱이 들어오면 카운터를 한 번 리셋
 * - 윈도우 끝과 다음 윈도우 시작에 각각 capacity 만큼 몰릴 수 있음 (알고리즘 특성)
 */
@Slf4j
public class FixedWindowRateLimiter extends AbstractRateLimiter<FixedWindowState> {

    private final long windowTicks;

    /**
     * @param capacity 윈도우 내 최대 유닛 수
     * @param windowTicks 윈도우 크기 (틱)
     */
    public FixedWindowRateLimiter(long capacity, long windowTicks) {
        super(capacity, new FixedWindowState());
        this.windowTicks = TickMath.requirePositive(windowTicks, "windowTicks");

        log.debug("FixedWindowRateLimiter initialized - capacity: {}, windowTicks: {}", capacity, windowTicks);
    }

    @Override
    protected long minAcceptableTick(FixedWindowState state) {
        return state.getWindowStart();
    }

    //새 윈도우로 넘어갔으면 카운터 리셋
    @Override
    protected void advance(FixedWindowState state, long tick) {
        long windowStart = TickMath.alignDown(tick, windowTicks);
        if (windowStart != state.getWindowStart()) {
            log.trace("Window reset - previous start: {}, new start: {}, dropped count: {}",
                    state.getWindowStart(), windowStart, state.getCount());
            state.setCount(0);
            state.setWindowStart(windowStart);
        }
    }

    @Override
    protected long available(FixedWindowState state, long tick) {
        return TickMath.saturatingSub(getCapacity(), state.getCount());
    }

    @Override
    protected void consume(FixedWindowState state, long tick, long units) {
        state.setCount(state.getCount() + units);
    }

    //다음 윈도우 시작까지 남은 틱
    @Override
    protected long retryAfterTicks(FixedWindowState state, long tick, long units) {
        long nextWindowStart = TickMath.saturatingAdd(state.getWindowStart(), windowTicks);
        return TickMath.saturatingSub(nextWindowStart, tick);
    }

    @Override
    protected FixedWindowState copyOf(FixedWindowState state) {
        return state.copy();
    }

    public long getWindowTicks() {
        return windowTicks;
    }

    @Override
    public String getAlgorithmName() {
        return RateLimitAlgorithm.FIXED_WINDOW.getId();
    }
}
