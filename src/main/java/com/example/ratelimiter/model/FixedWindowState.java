package com.example.ratelimiter.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fixed Window Counter에서 사용되는 윈도우 상태 클래스
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FixedWindowState {
    private long count; // 현재 윈도우 내 획득 유닛 수
    private long windowStart; // 마지막으로 처리한 틱이 속한 윈도우의 시작 틱

    public FixedWindowState copy() {
        return new FixedWindowState(count, windowStart);
    }
}
