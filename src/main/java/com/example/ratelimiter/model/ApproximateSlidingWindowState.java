package com.example.ratelimiter.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Approximate Sliding Window에서 사용되는 두 개의 교대 윈도우 상태 클래스
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApproximateSlidingWindowState {
    private long[] windows; // 윈도우별 획득 유닛 수
    private long[] windowStarts; // 윈도우별 시작 틱
    private int currentIndex; // 가장 최근 틱을 포함하는 윈도우 (0 또는 1)

    public static ApproximateSlidingWindowState createApproximateSlidingWindow() {
        return new ApproximateSlidingWindowState(new long[2], new long[2], 0);
    }

    //반대쪽 윈도우 인덱스
    public int getOtherIndex() {
        return currentIndex ^ 1;
    }

    public ApproximateSlidingWindowState copy() {
        return new ApproximateSlidingWindowState(windows.clone(), windowStarts.clone(), currentIndex);
    }
}
