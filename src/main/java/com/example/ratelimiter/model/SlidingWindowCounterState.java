package com.example.ratelimiter.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sliding Window Counter에서 사용되는 원형 버킷 배열 상태 클래스
 *
 * 슬롯의 값은 저장된 시작 틱이 현재 그 슬롯을 소유하는 정렬 시작 틱과 같을 때만 유효하다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlidingWindowCounterState {
    private long[] buckets; // 슬롯별 획득 유닛 수
    private long[] bucketStarts; // 슬롯별 시작 틱
    private int lastBucketIndex; // 마지막으로 사용한 슬롯

    public static SlidingWindowCounterState createSlidingWindowCounter(int bucketCount) {
        return new SlidingWindowCounterState(new long[bucketCount], new long[bucketCount], 0);
    }

    public SlidingWindowCounterState copy() {
        return new SlidingWindowCounterState(buckets.clone(), bucketStarts.clone(), lastBucketIndex);
    }
}
