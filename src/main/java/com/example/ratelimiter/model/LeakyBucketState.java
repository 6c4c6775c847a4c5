package com.example.ratelimiter.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Leaky Bucket에서 사용되는 버킷 상태 클래스 (빈 버킷으로 시작)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeakyBucketState {
    private long level; // 현재 버킷에 찬 유닛 수
    private long lastLeakTick; // 마지막 누출 틱 (항상 leakInterval의 배수)

    public LeakyBucketState copy() {
        return new LeakyBucketState(level, lastLeakTick);
    }
}
