package com.example.ratelimiter.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token Bucket에서 사용되는 버킷 상태 클래스
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenBucketState {
    private long available; // 현재 토큰 수
    private long lastRefillTick; // 마지막 보충 틱 (항상 refillInterval의 배수)

    //가득 찬 버킷 생성
    public static TokenBucketState createFull(long capacity) {
        return new TokenBucketState(capacity, 0);
    }

    public TokenBucketState copy() {
        return new TokenBucketState(available, lastRefillTick);
    }
}
