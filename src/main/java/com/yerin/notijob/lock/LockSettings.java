package com.yerin.notijob.lock;

/**
 * 쿼럼 락 재시도 설정.
 *
 * @param driftFactor   TTL 대비 시계 오차 비율
 * @param retryCount    첫 시도 이후 재시도 횟수
 * @param retryDelayMs  재시도 간격
 * @param retryJitterMs 재시도 간격에 더해지는 최대 랜덤 지연
 */
public record LockSettings(
        double driftFactor,
        int retryCount,
        long retryDelayMs,
        long retryJitterMs
) {
    public static final LockSettings DEFAULTS = new LockSettings(0.01, 50, 100, 200);

    public LockSettings {
        if (driftFactor < 0) throw new IllegalArgumentException("driftFactor must be >= 0");
        if (retryCount < 0) throw new IllegalArgumentException("retryCount must be >= 0");
        if (retryDelayMs < 0 || retryJitterMs < 0) throw new IllegalArgumentException("retry delay/jitter must be >= 0");
    }
}
