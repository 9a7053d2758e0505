package com.yerin.notijob.domain.step;

import java.time.Duration;

/**
 * DIGEST/DELAY 스텝의 윈도우 설정. backoff* 필드는 BACKOFF 다이제스트에서만 쓴다.
 */
public record DigestMetadata(
        DigestType type,
        long amount,
        DigestUnit unit,
        String digestKey,
        Long backoffAmount,
        DigestUnit backoffUnit
) {
    public Duration window() {
        if (unit == null || amount <= 0) return Duration.ZERO;
        return unit.times(amount);
    }

    public Duration backoffWindow() {
        if (backoffUnit == null || backoffAmount == null || backoffAmount <= 0) return Duration.ZERO;
        return backoffUnit.times(backoffAmount);
    }
}
