package com.yerin.notijob.infra.backoff;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

public final class Backoff {
    private Backoff() {}

    public static Duration expJitter(int retryCount, long baseMillis, long capMillis, double jitterRatio) {
        return expJitter(retryCount, baseMillis, capMillis, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * base * 2^retryCount 를 cap 으로 자른 뒤 1±jitterRatio 배로 흔든다.
     *
     * @param random [0, 1) 난수 공급자
     */
    public static Duration expJitter(int retryCount, long baseMillis, long capMillis, double jitterRatio, DoubleSupplier random) {
        double exp = baseMillis * Math.pow(2, Math.max(0, retryCount));
        long capped = (long) Math.min(exp, (double) capMillis);
        double jitter = 1.0 + (random.getAsDouble() * 2 - 1) * jitterRatio; // 1±r
        long withJitter = Math.max(0, (long) (capped * jitter));
        return Duration.ofMillis(withJitter);
    }
}
