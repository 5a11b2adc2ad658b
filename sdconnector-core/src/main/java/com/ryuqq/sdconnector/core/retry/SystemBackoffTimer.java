package com.ryuqq.sdconnector.core.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 실제 시간 기반 {@link BackoffTimer}.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
final class SystemBackoffTimer implements BackoffTimer {

    static final SystemBackoffTimer INSTANCE = new SystemBackoffTimer();

    private SystemBackoffTimer() {
    }

    @Override
    public void pause(Duration delay) throws InterruptedException {
        Thread.sleep(delay.toMillis());
    }

    @Override
    public CompletableFuture<Void> delay(Duration delay) {
        return CompletableFuture.runAsync(
            () -> { },
            CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)
        );
    }
}
