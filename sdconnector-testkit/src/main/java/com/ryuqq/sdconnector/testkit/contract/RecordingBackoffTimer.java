package com.ryuqq.sdconnector.testkit.contract;

import com.ryuqq.sdconnector.core.retry.BackoffTimer;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 대기 없이 요청된 지연만 기록하는 BackoffTimer.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public class RecordingBackoffTimer implements BackoffTimer {

    private final List<Duration> delays = new CopyOnWriteArrayList<>();

    @Override
    public void pause(Duration delay) {
        delays.add(delay);
    }

    @Override
    public CompletableFuture<Void> delay(Duration delay) {
        delays.add(delay);
        return CompletableFuture.completedFuture(null);
    }

    /**
     * 요청 순서대로의 지연 목록 (blocking/async 공통).
     */
    public List<Duration> delays() {
        return List.copyOf(delays);
    }

    public void clear() {
        delays.clear();
    }
}
