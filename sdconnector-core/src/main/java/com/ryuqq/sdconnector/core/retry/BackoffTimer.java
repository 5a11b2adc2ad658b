package com.ryuqq.sdconnector.core.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 재시도 대기 SPI.
 *
 * <p>Resilient Invoker는 재시도 사이의 대기를 이 인터페이스로 수행합니다.
 * 테스트에서는 실제로 대기하지 않고 요청된 지연만 기록하는 구현을 주입합니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public interface BackoffTimer {

    /**
     * 호출 스레드를 지정 시간 동안 블로킹.
     *
     * @param delay 대기 시간
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    void pause(Duration delay) throws InterruptedException;

    /**
     * 지정 시간 후 완료되는 Future (비블로킹).
     *
     * @param delay 대기 시간
     * @return delay 경과 후 완료되는 Future
     */
    CompletableFuture<Void> delay(Duration delay);

    /**
     * 실제 시간을 사용하는 기본 구현.
     *
     * @return Thread.sleep / CompletableFuture.delayedExecutor 기반 타이머
     */
    static BackoffTimer system() {
        return SystemBackoffTimer.INSTANCE;
    }
}
