package com.ryuqq.sdconnector.application.registry;

import com.ryuqq.sdconnector.core.model.Credentials;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SessionCache 테스트.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
class SessionCacheTest {

    private final AtomicInteger created = new AtomicInteger();
    private final List<String> closed = new ArrayList<>();
    private final SessionCache<String> cache = new SessionCache<>(
        credentials -> credentials.username() + "#" + created.incrementAndGet(),
        closed::add
    );

    @Test
    void acquire_같은_Credentials는_같은_세션() {
        // when
        SessionCache.Lease<String> first = cache.acquire(Credentials.of("user", "secret"));
        SessionCache.Lease<String> second = cache.acquire(Credentials.of("user", "secret"));

        // then
        assertThat(first.session()).isEqualTo("user#1");
        assertThat(second.session()).isSameAs(first.session());
        assertThat(created.get()).isEqualTo(1);
    }

    @Test
    void acquire_다른_Credentials는_다른_세션() {
        SessionCache.Lease<String> first = cache.acquire(Credentials.of("user", "secret"));
        SessionCache.Lease<String> second = cache.acquire(Credentials.of("user", "other"));

        assertThat(second.session()).isNotEqualTo(first.session());
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    void release_마지막_참조가_해제되면_세션을_닫는다() {
        // given
        Credentials credentials = Credentials.of("user", "secret");
        SessionCache.Lease<String> first = cache.acquire(credentials);
        SessionCache.Lease<String> second = cache.acquire(credentials);

        // when
        first.release();
        first.release();

        // then
        assertThat(closed).isEmpty();
        assertThat(cache.contains(credentials)).isTrue();

        // when
        second.release();

        // then
        assertThat(closed).containsExactly("user#1");
        assertThat(cache.contains(credentials)).isFalse();
        assertThat(cache.acquire(credentials).session()).isEqualTo("user#2");
    }

    @Test
    void acquire_동시_요청에도_세션은_하나만_생성() throws Exception {
        // given
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> sessions = new ArrayList<>();

        // when
        for (int i = 0; i < threads; i++) {
            sessions.add(executor.submit(() -> {
                start.await();
                return cache.acquire(Credentials.of("user", "secret")).session();
            }));
        }
        start.countDown();

        // then
        for (Future<String> session : sessions) {
            assertThat(session.get(5, TimeUnit.SECONDS)).isEqualTo("user#1");
        }
        assertThat(created.get()).isEqualTo(1);
        executor.shutdown();
    }
}
