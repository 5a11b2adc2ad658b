package com.ryuqq.sdconnector.application.registry;

import com.ryuqq.sdconnector.core.model.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Credentials별 전송 세션 캐시.
 *
 * <p>같은 Credentials로 요청하면 같은 세션을 돌려줍니다. 세션은 참조 카운트로 관리되며
 * 마지막 {@link Lease}가 해제될 때 closer로 정리되고 캐시에서 제거됩니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>최초 생성과 참조 카운트 변경은 하나의 Lock으로 보호됩니다.</li>
 *   <li>동시에 같은 Credentials로 acquire해도 factory는 한 번만 호출됩니다.</li>
 * </ul>
 *
 * @param <S> 세션 타입
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class SessionCache<S> {

    private static final Logger log = LoggerFactory.getLogger(SessionCache.class);

    private final Function<Credentials, S> factory;
    private final Consumer<S> closer;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Credentials, Entry<S>> entries = new HashMap<>();

    /**
     * 생성자.
     *
     * @param factory Credentials → 새 세션
     * @param closer 마지막 참조가 해제될 때 호출되는 정리 함수
     */
    public SessionCache(Function<Credentials, S> factory, Consumer<S> closer) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (closer == null) {
            throw new IllegalArgumentException("closer cannot be null");
        }
        this.factory = factory;
        this.closer = closer;
    }

    /**
     * 세션 획득 (필요하면 생성).
     *
     * @param credentials 인증 정보
     * @return 세션 Lease
     * @throws IllegalArgumentException credentials가 null인 경우
     */
    public Lease<S> acquire(Credentials credentials) {
        if (credentials == null) {
            throw new IllegalArgumentException("credentials cannot be null");
        }
        lock.lock();
        try {
            Entry<S> entry = entries.get(credentials);
            if (entry == null) {
                entry = new Entry<>(factory.apply(credentials));
                entries.put(credentials, entry);
                log.debug("Created transport session for {}", credentials.username());
            }
            entry.references++;
            return new Lease<>(this, credentials, entry.session);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(Credentials credentials) {
        lock.lock();
        try {
            return entries.containsKey(credentials);
        } finally {
            lock.unlock();
        }
    }

    private void release(Credentials credentials) {
        S toClose = null;
        lock.lock();
        try {
            Entry<S> entry = entries.get(credentials);
            if (entry == null) {
                return;
            }
            entry.references--;
            if (entry.references == 0) {
                entries.remove(credentials);
                toClose = entry.session;
            }
        } finally {
            lock.unlock();
        }

        if (toClose != null) {
            log.debug("Closing transport session for {}", credentials.username());
            closer.accept(toClose);
        }
    }

    private static final class Entry<S> {
        private final S session;
        private int references;

        private Entry(S session) {
            this.session = session;
        }
    }

    /**
     * 캐시된 세션에 대한 참조 하나.
     *
     * <p>{@link #release()}는 여러 번 호출해도 참조를 한 번만 반환합니다.</p>
     *
     * @param <S> 세션 타입
     */
    public static final class Lease<S> {

        private final SessionCache<S> owner;
        private final Credentials credentials;
        private final S session;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Lease(SessionCache<S> owner, Credentials credentials, S session) {
            this.owner = owner;
            this.credentials = credentials;
            this.session = session;
        }

        public S session() {
            return session;
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                owner.release(credentials);
            }
        }
    }
}
