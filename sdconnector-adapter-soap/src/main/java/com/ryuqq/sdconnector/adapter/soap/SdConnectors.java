package com.ryuqq.sdconnector.adapter.soap;

import com.ryuqq.sdconnector.application.facade.AsyncSdConnector;
import com.ryuqq.sdconnector.application.facade.SdConnector;
import com.ryuqq.sdconnector.application.invoker.AsyncResilientInvoker;
import com.ryuqq.sdconnector.application.invoker.ResilientInvoker;
import com.ryuqq.sdconnector.application.registry.AsyncOperationRegistry;
import com.ryuqq.sdconnector.application.registry.OperationRegistry;
import com.ryuqq.sdconnector.application.registry.SessionCache;
import com.ryuqq.sdconnector.core.model.Credentials;
import com.ryuqq.sdconnector.core.normalizer.ParameterNormalizer;
import com.ryuqq.sdconnector.core.retry.BackoffTimer;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * SD Connector 생성 진입점.
 *
 * <p>Credentials별 전송 세션을 {@link SessionCache}로 공유합니다. 같은 Credentials로 여러 번
 * 연결하면 같은 세션(HTTP 클라이언트와 디스크립터 캐시)을 재사용하며, 마지막 Connector가
 * 닫힐 때 세션이 종료됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * // 블로킹
 * try (SdConnector sd = SdConnectors.connect("user", "secret")) {
 *     ResponseRecord person = sd.getPerson(PersonQuery.of("XY"));
 * }
 *
 * // 비블로킹
 * SdConnectors.connectAsync("user", "secret")
 *     .thenCompose(sd -> sd.getPerson(PersonQuery.of("XY")).whenComplete((r, e) -> sd.close()));
 * }</pre>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class SdConnectors {

    private static final SdConnectors DEFAULT = new SdConnectors(SoapClientConfig.defaults());

    private final SoapClientConfig config;
    private final BackoffTimer timer;
    private final Clock clock;
    private final SessionCache<SoapSession> sessions;
    private final SessionCache<AsyncSoapSession> asyncSessions;

    public SdConnectors(SoapClientConfig config) {
        this(config, BackoffTimer.system(), Clock.systemDefaultZone());
    }

    /**
     * 생성자.
     *
     * @param config 전송 설정
     * @param timer 재시도 대기 타이머
     * @param clock 기간 기본값("오늘") 기준 Clock
     */
    public SdConnectors(SoapClientConfig config, BackoffTimer timer, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timer == null) {
            throw new IllegalArgumentException("timer cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.timer = timer;
        this.clock = clock;
        this.sessions = new SessionCache<>(credentials -> new SoapSession(credentials, config), SoapSession::close);
        this.asyncSessions = new SessionCache<>(
            credentials -> new AsyncSoapSession(credentials, config),
            AsyncSoapSession::close
        );
    }

    /**
     * 기본 설정으로 블로킹 Connector 생성.
     *
     * @param username SD 사용자 이름
     * @param password SD 비밀번호
     * @return 모든 Operation이 바인딩된 SdConnector
     */
    public static SdConnector connect(String username, String password) {
        return DEFAULT.connect(Credentials.of(username, password));
    }

    /**
     * 기본 설정으로 비블로킹 Connector 생성.
     *
     * @param username SD 사용자 이름
     * @param password SD 비밀번호
     * @return 모든 Operation이 바인딩된 뒤 완료되는 Future
     */
    public static CompletableFuture<AsyncSdConnector> connectAsync(String username, String password) {
        return DEFAULT.connectAsync(Credentials.of(username, password));
    }

    /**
     * 블로킹 Connector 생성.
     *
     * <p>모든 디스크립터를 호출 스레드에서 가져와 바인딩합니다.</p>
     *
     * @param credentials 인증 정보
     * @return SdConnector (close 시 세션 참조 반환)
     * @throws com.ryuqq.sdconnector.core.exception.RegistryConstructionException 바인딩 실패 시
     */
    public SdConnector connect(Credentials credentials) {
        SessionCache.Lease<SoapSession> lease = sessions.acquire(credentials);
        OperationRegistry registry;
        try {
            registry = new OperationRegistry(new SoapOperationBinder(lease.session()), config.locators());
        } catch (RuntimeException e) {
            lease.release();
            throw e;
        }
        return new SdConnector(
            new ResilientInvoker(registry, config.retryPolicy(), timer),
            new ParameterNormalizer(clock),
            lease::release
        );
    }

    /**
     * 비블로킹 Connector 생성.
     *
     * @param credentials 인증 정보
     * @return AsyncSdConnector Future (바인딩 실패 시 RegistryConstructionException으로 완료)
     */
    public CompletableFuture<AsyncSdConnector> connectAsync(Credentials credentials) {
        SessionCache.Lease<AsyncSoapSession> lease = asyncSessions.acquire(credentials);
        AsyncSoapOperationBinder binder = new AsyncSoapOperationBinder(lease.session(), lease::release);
        return AsyncOperationRegistry.create(binder, config.locators())
            .thenApply(registry -> new AsyncSdConnector(
                new AsyncResilientInvoker(registry, config.retryPolicy(), timer),
                new ParameterNormalizer(clock)
            ));
    }

    public SoapClientConfig config() {
        return config;
    }

    /**
     * 현재 열려 있는 세션 수 (블로킹 + 비블로킹).
     *
     * @return 세션 수
     */
    public int openSessions() {
        return sessions.size() + asyncSessions.size();
    }
}
