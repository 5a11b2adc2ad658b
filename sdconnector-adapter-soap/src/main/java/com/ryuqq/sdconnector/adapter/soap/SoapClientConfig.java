package com.ryuqq.sdconnector.adapter.soap;

import com.ryuqq.sdconnector.core.retry.RetryPolicy;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

/**
 * SOAP 전송 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>baseUrl: 디스크립터 기본 주소 (기본 {@value SdServiceCatalog#BASE_URL})</li>
 *   <li>locators: 바인딩할 디스크립터 목록 (기본 {@link SdServiceCatalog#LOCATORS})</li>
 *   <li>connectTimeoutMs: 연결 타임아웃 (기본 60000ms)</li>
 *   <li>requestTimeoutMs: 요청당 타임아웃 (기본 60000ms)</li>
 *   <li>retryPolicy: 재시도 정책 (기본 {@link RetryPolicy#defaults()})</li>
 *   <li>asyncThreads: 비블로킹 세션의 작업 스레드 수 (기본 4)</li>
 * </ul>
 *
 * <p><strong>Properties 키:</strong></p>
 * <pre>
 * sd.base-url
 * sd.connect-timeout-ms
 * sd.request-timeout-ms
 * sd.retry.max-attempts
 * sd.retry.initial-delay-ms
 * sd.retry.max-delay-ms
 * sd.async.threads
 * </pre>
 *
 * @author SD Connector Team
 * @since 1.0.0
 * @param baseUrl 디스크립터 기본 주소
 * @param locators 디스크립터 위치 목록 (1개 이상)
 * @param connectTimeoutMs 연결 타임아웃 (밀리초, 양수여야 함)
 * @param requestTimeoutMs 요청 타임아웃 (밀리초, 양수여야 함)
 * @param retryPolicy 재시도 정책
 * @param asyncThreads 비블로킹 작업 스레드 수 (1 이상이어야 함)
 */
public record SoapClientConfig(
    String baseUrl,
    List<String> locators,
    long connectTimeoutMs,
    long requestTimeoutMs,
    RetryPolicy retryPolicy,
    int asyncThreads
) {

    public static final String BASE_URL_KEY = "sd.base-url";
    public static final String CONNECT_TIMEOUT_KEY = "sd.connect-timeout-ms";
    public static final String REQUEST_TIMEOUT_KEY = "sd.request-timeout-ms";
    public static final String MAX_ATTEMPTS_KEY = "sd.retry.max-attempts";
    public static final String INITIAL_DELAY_KEY = "sd.retry.initial-delay-ms";
    public static final String MAX_DELAY_KEY = "sd.retry.max-delay-ms";
    public static final String ASYNC_THREADS_KEY = "sd.async.threads";

    private static final long DEFAULT_TIMEOUT_MS = 60_000L;
    private static final int DEFAULT_ASYNC_THREADS = 4;

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SoapClientConfig {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl cannot be null or blank");
        }
        if (locators == null || locators.isEmpty()) {
            throw new IllegalArgumentException("locators cannot be null or empty");
        }
        if (connectTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "connectTimeoutMs must be positive (current: " + connectTimeoutMs + ")"
            );
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "requestTimeoutMs must be positive (current: " + requestTimeoutMs + ")"
            );
        }
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (asyncThreads <= 0) {
            throw new IllegalArgumentException(
                "asyncThreads must be positive (current: " + asyncThreads + ")"
            );
        }
        baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        locators = List.copyOf(locators);
    }

    /**
     * 기본 설정.
     *
     * @return SD 운영 서비스 기본 설정
     */
    public static SoapClientConfig defaults() {
        return new SoapClientConfig(
            SdServiceCatalog.BASE_URL,
            SdServiceCatalog.LOCATORS,
            DEFAULT_TIMEOUT_MS,
            DEFAULT_TIMEOUT_MS,
            RetryPolicy.defaults(),
            DEFAULT_ASYNC_THREADS
        );
    }

    /**
     * Properties에서 설정 생성.
     *
     * <p>없는 키는 기본값을 사용합니다.</p>
     *
     * @param properties 설정 값
     * @return SoapClientConfig 인스턴스
     * @throws IllegalArgumentException properties가 null이거나 숫자 값이 잘못된 경우
     */
    public static SoapClientConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        SoapClientConfig defaults = defaults();
        RetryPolicy retry = defaults.retryPolicy()
            .withMaxAttempts(intValue(properties, MAX_ATTEMPTS_KEY, defaults.retryPolicy().maxAttempts()))
            .withInitialDelay(Duration.ofMillis(
                longValue(properties, INITIAL_DELAY_KEY, defaults.retryPolicy().initialDelay().toMillis())
            ))
            .withMaxDelay(Duration.ofMillis(
                longValue(properties, MAX_DELAY_KEY, defaults.retryPolicy().maxDelay().toMillis())
            ));

        return new SoapClientConfig(
            properties.getProperty(BASE_URL_KEY, defaults.baseUrl()).trim(),
            defaults.locators(),
            longValue(properties, CONNECT_TIMEOUT_KEY, defaults.connectTimeoutMs()),
            longValue(properties, REQUEST_TIMEOUT_KEY, defaults.requestTimeoutMs()),
            retry,
            intValue(properties, ASYNC_THREADS_KEY, defaults.asyncThreads())
        );
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }

    public Duration requestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }

    /**
     * baseUrl만 변경한 새 인스턴스 생성.
     */
    public SoapClientConfig withBaseUrl(String baseUrl) {
        return new SoapClientConfig(baseUrl, locators, connectTimeoutMs, requestTimeoutMs, retryPolicy, asyncThreads);
    }

    /**
     * locators만 변경한 새 인스턴스 생성.
     */
    public SoapClientConfig withLocators(List<String> locators) {
        return new SoapClientConfig(baseUrl, locators, connectTimeoutMs, requestTimeoutMs, retryPolicy, asyncThreads);
    }

    /**
     * connectTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public SoapClientConfig withConnectTimeoutMs(long connectTimeoutMs) {
        return new SoapClientConfig(baseUrl, locators, connectTimeoutMs, requestTimeoutMs, retryPolicy, asyncThreads);
    }

    /**
     * requestTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public SoapClientConfig withRequestTimeoutMs(long requestTimeoutMs) {
        return new SoapClientConfig(baseUrl, locators, connectTimeoutMs, requestTimeoutMs, retryPolicy, asyncThreads);
    }

    /**
     * retryPolicy만 변경한 새 인스턴스 생성.
     */
    public SoapClientConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new SoapClientConfig(baseUrl, locators, connectTimeoutMs, requestTimeoutMs, retryPolicy, asyncThreads);
    }

    /**
     * asyncThreads만 변경한 새 인스턴스 생성.
     */
    public SoapClientConfig withAsyncThreads(int asyncThreads) {
        return new SoapClientConfig(baseUrl, locators, connectTimeoutMs, requestTimeoutMs, retryPolicy, asyncThreads);
    }

    private static long longValue(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number (current: " + raw + ")", e);
        }
    }

    private static int intValue(Properties properties, String key, int defaultValue) {
        long value = longValue(properties, key, defaultValue);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(key + " is out of int range (current: " + value + ")", e);
        }
    }
}
