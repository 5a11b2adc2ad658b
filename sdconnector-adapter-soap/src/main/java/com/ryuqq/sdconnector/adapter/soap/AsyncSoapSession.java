package com.ryuqq.sdconnector.adapter.soap;

import com.ryuqq.sdconnector.core.exception.ResourceReleaseException;
import com.ryuqq.sdconnector.core.model.Credentials;
import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.model.ResponseRecord;
import com.ryuqq.sdconnector.core.spi.OperationSpec;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Credentials별 비블로킹 SOAP 세션.
 *
 * <p>세션은 전용 작업 스레드 풀을 소유하며 {@link HttpClient}의 비동기 처리와
 * 응답 해석이 이 풀에서 수행됩니다. 사용이 끝나면 {@link #close()}로 풀을 종료해야 합니다.</p>
 *
 * <p><strong>종료:</strong></p>
 * <ul>
 *   <li>shutdown 후 requestTimeout 동안 대기</li>
 *   <li>대기 시간 안에 끝나지 않으면 shutdownNow 후 {@link ResourceReleaseException}</li>
 * </ul>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class AsyncSoapSession {

    private static final Logger log = LoggerFactory.getLogger(AsyncSoapSession.class);

    private final String username;
    private final String authorization;
    private final SoapClientConfig config;
    private final ExecutorService executor;
    private final HttpClient http;
    private final WsdlParser parser = new WsdlParser();
    private final SoapEnvelopeWriter writer = new SoapEnvelopeWriter();
    private final SoapResponseReader reader = new SoapResponseReader();
    private final ConcurrentMap<String, CompletableFuture<ServiceDescriptor>> descriptors = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public AsyncSoapSession(Credentials credentials, SoapClientConfig config) {
        if (credentials == null) {
            throw new IllegalArgumentException("credentials cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.username = credentials.username();
        this.authorization = SoapExchange.basicAuthorization(credentials);
        this.config = config;
        this.executor = Executors.newFixedThreadPool(config.asyncThreads(), new SessionThreadFactory(username));
        this.http = HttpClient.newBuilder()
            .connectTimeout(config.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .executor(executor)
            .build();
        log.info("Opened async SD session for {} at {}", username, config.baseUrl());
    }

    /**
     * 서비스 디스크립터 조회 (세션 내 캐시, 실패한 조회는 캐시하지 않음).
     *
     * @param locator 디스크립터 위치
     * @return ServiceDescriptor Future ({@link DescriptorLoadException}으로 실패 가능)
     */
    public CompletableFuture<ServiceDescriptor> describe(String locator) {
        CompletableFuture<ServiceDescriptor> pending = descriptors.computeIfAbsent(locator, this::load);
        pending.whenComplete((descriptor, failure) -> {
            if (failure != null) {
                descriptors.remove(locator, pending);
            }
        });
        return pending;
    }

    /**
     * Operation 호출 (한 번, 재시도 없음).
     *
     * @param operation 호출할 Operation
     * @param fields 요청 필드
     * @return 응답 Future ({@link SoapCallException} / {@link SoapFaultException}으로 실패 가능)
     */
    public CompletableFuture<ResponseRecord> call(OperationSpec operation, FieldMap fields) {
        String envelope;
        try {
            envelope = writer.write(operation, fields);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("Calling {} at {} with {} fields (async)", operation.name(), operation.endpoint(), fields.size());

        return http.sendAsync(
                SoapExchange.callRequest(operation, envelope, authorization, config.requestTimeout()),
                HttpResponse.BodyHandlers.ofString()
            )
            .handle((response, failure) -> {
                if (failure != null) {
                    throw SoapExchange.callFailure(operation, unwrap(failure));
                }
                return SoapExchange.callResult(operation, response, reader);
            });
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * 작업 스레드 풀 종료.
     *
     * @throws ResourceReleaseException 제한 시간 안에 종료되지 않았거나 대기 중 인터럽트된 경우
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        descriptors.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.requestTimeoutMs(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                throw new ResourceReleaseException(
                    "Async SD session for " + username + " did not terminate within " + config.requestTimeoutMs() + "ms"
                );
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw new ResourceReleaseException("Interrupted while closing async SD session for " + username, e);
        }
        log.info("Closed async SD session for {}", username);
    }

    private CompletableFuture<ServiceDescriptor> load(String locator) {
        URI uri = SdServiceCatalog.resolve(config.baseUrl(), locator);
        log.debug("Fetching service descriptor {} (async)", uri);
        return fetch(uri)
            .thenCompose(wsdl -> resolveSchemas(locator, parser.read(locator, uri, wsdl)))
            .thenApply(WsdlParser.Document::toDescriptor);
    }

    private CompletableFuture<WsdlParser.Document> resolveSchemas(String locator, WsdlParser.Document document) {
        URI schema = document.nextSchema();
        if (schema == null) {
            return CompletableFuture.completedFuture(document);
        }
        log.debug("Fetching schema {} for {} (async)", schema, locator);
        return fetch(schema).thenCompose(xsd -> {
            document.addSchema(schema, xsd);
            return resolveSchemas(locator, document);
        });
    }

    private CompletableFuture<String> fetch(URI uri) {
        return http.sendAsync(
                SoapExchange.descriptorRequest(uri, authorization, config.requestTimeout()),
                HttpResponse.BodyHandlers.ofString()
            )
            .handle((response, failure) -> {
                if (failure != null) {
                    throw SoapExchange.descriptorFailure(uri, unwrap(failure));
                }
                return SoapExchange.descriptorBody(uri, response);
            });
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class SessionThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private SessionThreadFactory(String username) {
            this.prefix = "sd-soap-" + username + "-";
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
