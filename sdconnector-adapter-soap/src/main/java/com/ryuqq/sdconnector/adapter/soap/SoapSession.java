package com.ryuqq.sdconnector.adapter.soap;

import com.ryuqq.sdconnector.core.model.Credentials;
import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.model.ResponseRecord;
import com.ryuqq.sdconnector.core.spi.OperationSpec;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Credentials별 블로킹 SOAP 세션.
 *
 * <p>하나의 {@link HttpClient}를 모든 Operation이 공유합니다. 모든 요청(디스크립터 포함)에
 * HTTP Basic 인증 헤더가 붙으며, 해석한 디스크립터는 세션이 살아 있는 동안 재사용됩니다.</p>
 *
 * <p>모든 호출은 호출 스레드에서 수행됩니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class SoapSession {

    private static final Logger log = LoggerFactory.getLogger(SoapSession.class);

    private final String username;
    private final String authorization;
    private final SoapClientConfig config;
    private final HttpClient http;
    private final WsdlParser parser = new WsdlParser();
    private final SoapEnvelopeWriter writer = new SoapEnvelopeWriter();
    private final SoapResponseReader reader = new SoapResponseReader();
    private final ConcurrentMap<String, ServiceDescriptor> descriptors = new ConcurrentHashMap<>();

    public SoapSession(Credentials credentials, SoapClientConfig config) {
        if (credentials == null) {
            throw new IllegalArgumentException("credentials cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.username = credentials.username();
        this.authorization = SoapExchange.basicAuthorization(credentials);
        this.config = config;
        this.http = HttpClient.newBuilder()
            .connectTimeout(config.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
        log.info("Opened SD session for {} at {}", username, config.baseUrl());
    }

    /**
     * 서비스 디스크립터 조회 (세션 내 캐시).
     *
     * @param locator 디스크립터 위치
     * @return ServiceDescriptor
     * @throws DescriptorLoadException 조회/해석 실패 시
     */
    public ServiceDescriptor describe(String locator) {
        ServiceDescriptor cached = descriptors.get(locator);
        if (cached != null) {
            return cached;
        }
        ServiceDescriptor loaded = load(locator);
        ServiceDescriptor existing = descriptors.putIfAbsent(locator, loaded);
        return existing != null ? existing : loaded;
    }

    /**
     * Operation 호출 (한 번, 재시도 없음).
     *
     * @param operation 호출할 Operation
     * @param fields 요청 필드
     * @return 응답 레코드
     * @throws SoapCallException 전송 실패, 2xx가 아닌 상태, 타임아웃
     * @throws SoapFaultException SOAP Fault 응답
     */
    public ResponseRecord call(OperationSpec operation, FieldMap fields) {
        String envelope = writer.write(operation, fields);
        log.debug("Calling {} at {} with {} fields", operation.name(), operation.endpoint(), fields.size());
        try {
            HttpResponse<String> response = http.send(
                SoapExchange.callRequest(operation, envelope, authorization, config.requestTimeout()),
                HttpResponse.BodyHandlers.ofString()
            );
            return SoapExchange.callResult(operation, response, reader);
        } catch (IOException e) {
            throw SoapExchange.callFailure(operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SoapCallException("Interrupted while calling " + operation.name(), e);
        }
    }

    /**
     * 세션 종료.
     *
     * <p>캐시된 디스크립터를 비웁니다.</p>
     */
    public void close() {
        descriptors.clear();
        log.info("Closed SD session for {}", username);
    }

    private ServiceDescriptor load(String locator) {
        URI uri = SdServiceCatalog.resolve(config.baseUrl(), locator);
        log.debug("Fetching service descriptor {}", uri);
        WsdlParser.Document document = parser.read(locator, uri, fetch(uri));
        URI schema;
        while ((schema = document.nextSchema()) != null) {
            log.debug("Fetching schema {} for {}", schema, locator);
            document.addSchema(schema, fetch(schema));
        }
        return document.toDescriptor();
    }

    private String fetch(URI uri) {
        try {
            HttpResponse<String> response = http.send(
                SoapExchange.descriptorRequest(uri, authorization, config.requestTimeout()),
                HttpResponse.BodyHandlers.ofString()
            );
            return SoapExchange.descriptorBody(uri, response);
        } catch (IOException e) {
            throw SoapExchange.descriptorFailure(uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DescriptorLoadException("Interrupted while fetching service descriptor " + uri, e);
        }
    }
}
