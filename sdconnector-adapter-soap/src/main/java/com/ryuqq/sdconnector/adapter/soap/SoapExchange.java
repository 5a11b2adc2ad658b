package com.ryuqq.sdconnector.adapter.soap;

import com.ryuqq.sdconnector.core.model.Credentials;
import com.ryuqq.sdconnector.core.model.ResponseRecord;
import com.ryuqq.sdconnector.core.spi.OperationSpec;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * 블로킹/비블로킹 세션이 공유하는 HTTP 요청 작성과 응답 판정.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
final class SoapExchange {

    private static final String CONTENT_TYPE = "text/xml; charset=utf-8";
    private static final int MAX_BODY_IN_MESSAGE = 512;

    private SoapExchange() {
    }

    /**
     * HTTP Basic 인증 헤더 값.
     */
    static String basicAuthorization(Credentials credentials) {
        String token = credentials.username() + ":" + credentials.password();
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    static HttpRequest descriptorRequest(URI uri, String authorization, Duration timeout) {
        return HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Authorization", authorization)
            .GET()
            .build();
    }

    static HttpRequest callRequest(OperationSpec operation, String envelope, String authorization, Duration timeout) {
        return HttpRequest.newBuilder(URI.create(operation.endpoint()))
            .timeout(timeout)
            .header("Authorization", authorization)
            .header("Content-Type", CONTENT_TYPE)
            .header("SOAPAction", "\"" + operation.action() + "\"")
            .POST(HttpRequest.BodyPublishers.ofString(envelope, StandardCharsets.UTF_8))
            .build();
    }

    /**
     * 디스크립터 응답 판정.
     *
     * @throws DescriptorLoadException 2xx가 아닌 경우
     */
    static String descriptorBody(URI uri, HttpResponse<String> response) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return response.body();
        }
        throw new DescriptorLoadException(
            "HTTP " + status + " fetching service descriptor " + uri + " body=" + truncate(response.body())
        );
    }

    /**
     * Operation 응답 판정.
     *
     * <p>2xx는 응답 해석, 500은 Fault가 있으면 {@link SoapFaultException}, 그 외는 {@link SoapCallException}.</p>
     */
    static ResponseRecord callResult(OperationSpec operation, HttpResponse<String> response, SoapResponseReader reader) {
        int status = response.statusCode();
        String body = response.body();
        if (status >= 200 && status < 300) {
            return reader.read(operation.name(), body, status);
        }
        if (status == 500 && body != null && body.contains("Fault")) {
            reader.read(operation.name(), body, status);
        }
        throw new SoapCallException(
            "HTTP " + status + " calling " + operation.name() + " at " + operation.endpoint() + " body=" + truncate(body),
            status
        );
    }

    /**
     * 전송 오류를 재시도 가능한 호출 오류로 변환.
     */
    static SoapCallException callFailure(OperationSpec operation, Throwable cause) {
        if (cause instanceof HttpTimeoutException) {
            return new SoapCallException("Timeout calling " + operation.name() + " at " + operation.endpoint(), cause);
        }
        return new SoapCallException("Error calling " + operation.name() + " at " + operation.endpoint(), cause);
    }

    static DescriptorLoadException descriptorFailure(URI uri, Throwable cause) {
        if (cause instanceof HttpTimeoutException) {
            return new DescriptorLoadException("Timeout fetching service descriptor " + uri, cause);
        }
        return new DescriptorLoadException("Error fetching service descriptor " + uri, cause);
    }

    static String truncate(String s) {
        if (s == null) {
            return null;
        }
        return s.length() <= MAX_BODY_IN_MESSAGE ? s : s.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
