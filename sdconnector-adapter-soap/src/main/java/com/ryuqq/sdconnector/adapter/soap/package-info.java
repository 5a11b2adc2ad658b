/**
 * SD 웹서비스 SOAP 어댑터.
 *
 * <p>Core의 Binder SPI를 {@code java.net.http.HttpClient}와 Woodstox(StAX)로 구현합니다.</p>
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.sdconnector.adapter.soap.WsdlParser}: WSDL → ServiceDescriptor</li>
 *   <li>{@link com.ryuqq.sdconnector.adapter.soap.SoapEnvelopeWriter}: FieldMap → SOAP Envelope</li>
 *   <li>{@link com.ryuqq.sdconnector.adapter.soap.SoapResponseReader}: SOAP 응답 → ResponseRecord</li>
 *   <li>{@link com.ryuqq.sdconnector.adapter.soap.SoapSession} /
 *       {@link com.ryuqq.sdconnector.adapter.soap.AsyncSoapSession}: Credentials별 전송 세션</li>
 *   <li>{@link com.ryuqq.sdconnector.adapter.soap.SdConnectors}: Connector 생성 진입점</li>
 * </ul>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
package com.ryuqq.sdconnector.adapter.soap;
