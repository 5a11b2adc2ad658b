package com.ryuqq.sdconnector.core.normalizer;

import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.model.Identifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 식별자 종류(UUID / 코드) 판별기.
 *
 * <p>같은 식별자 슬롯에 대해 원격 서비스는 {@code <Prefix>Identifier}와
 * {@code <Prefix>UUIDIdentifier} 두 필드를 구분해서 받습니다.
 * 이 클래스는 값의 형태를 보고 둘 중 정확히 하나만 생성합니다.</p>
 *
 * <p><strong>판별 규칙:</strong></p>
 * <ol>
 *   <li>값이 없으면 아무 필드도 만들지 않음</li>
 *   <li>UUID 타입이거나 UUID 문법의 문자열이면 {@code <Prefix>UUIDIdentifier} (정규화된 소문자 UUID)</li>
 *   <li>그 외에는 {@code <Prefix>Identifier} (원본 값 그대로)</li>
 * </ol>
 *
 * <p>UUID 파싱 실패는 오류가 아니라 "코드"로 취급합니다. UUID처럼 보이는 값이 파싱에 실패한
 * 경우에만 DEBUG 로그를 남기며, 일반 코드는 로그 없이 처리됩니다.</p>
 *
 * <p>UUID 문법으로 인정하는 형태: 하이픈 위치와 무관한 32자리 16진수,
 * 중괄호({@code {...}}) 또는 {@code urn:uuid:} 접두사 허용.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class IdentifierResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentifierResolver.class);

    static final String IDENTIFIER_SUFFIX = "Identifier";
    static final String UUID_IDENTIFIER_SUFFIX = "UUIDIdentifier";

    private static final Pattern UUID_LAYOUT =
        Pattern.compile("[0-9A-Za-z]{8}-[0-9A-Za-z]{4}-[0-9A-Za-z]{4}-[0-9A-Za-z]{4}-[0-9A-Za-z]{12}");

    private IdentifierResolver() {
    }

    /**
     * 식별자 슬롯의 요청 필드 생성.
     *
     * @param prefix 필드 이름 접두사 (예: Institution)
     * @param value 식별자 (null 가능)
     * @return 0개 또는 1개의 필드를 가진 FieldMap
     * @throws IllegalArgumentException prefix가 null이거나 빈 문자열인 경우
     */
    public static FieldMap resolve(String prefix, Identifier value) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be null or blank");
        }
        if (value == null) {
            return FieldMap.empty();
        }

        Optional<UUID> uuid = value.isTypedUuid() ? value.typedUuid() : parseUuid(value.value());
        if (uuid.isPresent()) {
            return FieldMap.builder()
                .put(prefix + UUID_IDENTIFIER_SUFFIX, uuid.get().toString())
                .build();
        }

        if (looksLikeUuid(value.value())) {
            log.debug("{} value '{}' looks like a UUID but is not one, sending it as {}{}",
                prefix, value.value(), prefix, IDENTIFIER_SUFFIX);
        }
        return FieldMap.builder()
            .put(prefix + IDENTIFIER_SUFFIX, value.value())
            .build();
    }

    /**
     * 문자열의 UUID 해석.
     *
     * @param raw 입력 문자열
     * @return UUID, UUID 문법이 아니면 empty
     */
    static Optional<UUID> parseUuid(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String hex = raw.replace("urn:", "").replace("uuid:", "");
        if (hex.startsWith("{")) {
            hex = hex.substring(1);
        }
        if (hex.endsWith("}")) {
            hex = hex.substring(0, hex.length() - 1);
        }
        hex = hex.replace("-", "");

        if (hex.length() != 32 || !isHex(hex)) {
            return Optional.empty();
        }
        long most = Long.parseUnsignedLong(hex.substring(0, 16), 16);
        long least = Long.parseUnsignedLong(hex.substring(16), 16);
        return Optional.of(new UUID(most, least));
    }

    /**
     * UUID를 의도한 것으로 보이는 값인지.
     *
     * <p>8-4-4-4-12 하이픈 배치이거나, 하이픈을 포함한 16진수 30~40자이면 true.</p>
     */
    static boolean looksLikeUuid(String raw) {
        if (raw == null) {
            return false;
        }
        String trimmed = raw.trim();
        if (UUID_LAYOUT.matcher(trimmed).matches()) {
            return true;
        }
        if (trimmed.length() < 30 || trimmed.length() > 40 || trimmed.indexOf('-') < 0) {
            return false;
        }
        return isHex(trimmed.replace("-", ""));
    }

    private static boolean isHex(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.digit(s.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
