package com.ryuqq.sdconnector.core.model;

import java.util.Optional;
import java.util.UUID;

/**
 * 호출자가 전달한 식별자 값.
 *
 * <p>불투명한 코드(String) 또는 UUID입니다. UUID 형태의 문자열인지 여부는
 * 여기서 판단하지 않고 {@code IdentifierResolver}가 요청 필드를 만들 때 결정합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class Identifier {

    private final String value;
    private final UUID uuid;

    private Identifier(String value, UUID uuid) {
        this.value = value;
        this.uuid = uuid;
    }

    /**
     * 문자열 식별자 생성.
     *
     * @param value 코드 또는 UUID 문자열
     * @return Identifier 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    public static Identifier of(String value) {
        if (value == null) {
            throw new IllegalArgumentException("identifier value cannot be null");
        }
        return new Identifier(value, null);
    }

    /**
     * UUID 식별자 생성.
     *
     * @param uuid UUID 값
     * @return Identifier 인스턴스
     * @throws IllegalArgumentException uuid가 null인 경우
     */
    public static Identifier of(UUID uuid) {
        if (uuid == null) {
            throw new IllegalArgumentException("identifier uuid cannot be null");
        }
        return new Identifier(uuid.toString(), uuid);
    }

    /**
     * null 허용 변환.
     *
     * @param value 코드 또는 UUID 문자열 (null 가능)
     * @return Identifier, value가 null이면 null
     */
    public static Identifier ofNullable(String value) {
        return value == null ? null : of(value);
    }

    /**
     * null 허용 변환.
     *
     * @param uuid UUID (null 가능)
     * @return Identifier, uuid가 null이면 null
     */
    public static Identifier ofNullable(UUID uuid) {
        return uuid == null ? null : of(uuid);
    }

    /**
     * 원본 값 조회.
     *
     * @return 호출자가 전달한 문자열 (UUID 타입이면 정규화된 문자열)
     */
    public String value() {
        return value;
    }

    /**
     * UUID 타입으로 생성되었는지 확인.
     *
     * @return UUID 타입 여부
     */
    public boolean isTypedUuid() {
        return uuid != null;
    }

    /**
     * UUID 타입으로 생성된 경우의 UUID.
     *
     * @return UUID, 문자열로 생성된 경우 empty
     */
    public Optional<UUID> typedUuid() {
        return Optional.ofNullable(uuid);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identifier that = (Identifier) o;
        return value.equals(that.value) && (uuid == null) == (that.uuid == null);
    }

    @Override
    public int hashCode() {
        return value.hashCode() * 31 + (uuid == null ? 0 : 1);
    }

    @Override
    public String toString() {
        return "Identifier{" + value + (uuid != null ? ", uuid" : "") + '}';
    }
}
