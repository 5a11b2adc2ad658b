package com.ryuqq.sdconnector.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 원격 Operation의 구조화된 응답.
 *
 * <p>응답 스키마는 원격 서비스가 정의하므로 이 타입은 필드를 모델링하지 않고
 * 요소 이름 → 값의 트리로만 보관합니다. 값은 다음 중 하나입니다:</p>
 * <ul>
 *   <li>{@link String}: 텍스트만 가진 요소</li>
 *   <li>{@link ResponseRecord}: 자식 요소를 가진 요소</li>
 *   <li>{@link List}: 같은 이름이 반복된 요소 (문서 순서 유지)</li>
 * </ul>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class ResponseRecord {

    private final String name;
    private final Map<String, Object> fields;

    private ResponseRecord(String name, Map<String, Object> fields) {
        this.name = name;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * ResponseRecord 생성.
     *
     * @param name 요소 이름 (예: GetDepartment20111201)
     * @param fields 자식 요소
     * @return ResponseRecord 인스턴스
     * @throws IllegalArgumentException name 또는 fields가 null인 경우
     */
    public static ResponseRecord of(String name, Map<String, Object> fields) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        return new ResponseRecord(name, fields);
    }

    public String name() {
        return name;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /**
     * 텍스트 필드 조회.
     *
     * @param field 요소 이름
     * @return 텍스트, 없으면 null
     * @throws IllegalStateException 값이 텍스트가 아닌 경우
     */
    public String getString(String field) {
        Object value = fields.get(field);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new IllegalStateException("field " + field + " of " + name + " is not text");
    }

    /**
     * 단일 하위 레코드 조회.
     *
     * @param field 요소 이름
     * @return 하위 레코드, 없으면 null
     * @throws IllegalStateException 값이 레코드가 아닌 경우
     */
    public ResponseRecord getRecord(String field) {
        Object value = fields.get(field);
        if (value == null || value instanceof ResponseRecord) {
            return (ResponseRecord) value;
        }
        throw new IllegalStateException("field " + field + " of " + name + " is not a record");
    }

    /**
     * 반복 가능한 하위 레코드 조회.
     *
     * <p>요소가 한 번만 나타나도 한 개짜리 목록으로 반환합니다.</p>
     *
     * @param field 요소 이름
     * @return 하위 레코드 목록, 없으면 빈 목록
     */
    public List<ResponseRecord> getRecords(String field) {
        Object value = fields.get(field);
        if (value == null) {
            return List.of();
        }
        List<ResponseRecord> records = new ArrayList<>();
        if (value instanceof List<?>) {
            for (Object item : (List<?>) value) {
                if (item instanceof ResponseRecord) {
                    records.add((ResponseRecord) item);
                }
            }
        } else if (value instanceof ResponseRecord) {
            records.add((ResponseRecord) value);
        }
        return Collections.unmodifiableList(records);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResponseRecord that = (ResponseRecord) o;
        return name.equals(that.name) && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + fields.hashCode();
    }

    @Override
    public String toString() {
        return name + fields;
    }
}
