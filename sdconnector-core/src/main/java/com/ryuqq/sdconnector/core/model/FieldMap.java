package com.ryuqq.sdconnector.core.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 원격 Operation에 전달되는 요청 필드 집합.
 *
 * <p>필드 이름 → 값의 순서 보존 매핑입니다. 값은 {@link String}, {@link Boolean},
 * {@link LocalDate}, {@link LocalTime} 중 하나입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>키는 원격 Operation이 받는 필드 이름과 정확히 일치합니다.</li>
 *   <li>값이 없는 선택 필드는 null로 전송되지 않고 아예 생략됩니다.</li>
 *   <li>생성 후 변경 불가 (Builder로만 생성)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * FieldMap fields = FieldMap.builder()
 *     .put("InstitutionIdentifier", "XY")
 *     .put("UUIDIndicator", true)
 *     .put("DepartmentIdentifier", (String) null)   // 생략됨
 *     .build();
 * }</pre>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class FieldMap {

    private static final FieldMap EMPTY = new FieldMap(new LinkedHashMap<>());

    private final Map<String, Object> fields;

    private FieldMap(LinkedHashMap<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    /**
     * 빈 FieldMap.
     *
     * @return 필드가 없는 FieldMap
     */
    public static FieldMap empty() {
        return EMPTY;
    }

    /**
     * Builder 생성.
     *
     * @return 새 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 필드 값 조회.
     *
     * @param name 필드 이름
     * @return 값, 필드가 없으면 null
     */
    public Object get(String name) {
        return fields.get(name);
    }

    /**
     * 필드 존재 여부 확인.
     *
     * @param name 필드 이름
     * @return 존재 여부
     */
    public boolean contains(String name) {
        return fields.containsKey(name);
    }

    /**
     * 필드 이름 목록 (삽입 순서).
     *
     * @return 필드 이름 집합
     */
    public Set<String> names() {
        return fields.keySet();
    }

    /**
     * 읽기 전용 Map 뷰.
     *
     * @return 필드 이름 → 값 (삽입 순서)
     */
    public Map<String, Object> asMap() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldMap other = (FieldMap) o;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "FieldMap" + fields;
    }

    /**
     * FieldMap Builder.
     *
     * <p>null 값을 넣으면 해당 필드는 생략됩니다. 같은 이름을 다시 넣으면
     * 값만 교체되고 순서는 처음 위치를 유지합니다.</p>
     */
    public static final class Builder {

        private final LinkedHashMap<String, Object> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String name, String value) {
            return putValue(name, value);
        }

        public Builder put(String name, boolean value) {
            return putValue(name, value);
        }

        public Builder put(String name, LocalDate value) {
            return putValue(name, value);
        }

        public Builder put(String name, LocalTime value) {
            return putValue(name, value);
        }

        /**
         * 다른 FieldMap의 모든 필드 추가.
         *
         * @param other 추가할 필드
         * @return this
         * @throws IllegalArgumentException other가 null인 경우
         */
        public Builder putAll(FieldMap other) {
            if (other == null) {
                throw new IllegalArgumentException("other cannot be null");
            }
            fields.putAll(other.fields);
            return this;
        }

        public FieldMap build() {
            if (fields.isEmpty()) {
                return EMPTY;
            }
            return new FieldMap(new LinkedHashMap<>(fields));
        }

        private Builder putValue(String name, Object value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("field name cannot be null or blank");
            }
            if (value != null) {
                fields.put(name, value);
            }
            return this;
        }
    }
}
