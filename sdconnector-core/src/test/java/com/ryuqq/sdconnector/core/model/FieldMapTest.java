package com.ryuqq.sdconnector.core.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FieldMap 테스트.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
class FieldMapTest {

    @Test
    void build_null값은_생략된다() {
        // when
        FieldMap fields = FieldMap.builder()
            .put("InstitutionIdentifier", "XY")
            .put("DepartmentIdentifier", (String) null)
            .put("ActivationDate", (LocalDate) null)
            .build();

        // then
        assertThat(fields.names()).containsExactly("InstitutionIdentifier");
        assertThat(fields.contains("DepartmentIdentifier")).isFalse();
    }

    @Test
    void build_삽입_순서를_유지한다() {
        // when
        FieldMap fields = FieldMap.builder()
            .put("UUIDIndicator", true)
            .put("ActivationDate", LocalDate.of(2024, 1, 2))
            .put("ActivationTime", LocalTime.of(0, 0))
            .put("InstitutionIdentifier", "XY")
            .build();

        // then
        assertThat(fields.names())
            .containsExactly("UUIDIndicator", "ActivationDate", "ActivationTime", "InstitutionIdentifier");
        assertThat(fields.get("UUIDIndicator")).isEqualTo(Boolean.TRUE);
        assertThat(fields.size()).isEqualTo(4);
    }

    @Test
    void put_같은_이름이면_값만_교체된다() {
        // when
        FieldMap fields = FieldMap.builder()
            .put("A", "1")
            .put("B", "2")
            .put("A", "3")
            .build();

        // then
        assertThat(fields.names()).containsExactly("A", "B");
        assertThat(fields.get("A")).isEqualTo("3");
    }

    @Test
    void putAll_다른_FieldMap을_이어붙인다() {
        // given
        FieldMap window = FieldMap.builder()
            .put("ActivationDate", LocalDate.of(2024, 5, 1))
            .build();

        // when
        FieldMap fields = FieldMap.builder()
            .put("InstitutionIdentifier", "XY")
            .putAll(window)
            .putAll(FieldMap.empty())
            .build();

        // then
        assertThat(fields.names()).containsExactly("InstitutionIdentifier", "ActivationDate");
    }

    @Test
    void put_빈_이름이면_예외() {
        assertThatThrownBy(() -> FieldMap.builder().put(" ", "x"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null or blank");
    }

    @Test
    void asMap_수정_불가() {
        FieldMap fields = FieldMap.builder().put("A", "1").build();

        assertThatThrownBy(() -> fields.asMap().put("B", "2"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void equals_같은_필드면_동일() {
        FieldMap first = FieldMap.builder().put("A", "1").put("B", false).build();
        FieldMap second = FieldMap.builder().put("A", "1").put("B", false).build();

        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(FieldMap.builder().build()).isSameAs(FieldMap.empty());
    }
}
