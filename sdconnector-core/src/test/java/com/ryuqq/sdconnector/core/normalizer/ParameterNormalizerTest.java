package com.ryuqq.sdconnector.core.normalizer;

import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.query.DepartmentParentQuery;
import com.ryuqq.sdconnector.core.query.DepartmentQuery;
import com.ryuqq.sdconnector.core.query.EmploymentChangedAtDateQuery;
import com.ryuqq.sdconnector.core.query.EmploymentQuery;
import com.ryuqq.sdconnector.core.query.InstitutionQuery;
import com.ryuqq.sdconnector.core.query.PersonQuery;
import com.ryuqq.sdconnector.core.query.ProfessionQuery;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ParameterNormalizer 테스트.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
class ParameterNormalizerTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);
    private final ParameterNormalizer normalizer = new ParameterNormalizer(
        Clock.fixed(Instant.parse("2024-03-15T10:30:00Z"), ZoneOffset.UTC)
    );

    @Test
    void department_기관_코드만_지정하면_기본값으로_채워진다() {
        // given
        DepartmentQuery query = DepartmentQuery.builder().institutionIdentifier("12345").build();

        // when
        FieldMap fields = normalizer.department(query);

        // then
        assertThat(fields.get("InstitutionIdentifier")).isEqualTo("12345");
        assertThat(fields.contains("InstitutionUUIDIdentifier")).isFalse();
        assertThat(fields.get("DepartmentNameIndicator")).isEqualTo(true);
        assertThat(fields.get("UUIDIndicator")).isEqualTo(true);
        assertThat(fields.get("ContactInformationIndicator")).isEqualTo(false);
        assertThat(fields.get("ActivationDate")).isEqualTo(TODAY);
        assertThat(fields.get("DeactivationDate")).isEqualTo(TODAY);
        assertThat(fields.contains("DepartmentLevelIdentifier")).isFalse();
        assertThat(fields.contains("DepartmentIdentifier")).isFalse();
    }

    @Test
    void department_UUID_식별자는_UUID_필드로() {
        // given
        UUID department = UUID.randomUUID();
        DepartmentQuery query = DepartmentQuery.builder()
            .institutionIdentifier("XY")
            .departmentIdentifier(department.toString())
            .departmentLevelIdentifier("NY1-niveau")
            .build();

        // when
        FieldMap fields = normalizer.department(query);

        // then
        assertThat(fields.get("DepartmentUUIDIdentifier")).isEqualTo(department.toString());
        assertThat(fields.get("DepartmentLevelIdentifier")).isEqualTo("NY1-niveau");
    }

    @Test
    void department_빈_DepartmentLevel은_생략() {
        DepartmentQuery query = DepartmentQuery.builder().departmentLevelIdentifier("").build();

        assertThat(normalizer.department(query).contains("DepartmentLevelIdentifier")).isFalse();
    }

    @Test
    void department_같은_입력이면_같은_결과() {
        DepartmentQuery query = DepartmentQuery.builder().institutionIdentifier("XY").build();

        assertThat(normalizer.department(query)).isEqualTo(normalizer.department(query));
    }

    @Test
    void departmentParent_EffectiveDate_기본값은_오늘() {
        // given
        UUID department = UUID.randomUUID();

        // when
        FieldMap fields = normalizer.departmentParent(DepartmentParentQuery.of(department));

        // then
        assertThat(fields.names()).containsExactly("EffectiveDate", "DepartmentUUIDIdentifier");
        assertThat(fields.get("EffectiveDate")).isEqualTo(TODAY);
        assertThat(fields.get("DepartmentUUIDIdentifier")).isEqualTo(department.toString());
    }

    @Test
    void institution_기본값은_UUIDIndicator만_true() {
        // when
        FieldMap fields = normalizer.institution(InstitutionQuery.defaults());

        // then
        assertThat(fields.get("UUIDIndicator")).isEqualTo(true);
        assertThat(fields.get("AdministrationIndicator")).isEqualTo(false);
        assertThat(fields.contains("RegionIdentifier")).isFalse();
        assertThat(fields.contains("InstitutionIdentifier")).isFalse();
    }

    @Test
    void employment_범위_필드와_EffectiveDate() {
        // given
        EmploymentQuery query = EmploymentQuery.builder("XY")
            .personCivilRegistrationIdentifier("0101011234")
            .departmentLevelIdentifier("Afdelings-niveau")
            .build();

        // when
        FieldMap fields = normalizer.employment(query);

        // then
        assertThat(fields.get("InstitutionIdentifier")).isEqualTo("XY");
        assertThat(fields.get("PersonCivilRegistrationIdentifier")).isEqualTo("0101011234");
        assertThat(fields.contains("EmploymentIdentifier")).isFalse();
        assertThat(fields.get("EffectiveDate")).isEqualTo(TODAY);
        assertThat(fields.get("DepartmentLevelIdentifier")).isEqualTo("Afdelings-niveau");
    }

    @Test
    void employmentChangedAtDate_시각_기본값() {
        // when
        FieldMap fields = normalizer.employmentChangedAtDate(EmploymentChangedAtDateQuery.of("XY"));

        // then
        assertThat(fields.get("ActivationTime")).isEqualTo(LocalTime.MIDNIGHT);
        assertThat(fields.get("DeactivationTime")).isEqualTo(LocalTime.of(23, 59, 59));
        assertThat(fields.contains("FutureInformationIndicator")).isTrue();
    }

    @Test
    void person_기본_조회() {
        FieldMap fields = normalizer.person(PersonQuery.of("XY"));

        assertThat(fields.get("InstitutionIdentifier")).isEqualTo("XY");
        assertThat(fields.get("EffectiveDate")).isEqualTo(TODAY);
    }

    @Test
    void profession_JobPosition_미지정이면_생략() {
        assertThat(normalizer.profession(ProfessionQuery.of("XY")).names())
            .containsExactly("InstitutionIdentifier");
        assertThat(normalizer.profession(ProfessionQuery.of("XY", "1234")).get("JobPositionIdentifier"))
            .isEqualTo("1234");
    }

    @Test
    void null_조회조건이면_예외() {
        assertThatThrownBy(() -> normalizer.department(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("query cannot be null");
    }
}
