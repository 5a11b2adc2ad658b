package com.ryuqq.sdconnector.core.normalizer;

import com.ryuqq.sdconnector.core.model.FieldMap;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TemporalWindowResolver 테스트.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
class TemporalWindowResolverTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);
    private final TemporalWindowResolver resolver = new TemporalWindowResolver(
        Clock.fixed(Instant.parse("2024-03-15T10:30:00Z"), ZoneOffset.UTC)
    );

    @Test
    void resolveDates_미지정이면_오늘() {
        // when
        FieldMap fields = resolver.resolveDates(null, null);

        // then
        assertThat(fields.names()).containsExactly("ActivationDate", "DeactivationDate");
        assertThat(fields.get("ActivationDate")).isEqualTo(TODAY);
        assertThat(fields.get("DeactivationDate")).isEqualTo(TODAY);
    }

    @Test
    void resolveDates_역전된_기간도_그대로_전달() {
        // given
        LocalDate start = LocalDate.of(2024, 12, 31);
        LocalDate end = LocalDate.of(2024, 1, 1);

        // when
        FieldMap fields = resolver.resolveDates(start, end);

        // then
        assertThat(fields.get("ActivationDate")).isEqualTo(start);
        assertThat(fields.get("DeactivationDate")).isEqualTo(end);
    }

    @Test
    void resolveDateTimes_미지정이면_오늘_하루_전체() {
        // when
        FieldMap fields = resolver.resolveDateTimes(null, null);

        // then
        assertThat(fields.names())
            .containsExactly("ActivationDate", "ActivationTime", "DeactivationDate", "DeactivationTime");
        assertThat(fields.get("ActivationDate")).isEqualTo(TODAY);
        assertThat(fields.get("ActivationTime")).isEqualTo(LocalTime.MIDNIGHT);
        assertThat(fields.get("DeactivationDate")).isEqualTo(TODAY);
        assertThat(fields.get("DeactivationTime")).isEqualTo(LocalTime.of(23, 59, 59));
    }

    @Test
    void resolveDateTimes_지정값을_날짜와_시각으로_분리() {
        // given
        LocalDateTime start = LocalDateTime.of(2024, 1, 2, 8, 15, 30);

        // when
        FieldMap fields = resolver.resolveDateTimes(start, null);

        // then
        assertThat(fields.get("ActivationDate")).isEqualTo(LocalDate.of(2024, 1, 2));
        assertThat(fields.get("ActivationTime")).isEqualTo(LocalTime.of(8, 15, 30));
        assertThat(fields.get("DeactivationDate")).isEqualTo(TODAY);
    }

    @Test
    void effectiveDate_미지정이면_오늘() {
        assertThat(resolver.effectiveDate(null)).isEqualTo(TODAY);
        assertThat(resolver.effectiveDate(LocalDate.of(2020, 1, 1))).isEqualTo(LocalDate.of(2020, 1, 1));
    }
}
