package com.ryuqq.sdconnector.core.normalizer;

import com.ryuqq.sdconnector.core.model.FieldMap;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 조회 기간 기본값 해석기.
 *
 * <p>호출자가 기간을 생략하면 "오늘"로 채웁니다.</p>
 * <ul>
 *   <li>날짜 기간: 오늘 ~ 오늘</li>
 *   <li>일시 기간: 오늘 00:00:00 ~ 오늘 23:59:59</li>
 * </ul>
 *
 * <p>start ≤ end 검증은 하지 않습니다. 역전된 기간도 그대로 원격 서비스에 전달되며
 * 결과는 원격 서비스가 결정합니다.</p>
 *
 * <p>"오늘"은 주입된 {@link Clock} 기준입니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class TemporalWindowResolver {

    static final String ACTIVATION_DATE = "ActivationDate";
    static final String ACTIVATION_TIME = "ActivationTime";
    static final String DEACTIVATION_DATE = "DeactivationDate";
    static final String DEACTIVATION_TIME = "DeactivationTime";

    private static final LocalTime START_OF_DAY = LocalTime.of(0, 0);
    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    private final Clock clock;

    /**
     * 생성자.
     *
     * @param clock "오늘" 기준 Clock
     * @throws IllegalArgumentException clock이 null인 경우
     */
    public TemporalWindowResolver(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    /**
     * 오늘 날짜.
     *
     * @return Clock 기준 오늘
     */
    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * 기준일 해석 (생략 시 오늘).
     *
     * @param effectiveDate 기준일 (null 가능)
     * @return 기준일
     */
    public LocalDate effectiveDate(LocalDate effectiveDate) {
        return effectiveDate != null ? effectiveDate : today();
    }

    /**
     * 날짜 기간 필드 생성.
     *
     * @param start 시작일 (null이면 오늘)
     * @param end 종료일 (null이면 오늘)
     * @return ActivationDate, DeactivationDate
     */
    public FieldMap resolveDates(LocalDate start, LocalDate end) {
        LocalDate today = today();
        return FieldMap.builder()
            .put(ACTIVATION_DATE, start != null ? start : today)
            .put(DEACTIVATION_DATE, end != null ? end : today)
            .build();
    }

    /**
     * 일시 기간 필드 생성.
     *
     * @param start 시작 일시 (null이면 오늘 00:00:00)
     * @param end 종료 일시 (null이면 오늘 23:59:59)
     * @return ActivationDate, ActivationTime, DeactivationDate, DeactivationTime
     */
    public FieldMap resolveDateTimes(LocalDateTime start, LocalDateTime end) {
        LocalDate today = today();
        LocalDateTime from = start != null ? start : LocalDateTime.of(today, START_OF_DAY);
        LocalDateTime to = end != null ? end : LocalDateTime.of(today, END_OF_DAY);
        return FieldMap.builder()
            .put(ACTIVATION_DATE, from.toLocalDate())
            .put(ACTIVATION_TIME, from.toLocalTime())
            .put(DEACTIVATION_DATE, to.toLocalDate())
            .put(DEACTIVATION_TIME, to.toLocalTime())
            .build();
    }
}
