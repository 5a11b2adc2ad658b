package com.ryuqq.sdconnector.application.facade;

import com.ryuqq.sdconnector.application.invoker.ResilientInvoker;
import com.ryuqq.sdconnector.core.model.ResponseRecord;
import com.ryuqq.sdconnector.core.normalizer.ParameterNormalizer;
import com.ryuqq.sdconnector.core.query.DepartmentParentQuery;
import com.ryuqq.sdconnector.core.query.DepartmentQuery;
import com.ryuqq.sdconnector.core.query.EmploymentChangedAtDateQuery;
import com.ryuqq.sdconnector.core.query.EmploymentChangedQuery;
import com.ryuqq.sdconnector.core.query.EmploymentQuery;
import com.ryuqq.sdconnector.core.query.InstitutionQuery;
import com.ryuqq.sdconnector.core.query.OrganizationQuery;
import com.ryuqq.sdconnector.core.query.PersonChangedAtDateQuery;
import com.ryuqq.sdconnector.core.query.PersonQuery;
import com.ryuqq.sdconnector.core.query.ProfessionQuery;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SD 조회 블로킹 Facade.
 *
 * <p>각 메서드는 조회 조건을 정규화한 뒤 {@link ResilientInvoker}로 해당 Operation을 호출합니다.
 * 모든 호출은 호출 스레드에서 수행됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (SdConnector sd = SdConnectors.connect("user", "secret")) {
 *     ResponseRecord department = sd.getDepartment(
 *         DepartmentQuery.builder().institutionIdentifier("XY").build()
 *     );
 * }
 * }</pre>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class SdConnector implements AutoCloseable {

    private final ResilientInvoker invoker;
    private final ParameterNormalizer normalizer;
    private final Runnable releaseHook;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SdConnector(ResilientInvoker invoker, ParameterNormalizer normalizer) {
        this(invoker, normalizer, () -> { });
    }

    /**
     * 생성자.
     *
     * @param invoker 재시도 호출기
     * @param normalizer 파라미터 정규화기
     * @param releaseHook {@link #close()} 시 한 번 실행되는 세션 해제 함수
     */
    public SdConnector(ResilientInvoker invoker, ParameterNormalizer normalizer, Runnable releaseHook) {
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer cannot be null");
        }
        if (releaseHook == null) {
            throw new IllegalArgumentException("releaseHook cannot be null");
        }
        this.invoker = invoker;
        this.normalizer = normalizer;
        this.releaseHook = releaseHook;
    }

    public ResponseRecord getDepartment(DepartmentQuery query) {
        return invoke(Routes.DEPARTMENT, query);
    }

    public ResponseRecord getDepartmentParent(DepartmentParentQuery query) {
        return invoke(Routes.DEPARTMENT_PARENT, query);
    }

    public ResponseRecord getInstitution(InstitutionQuery query) {
        return invoke(Routes.INSTITUTION, query);
    }

    public ResponseRecord getOrganization(OrganizationQuery query) {
        return invoke(Routes.ORGANIZATION, query);
    }

    public ResponseRecord getEmployment(EmploymentQuery query) {
        return invoke(Routes.EMPLOYMENT, query);
    }

    public ResponseRecord getEmploymentChanged(EmploymentChangedQuery query) {
        return invoke(Routes.EMPLOYMENT_CHANGED, query);
    }

    public ResponseRecord getEmploymentChangedAtDate(EmploymentChangedAtDateQuery query) {
        return invoke(Routes.EMPLOYMENT_CHANGED_AT_DATE, query);
    }

    public ResponseRecord getPerson(PersonQuery query) {
        return invoke(Routes.PERSON, query);
    }

    public ResponseRecord getPersonChangedAtDate(PersonChangedAtDateQuery query) {
        return invoke(Routes.PERSON_CHANGED_AT_DATE, query);
    }

    public ResponseRecord getProfession(ProfessionQuery query) {
        return invoke(Routes.PROFESSION, query);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            releaseHook.run();
        }
    }

    private <Q> ResponseRecord invoke(Route<Q> route, Q query) {
        if (closed.get()) {
            throw new IllegalStateException("connector is closed");
        }
        return invoker.call(route.operationName(), route.normalize(normalizer, query));
    }
}
