package com.ryuqq.sdconnector.application.facade;

import com.ryuqq.sdconnector.application.invoker.AsyncResilientInvoker;
import com.ryuqq.sdconnector.core.model.FieldMap;
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

import java.util.concurrent.CompletableFuture;

/**
 * SD 조회 비블로킹 Facade.
 *
 * <p>모든 메서드는 {@link CompletableFuture}를 반환합니다. Credentials별 전송 세션을
 * 점유하므로 사용 후 반드시 {@link #close()}로 해제해야 합니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class AsyncSdConnector implements AutoCloseable {

    private final AsyncResilientInvoker invoker;
    private final ParameterNormalizer normalizer;

    public AsyncSdConnector(AsyncResilientInvoker invoker, ParameterNormalizer normalizer) {
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        if (normalizer == null) {
            throw new IllegalArgumentException("normalizer cannot be null");
        }
        this.invoker = invoker;
        this.normalizer = normalizer;
    }

    public CompletableFuture<ResponseRecord> getDepartment(DepartmentQuery query) {
        return invoke(Routes.DEPARTMENT, query);
    }

    public CompletableFuture<ResponseRecord> getDepartmentParent(DepartmentParentQuery query) {
        return invoke(Routes.DEPARTMENT_PARENT, query);
    }

    public CompletableFuture<ResponseRecord> getInstitution(InstitutionQuery query) {
        return invoke(Routes.INSTITUTION, query);
    }

    public CompletableFuture<ResponseRecord> getOrganization(OrganizationQuery query) {
        return invoke(Routes.ORGANIZATION, query);
    }

    public CompletableFuture<ResponseRecord> getEmployment(EmploymentQuery query) {
        return invoke(Routes.EMPLOYMENT, query);
    }

    public CompletableFuture<ResponseRecord> getEmploymentChanged(EmploymentChangedQuery query) {
        return invoke(Routes.EMPLOYMENT_CHANGED, query);
    }

    public CompletableFuture<ResponseRecord> getEmploymentChangedAtDate(EmploymentChangedAtDateQuery query) {
        return invoke(Routes.EMPLOYMENT_CHANGED_AT_DATE, query);
    }

    public CompletableFuture<ResponseRecord> getPerson(PersonQuery query) {
        return invoke(Routes.PERSON, query);
    }

    public CompletableFuture<ResponseRecord> getPersonChangedAtDate(PersonChangedAtDateQuery query) {
        return invoke(Routes.PERSON_CHANGED_AT_DATE, query);
    }

    public CompletableFuture<ResponseRecord> getProfession(ProfessionQuery query) {
        return invoke(Routes.PROFESSION, query);
    }

    /**
     * 전송 세션 해제.
     *
     * @throws com.ryuqq.sdconnector.core.exception.ResourceReleaseException 해제 실패 시
     */
    @Override
    public void close() {
        invoker.registry().close();
    }

    private <Q> CompletableFuture<ResponseRecord> invoke(Route<Q> route, Q query) {
        FieldMap fields;
        try {
            fields = route.normalize(normalizer, query);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return invoker.call(route.operationName(), fields);
    }
}
