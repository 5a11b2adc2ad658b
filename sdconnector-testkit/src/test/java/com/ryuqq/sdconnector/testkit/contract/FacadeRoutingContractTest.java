package com.ryuqq.sdconnector.testkit.contract;

import com.ryuqq.sdconnector.application.facade.AsyncSdConnector;
import com.ryuqq.sdconnector.application.facade.SdConnector;
import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.model.OperationNames;
import com.ryuqq.sdconnector.core.query.DepartmentParentQuery;
import com.ryuqq.sdconnector.core.query.DepartmentQuery;
import com.ryuqq.sdconnector.core.query.EmploymentChangedQuery;
import com.ryuqq.sdconnector.core.query.EmploymentQuery;
import com.ryuqq.sdconnector.core.query.InstitutionQuery;
import com.ryuqq.sdconnector.core.query.OrganizationQuery;
import com.ryuqq.sdconnector.core.query.PersonQuery;
import com.ryuqq.sdconnector.core.query.ProfessionQuery;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Facade 라우팅과 파라미터 정규화.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Facade 메서드 → 대응하는 Canonical Operation 호출</li>
 *   <li>생략된 날짜 → 오늘 날짜로 채움</li>
 *   <li>UUID 형태 식별자 → *UUIDIdentifier 필드, 그 외 → *Identifier 필드</li>
 *   <li>닫힌 Facade 호출 → IllegalStateException</li>
 * </ul>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
class FacadeRoutingContractTest extends AbstractContractTest {

    @Test
    void testEachMethod_RoutesToItsOperation() {
        // Given
        SdConnector connector = createConnector();
        DepartmentQuery department = DepartmentQuery.builder().institutionIdentifier("XY").build();
        InstitutionQuery institution = InstitutionQuery.builder().regionIdentifier("RG").build();
        OrganizationQuery organization = OrganizationQuery.builder().institutionIdentifier("XY").build();
        EmploymentQuery employment = EmploymentQuery.of("XY");
        EmploymentChangedQuery employmentChanged = EmploymentChangedQuery.of("XY");
        PersonQuery person = PersonQuery.of("XY");
        ProfessionQuery profession = ProfessionQuery.of("XY");

        // When
        connector.getDepartment(department);
        connector.getInstitution(institution);
        connector.getOrganization(organization);
        connector.getEmployment(employment);
        connector.getEmploymentChanged(employmentChanged);
        connector.getPerson(person);
        connector.getProfession(profession);

        // Then
        assertLastFields(OperationNames.GET_DEPARTMENT, normalizer.department(department));
        assertLastFields(OperationNames.GET_INSTITUTION, normalizer.institution(institution));
        assertLastFields(OperationNames.GET_ORGANIZATION, normalizer.organization(organization));
        assertLastFields(OperationNames.GET_EMPLOYMENT, normalizer.employment(employment));
        assertLastFields(OperationNames.GET_EMPLOYMENT_CHANGED, normalizer.employmentChanged(employmentChanged));
        assertLastFields(OperationNames.GET_PERSON, normalizer.person(person));
        assertLastFields(OperationNames.GET_PROFESSION, normalizer.profession(profession));
        assertEquals(7, binder.invocations().size());
    }

    @Test
    void testOmittedDates_DefaultToToday() {
        // When
        createConnector().getOrganization(OrganizationQuery.builder().institutionIdentifier("XY").build());

        // Then
        FieldMap fields = binder.invocations(OperationNames.GET_ORGANIZATION).get(0).fields();
        assertEquals(TODAY, fields.get("ActivationDate"));
        assertEquals(TODAY, fields.get("DeactivationDate"));
    }

    @Test
    void testExplicitDates_PassedThrough() {
        // Given
        LocalDate start = LocalDate.of(2023, 1, 1);

        // When
        createConnector().getDepartment(DepartmentQuery.builder()
                .institutionIdentifier("XY")
                .startDate(start)
                .build());

        // Then
        FieldMap fields = binder.invocations(OperationNames.GET_DEPARTMENT).get(0).fields();
        assertEquals(start, fields.get("ActivationDate"));
        assertEquals(TODAY, fields.get("DeactivationDate"));
    }

    @Test
    void testUuidIdentifier_SentAsUuidField() {
        // Given
        UUID institution = UUID.fromString("6f9b2c1e-8a4d-4f3b-9c2a-1d5e7f8a9b0c");

        // When
        createConnector().getDepartment(DepartmentQuery.builder()
                .institutionIdentifier(institution.toString())
                .departmentIdentifier("ABCD")
                .build());

        // Then
        FieldMap fields = binder.invocations(OperationNames.GET_DEPARTMENT).get(0).fields();
        assertEquals(institution.toString(), fields.get("InstitutionUUIDIdentifier"));
        assertFalse(fields.contains("InstitutionIdentifier"));
        assertEquals("ABCD", fields.get("DepartmentIdentifier"));
        assertFalse(fields.contains("DepartmentUUIDIdentifier"));
    }

    @Test
    void testDepartmentParent_UsesEffectiveDateToday() {
        // Given
        UUID department = UUID.randomUUID();

        // When
        createConnector().getDepartmentParent(new DepartmentParentQuery(department, null));

        // Then
        FieldMap fields = binder.invocations(OperationNames.GET_DEPARTMENT_PARENT).get(0).fields();
        assertEquals(TODAY, fields.get("EffectiveDate"));
        assertEquals(department.toString(), fields.get("DepartmentUUIDIdentifier"));
    }

    @Test
    void testClosedConnector_RejectsCalls() {
        // Given
        SdConnector connector = createConnector();
        connector.close();

        // When & Then
        assertThrows(IllegalStateException.class, () -> connector.getPerson(PersonQuery.of("XY")));
        assertTrue(binder.invocations().isEmpty());
    }

    @Test
    void testAsyncFacade_SameRoutingAsBlocking() throws Exception {
        // Given
        InMemoryAsyncOperationBinder asyncBinder = new InMemoryAsyncOperationBinder(binder);
        AsyncSdConnector connector = createAsyncConnector(asyncBinder);
        PersonQuery person = PersonQuery.builder("XY").personCivilRegistrationIdentifier("0101011234").build();

        // When
        connector.getPerson(person).get();
        connector.close();

        // Then
        assertLastFields(OperationNames.GET_PERSON, normalizer.person(person));
        assertTrue(asyncBinder.isClosed());
    }
}
