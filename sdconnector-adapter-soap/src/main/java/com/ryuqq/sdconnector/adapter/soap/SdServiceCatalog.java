package com.ryuqq.sdconnector.adapter.soap;

import java.net.URI;
import java.util.List;

/**
 * SD 웹서비스 디스크립터(WSDL) 목록.
 *
 * <p>현재 버전과 이전 버전의 디스크립터를 모두 포함합니다. 이전 버전도 Registry에
 * 바인딩되지만 Facade는 최신 버전만 사용합니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class SdServiceCatalog {

    /** SD 웹서비스 기본 주소. */
    public static final String BASE_URL = "https://service.sd.dk/sdws/";

    private static final String SCHEMA_20111201 = "xml/schema/sd.dk/xml.wsdl/20111201/";

    /** 바인딩할 디스크립터 위치 (BASE_URL 기준 상대 경로). */
    public static final List<String> LOCATORS = List.of(
        "GetDepartment20080201WSDL",
        SCHEMA_20111201 + "GetDepartment20111201.wsdl",
        "xml/schema/sd.dk/xml.wsdl/20190701/GetDepartmentParent20190701.wsdl",
        "GetInstitution20080201WSDL",
        SCHEMA_20111201 + "GetInstitution20111201.wsdl",
        "GetOrganizationWSDL",
        "GetOrganization20080201WSDL",
        SCHEMA_20111201 + "GetOrganization20111201.wsdl",
        "GetEmployment20070401WSDL",
        SCHEMA_20111201 + "GetEmployment20111201.wsdl",
        "GetEmploymentChanged20070401WSDL",
        SCHEMA_20111201 + "GetEmploymentChanged20111201.wsdl",
        "GetEmploymentChangedAtDate20070401WSDL",
        SCHEMA_20111201 + "GetEmploymentChangedAtDate20111201.wsdl",
        "GetPersonWSDL",
        SCHEMA_20111201 + "GetPerson20111201.wsdl",
        "GetPersonChangedAtDateWSDL",
        SCHEMA_20111201 + "GetPersonChangedAtDate20111201.wsdl",
        "GetProfessionWSDL",
        "GetProfession20080201WSDL"
    );

    private SdServiceCatalog() {
    }

    /**
     * 디스크립터 위치를 절대 URI로 변환.
     *
     * @param baseUrl 기본 주소 ("/"로 끝남)
     * @param locator 상대 경로 또는 절대 URL
     * @return 디스크립터 URI
     * @throws IllegalArgumentException locator가 null/빈 문자열이거나 URI 문법이 아닌 경우
     */
    public static URI resolve(String baseUrl, String locator) {
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator cannot be null or blank");
        }
        URI target = URI.create(locator);
        if (target.isAbsolute()) {
            return target;
        }
        return URI.create(baseUrl).resolve(target);
    }
}
