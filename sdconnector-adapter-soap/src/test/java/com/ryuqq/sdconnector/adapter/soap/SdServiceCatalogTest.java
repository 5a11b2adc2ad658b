package com.ryuqq.sdconnector.adapter.soap;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SdServiceCatalog 테스트.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
class SdServiceCatalogTest {

    @Test
    void locators_20개의_서로_다른_디스크립터() {
        assertThat(SdServiceCatalog.LOCATORS).hasSize(20).doesNotHaveDuplicates();
    }

    @Test
    void resolve_상대_경로는_기본_주소_기준() {
        URI uri = SdServiceCatalog.resolve(
            SdServiceCatalog.BASE_URL,
            "xml/schema/sd.dk/xml.wsdl/20111201/GetPerson20111201.wsdl"
        );

        assertThat(uri.toString())
            .isEqualTo("https://service.sd.dk/sdws/xml/schema/sd.dk/xml.wsdl/20111201/GetPerson20111201.wsdl");
        assertThat(SdServiceCatalog.resolve(SdServiceCatalog.BASE_URL, "GetPersonWSDL").toString())
            .isEqualTo("https://service.sd.dk/sdws/GetPersonWSDL");
    }

    @Test
    void resolve_절대_주소는_그대로() {
        assertThat(SdServiceCatalog.resolve(SdServiceCatalog.BASE_URL, "https://other.example/x.wsdl").toString())
            .isEqualTo("https://other.example/x.wsdl");
    }
}
