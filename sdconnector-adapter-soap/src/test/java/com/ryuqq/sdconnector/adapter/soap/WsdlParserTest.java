package com.ryuqq.sdconnector.adapter.soap;

import com.ryuqq.sdconnector.core.spi.OperationSpec;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WsdlParser 테스트.
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
class WsdlParserTest {

    private static final URI DOCUMENT = URI.create("https://sd.example/sdws/xml/schema/GetPerson20111201.wsdl");

    private final WsdlParser parser = new WsdlParser();

    @Test
    void parse_문서_리터럴_WSDL에서_Operation_정보를_추출() throws IOException {
        // given
        String wsdl = fixture("wsdl/GetPerson20111201.wsdl").replace("{{base}}", "https://sd.example/sdws/");

        // when
        ServiceDescriptor descriptor = parser.parse("GetPerson.wsdl", DOCUMENT, wsdl);

        // then
        assertThat(descriptor.locator()).isEqualTo("GetPerson.wsdl");
        assertThat(descriptor.operations()).hasSize(1);
        OperationSpec operation = descriptor.operations().get(0);
        assertThat(operation.name()).isEqualTo("GetPerson20111201Operation");
        assertThat(operation.action()).isEqualTo("GetPerson20111201");
        assertThat(operation.requestNamespace()).isEqualTo("urn:oio:sd:snapshot:1.0.0");
        assertThat(operation.requestElement()).isEqualTo("GetPerson20111201");
        assertThat(operation.endpoint()).isEqualTo("https://sd.example/sdws/service/GetPerson20111201");
    }

    @Test
    void parse_기본_네임스페이스_WSDL과_상대_주소() throws IOException {
        // when
        ServiceDescriptor descriptor = parser.parse(
            "GetDepartment.wsdl",
            URI.create("https://sd.example/sdws/wsdl/GetDepartment20111201.wsdl"),
            fixture("wsdl/GetDepartment20111201.wsdl")
        );

        // then
        OperationSpec operation = descriptor.operations().get(0);
        assertThat(operation.name()).isEqualTo("GetDepartment20111201Operation");
        assertThat(operation.requestElement()).isEqualTo("GetDepartment20111201");
        assertThat(operation.endpoint()).isEqualTo("https://sd.example/sdws/wsdl/service/GetDepartment20111201");
    }

    @Test
    void parse_인라인_스키마의_sequence_순서와_비한정_자식() throws IOException {
        // when
        ServiceDescriptor descriptor = parser.parse(
            "GetDepartment.wsdl",
            URI.create("https://sd.example/sdws/wsdl/GetDepartment20111201.wsdl"),
            fixture("wsdl/GetDepartment20111201.wsdl")
        );

        // then
        OperationSpec operation = descriptor.operations().get(0);
        assertThat(operation.childOrder()).containsExactly(
            "InstitutionIdentifier", "InstitutionUUIDIdentifier",
            "DepartmentIdentifier", "DepartmentUUIDIdentifier",
            "DepartmentLevelIdentifier", "ActivationDate", "DeactivationDate",
            "ContactInformationIndicator", "DepartmentNameIndicator", "EmploymentDepartmentIndicator",
            "PostalAddressIndicator", "ProductionUnitIndicator", "UUIDIndicator"
        );
        assertThat(operation.qualifiedChildren()).isFalse();
    }

    @Test
    void read_xs_import_스키마를_받으면_명명된_타입의_sequence_사용() throws IOException {
        // given
        String wsdl = fixture("wsdl/GetPerson20111201.wsdl").replace("{{base}}", "https://sd.example/sdws/");
        WsdlParser.Document document = parser.read("GetPerson.wsdl", DOCUMENT, wsdl);

        // when
        URI schema = document.nextSchema();
        document.addSchema(schema, fixture("wsdl/GetPerson20111201.xsd"));
        OperationSpec operation = document.toDescriptor().operations().get(0);

        // then
        assertThat(schema).isEqualTo(URI.create("https://sd.example/sdws/xml/schema/GetPerson20111201.xsd"));
        assertThat(document.nextSchema()).isNull();
        assertThat(operation.childOrder()).startsWith("EffectiveDate", "InstitutionIdentifier")
            .endsWith("PostalAddressIndicator")
            .hasSize(10);
        assertThat(operation.qualifiedChildren()).isTrue();
    }

    @Test
    void parse_스키마를_받지_않으면_순서_정보_없음() throws IOException {
        // given
        String wsdl = fixture("wsdl/GetPerson20111201.wsdl").replace("{{base}}", "https://sd.example/sdws/");

        // when
        OperationSpec operation = parser.parse("GetPerson.wsdl", DOCUMENT, wsdl).operations().get(0);

        // then
        assertThat(operation.childOrder()).isEmpty();
        assertThat(operation.qualifiedChildren()).isTrue();
    }

    @Test
    void read_중첩_요소의_자식은_sequence에_포함되지_않음() {
        // given
        String wsdl = "<definitions xmlns=\"http://schemas.xmlsoap.org/wsdl/\""
            + " xmlns:soap=\"http://schemas.xmlsoap.org/wsdl/soap/\""
            + " xmlns:xs=\"http://www.w3.org/2001/XMLSchema\" xmlns:t=\"urn:x\" targetNamespace=\"urn:x\">"
            + "<types><xs:schema targetNamespace=\"urn:x\" elementFormDefault=\"qualified\">"
            + "<xs:element name=\"GetX\"><xs:complexType><xs:sequence>"
            + "<xs:element name=\"B\"><xs:complexType><xs:sequence><xs:element name=\"Inner\"/></xs:sequence></xs:complexType></xs:element>"
            + "<xs:element ref=\"t:A\"/>"
            + "</xs:sequence></xs:complexType></xs:element>"
            + "</xs:schema></types>"
            + "<message name=\"Req\"><part name=\"p\" element=\"t:GetX\"/></message>"
            + "<portType name=\"P\"><operation name=\"GetXOperation\"><input message=\"t:Req\"/></operation></portType>"
            + "<service name=\"S\"><port name=\"Q\"><soap:address location=\"https://sd.example/x\"/></port></service>"
            + "</definitions>";

        // when
        OperationSpec operation = parser.parse("x.wsdl", DOCUMENT, wsdl).operations().get(0);

        // then
        assertThat(operation.childOrder()).containsExactly("B", "A");
    }

    @Test
    void parse_Operation이_두개면_모두_반환() throws IOException {
        // when
        ServiceDescriptor descriptor = parser.parse(
            "Two.wsdl",
            DOCUMENT,
            fixture("wsdl/TwoOperations.wsdl").replace("{{base}}", "https://sd.example/")
        );

        // then
        assertThat(descriptor.operations()).extracting(OperationSpec::name)
            .containsExactly("GetInstitution20111201Operation", "GetOrganization20111201Operation");
        assertThat(descriptor.operations().get(0).action()).isEmpty();
    }

    @Test
    void parse_soap_address가_없으면_예외() {
        // given
        String wsdl = "<definitions xmlns=\"http://schemas.xmlsoap.org/wsdl/\" targetNamespace=\"urn:x\">"
            + "<portType name=\"P\"><operation name=\"GetXOperation\"/></portType>"
            + "</definitions>";

        // when & then
        assertThatThrownBy(() -> parser.parse("x.wsdl", DOCUMENT, wsdl))
            .isInstanceOf(DescriptorLoadException.class)
            .hasMessageContaining("soap:address");
    }

    @Test
    void parse_XML이_아니면_예외() {
        assertThatThrownBy(() -> parser.parse("broken.wsdl", DOCUMENT, "<definitions><unclosed>"))
            .isInstanceOf(DescriptorLoadException.class)
            .hasMessageContaining("broken.wsdl");
        assertThatThrownBy(() -> parser.parse("empty.wsdl", DOCUMENT, ""))
            .isInstanceOf(DescriptorLoadException.class);
    }

    static String fixture(String resource) throws IOException {
        try (InputStream in = WsdlParserTest.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("missing fixture " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
