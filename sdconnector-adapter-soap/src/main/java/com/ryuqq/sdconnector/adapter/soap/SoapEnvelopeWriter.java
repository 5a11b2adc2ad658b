package com.ryuqq.sdconnector.adapter.soap;

import com.ctc.wstx.stax.WstxOutputFactory;
import com.ryuqq.sdconnector.core.model.FieldMap;
import com.ryuqq.sdconnector.core.spi.OperationSpec;
import org.codehaus.stax2.XMLOutputFactory2;
import org.codehaus.stax2.XMLStreamWriter2;

import javax.xml.stream.XMLStreamException;
import java.io.StringWriter;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SOAP 1.1 요청 Envelope 작성기.
 *
 * <p>Body에는 Operation의 요청 요소 하나가 들어가고, FieldMap의 각 필드가 자식 요소가 됩니다.
 * 자식 요소는 {@link OperationSpec#childOrder()}에 나온 이름이 그 순서대로 먼저,
 * 나머지는 FieldMap 삽입 순서대로 이어집니다.</p>
 *
 * <p>{@link OperationSpec#qualifiedChildren()}가 false면 요청 요소만 {@code sd} 접두어로
 * 한정하고 자식 요소는 네임스페이스 없이 씁니다.</p>
 *
 * <p><strong>값 형식:</strong></p>
 * <ul>
 *   <li>Boolean → xsd:boolean (true / false)</li>
 *   <li>LocalDate → xsd:date (yyyy-MM-dd)</li>
 *   <li>LocalTime → xsd:time (HH:mm:ss)</li>
 *   <li>String → 그대로</li>
 * </ul>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class SoapEnvelopeWriter {

    static final String ENVELOPE_NS = "http://schemas.xmlsoap.org/soap/envelope/";
    private static final String ENVELOPE_PREFIX = "soapenv";
    private static final String REQUEST_PREFIX = "sd";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final XMLOutputFactory2 factory;

    public SoapEnvelopeWriter() {
        this.factory = new WstxOutputFactory();
    }

    /**
     * Envelope 작성.
     *
     * @param operation 호출할 Operation
     * @param fields 요청 필드
     * @return SOAP Envelope 문서
     * @throws IllegalArgumentException 지원하지 않는 값 타입인 경우
     */
    public String write(OperationSpec operation, FieldMap fields) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter2 writer = (XMLStreamWriter2) factory.createXMLStreamWriter(out);
            writer.writeStartDocument("UTF-8", "1.0");
            writer.writeStartElement(ENVELOPE_PREFIX, "Envelope", ENVELOPE_NS);
            writer.writeNamespace(ENVELOPE_PREFIX, ENVELOPE_NS);
            writer.writeEmptyElement(ENVELOPE_PREFIX, "Header", ENVELOPE_NS);
            writer.writeStartElement(ENVELOPE_PREFIX, "Body", ENVELOPE_NS);

            String namespace = operation.requestNamespace();
            String childNamespace = namespace;
            if (namespace.isEmpty() || operation.qualifiedChildren()) {
                startElement(writer, namespace, operation.requestElement());
                if (!namespace.isEmpty()) {
                    writer.writeDefaultNamespace(namespace);
                }
            } else {
                writer.writeStartElement(REQUEST_PREFIX, operation.requestElement(), namespace);
                writer.writeNamespace(REQUEST_PREFIX, namespace);
                childNamespace = "";
            }
            for (Map.Entry<String, Object> field : ordered(operation, fields)) {
                startElement(writer, childNamespace, field.getKey());
                writer.writeCharacters(format(field.getKey(), field.getValue()));
                writer.writeEndElement();
            }
            writer.writeEndElement();

            writer.writeEndElement();
            writer.writeEndElement();
            writer.writeEndDocument();
            writer.close();
        } catch (XMLStreamException e) {
            throw new SoapCallException("Failed to write request for " + operation.name(), e);
        }
        return out.toString();
    }

    static String format(String name, Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "true" : "false";
        }
        if (value instanceof LocalDate) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format((LocalDate) value);
        }
        if (value instanceof LocalTime) {
            return TIME_FORMAT.format((LocalTime) value);
        }
        throw new IllegalArgumentException(
            "field " + name + " has unsupported type: " + value.getClass().getName()
        );
    }

    static List<Map.Entry<String, Object>> ordered(OperationSpec operation, FieldMap fields) {
        Map<String, Object> remaining = new LinkedHashMap<>(fields.asMap());
        List<Map.Entry<String, Object>> result = new ArrayList<>(remaining.size());
        for (String name : operation.childOrder()) {
            Object value = remaining.remove(name);
            if (value != null) {
                result.add(Map.entry(name, value));
            }
        }
        result.addAll(remaining.entrySet());
        return result;
    }

    private static void startElement(XMLStreamWriter2 writer, String namespace, String local) throws XMLStreamException {
        if (namespace.isEmpty()) {
            writer.writeStartElement(local);
        } else {
            writer.writeStartElement("", local, namespace);
        }
    }
}
