package com.ryuqq.sdconnector.adapter.soap;

import com.ctc.wstx.stax.WstxInputFactory;
import com.ryuqq.sdconnector.core.model.ResponseRecord;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SOAP 응답 해석기.
 *
 * <p>Body의 첫 번째 요소를 {@link ResponseRecord} 트리로 변환합니다 (스트리밍, DOM 없음).</p>
 * <ul>
 *   <li>자식이 없는 요소 → 텍스트</li>
 *   <li>자식이 있는 요소 → ResponseRecord (속성은 무시)</li>
 *   <li>같은 이름이 반복된 요소 → List (문서 순서)</li>
 * </ul>
 *
 * <p>Body가 Fault이면 {@link SoapFaultException}을 던집니다.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class SoapResponseReader {

    private static final ThreadLocal<XMLInputFactory2> FACTORY = ThreadLocal.withInitial(() -> {
        XMLInputFactory2 factory = new WstxInputFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
        factory.setXMLResolver((publicId, systemId, baseUri, namespace) -> null);
        return factory;
    });

    /**
     * 응답 해석.
     *
     * @param operationName 로그/오류 메시지용 Operation 이름
     * @param xml 응답 문서
     * @param statusCode HTTP 상태 코드
     * @return Body의 첫 번째 요소
     * @throws SoapFaultException Body가 Fault인 경우
     * @throws SoapCallException XML 문법 오류이거나 Body가 비어 있는 경우
     */
    public ResponseRecord read(String operationName, String xml, int statusCode) {
        try {
            XMLStreamReader2 reader = (XMLStreamReader2) FACTORY.get().createXMLStreamReader(new StringReader(xml));
            if (!advanceToBodyChild(reader)) {
                throw new SoapCallException("Response to " + operationName + " has no SOAP body element", statusCode);
            }
            String name = reader.getLocalName();
            if ("Fault".equals(name)) {
                throw readFault(reader, statusCode);
            }
            Object value = readElement(reader);
            reader.closeCompletely();
            if (value instanceof ResponseRecord) {
                return (ResponseRecord) value;
            }
            String text = (String) value;
            if (text.isBlank()) {
                return ResponseRecord.of(name, Map.of());
            }
            return ResponseRecord.of(name, Map.of("value", text));
        } catch (XMLStreamException e) {
            throw new SoapCallException("Response to " + operationName + " is not valid XML: " + e.getMessage(), e);
        }
    }

    private static boolean advanceToBodyChild(XMLStreamReader2 reader) throws XMLStreamException {
        boolean inBody = false;
        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                if (inBody) {
                    return true;
                }
                inBody = "Body".equals(reader.getLocalName());
            } else if (event == XMLStreamConstants.END_ELEMENT && inBody) {
                return false;
            }
        }
        return false;
    }

    /**
     * 현재 START_ELEMENT부터 대응하는 END_ELEMENT까지 읽음.
     */
    private static Object readElement(XMLStreamReader2 reader) throws XMLStreamException {
        String name = reader.getLocalName();
        Map<String, List<Object>> children = new LinkedHashMap<>();
        StringBuilder text = new StringBuilder();

        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                String child = reader.getLocalName();
                children.computeIfAbsent(child, key -> new ArrayList<>()).add(readElement(reader));
            } else if (event == XMLStreamConstants.CHARACTERS || event == XMLStreamConstants.CDATA) {
                text.append(reader.getText());
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                break;
            }
        }

        if (children.isEmpty()) {
            return text.toString();
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> entry : children.entrySet()) {
            List<Object> values = entry.getValue();
            fields.put(entry.getKey(), values.size() == 1 ? values.get(0) : Collections.unmodifiableList(values));
        }
        return ResponseRecord.of(name, fields);
    }

    private static SoapFaultException readFault(XMLStreamReader2 reader, int statusCode) throws XMLStreamException {
        Object fault = readElement(reader);
        String code = "";
        String message = "";
        if (fault instanceof ResponseRecord) {
            ResponseRecord record = (ResponseRecord) fault;
            code = firstText(record, "faultcode", "Code");
            message = firstText(record, "faultstring", "Reason");
        }
        return new SoapFaultException(code, message, statusCode);
    }

    private static String firstText(ResponseRecord record, String soap11Name, String soap12Name) {
        Object value = record.has(soap11Name) ? record.get(soap11Name) : record.get(soap12Name);
        while (value instanceof ResponseRecord) {
            Map<String, Object> fields = ((ResponseRecord) value).fields();
            value = fields.isEmpty() ? null : fields.values().iterator().next();
        }
        return value instanceof String ? ((String) value).trim() : "";
    }
}
