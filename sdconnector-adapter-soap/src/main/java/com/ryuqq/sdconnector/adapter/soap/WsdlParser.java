package com.ryuqq.sdconnector.adapter.soap;

import com.ctc.wstx.stax.WstxInputFactory;
import com.ryuqq.sdconnector.core.spi.OperationSpec;
import com.ryuqq.sdconnector.core.spi.ServiceDescriptor;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;

import javax.xml.namespace.QName;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.StringReader;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * WSDL 1.1 디스크립터 해석기 (StAX).
 *
 * <p>다음 정보만 추출합니다:</p>
 * <ul>
 *   <li>definitions의 targetNamespace</li>
 *   <li>message → part의 요청 요소 QName</li>
 *   <li>portType의 Operation과 입력 message</li>
 *   <li>binding의 soapAction</li>
 *   <li>service/port의 soap:address (디스크립터 URI 기준으로 해석)</li>
 *   <li>요청 요소의 xs:sequence 순서와 elementFormDefault (인라인 또는 xs:import/xs:include 스키마)</li>
 * </ul>
 *
 * <p>외부 스키마는 {@link Document#nextSchema()}로 위치를 꺼내 호출자가 가져온 뒤
 * {@link Document#addSchema(URI, String)}로 넘깁니다. 해석기는 네트워크에 접근하지 않습니다.</p>
 *
 * <p>DTD와 외부 엔티티는 비활성화되어 있습니다. Thread-safe: 스레드마다 하나의 {@link XMLInputFactory2}.</p>
 *
 * @author SD Connector Team
 * @since 1.0.0
 */
public final class WsdlParser {

    static final String WSDL_NS = "http://schemas.xmlsoap.org/wsdl/";
    static final String SOAP11_BINDING_NS = "http://schemas.xmlsoap.org/wsdl/soap/";
    static final String SOAP12_BINDING_NS = "http://schemas.xmlsoap.org/wsdl/soap12/";
    static final String XSD_NS = "http://www.w3.org/2001/XMLSchema";

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
     * WSDL 문서 해석 (외부 스키마는 따라가지 않음).
     *
     * @param locator 디스크립터 위치 (ServiceDescriptor에 기록됨)
     * @param documentUri 디스크립터를 가져온 URI (상대 soap:address 해석 기준)
     * @param wsdl WSDL 문서
     * @return ServiceDescriptor (portType 선언 순서의 Operation 목록)
     * @throws DescriptorLoadException XML 문법 오류이거나 필요한 요소가 없는 경우
     */
    public ServiceDescriptor parse(String locator, URI documentUri, String wsdl) {
        return read(locator, documentUri, wsdl).toDescriptor();
    }

    /**
     * WSDL 문서 읽기.
     *
     * @return 외부 스키마를 더 받을 수 있는 해석 상태
     * @throws DescriptorLoadException 비어 있거나 XML 문법 오류인 경우
     */
    public Document read(String locator, URI documentUri, String wsdl) {
        if (wsdl == null || wsdl.isBlank()) {
            throw new DescriptorLoadException("Service descriptor " + locator + " is empty");
        }
        Document document = new Document(locator, documentUri);
        document.consume(documentUri, wsdl, "Service descriptor " + locator);
        return document;
    }

    /**
     * 한 디스크립터의 해석 상태.
     *
     * <p>단일 스레드에서 순서대로 사용합니다.</p>
     */
    public static final class Document {

        private static final Sequence UNKNOWN = new Sequence(List.of(), true);
        private static final Set<String> GROUPS = Set.of("sequence", "all", "choice");

        private final String locator;
        private final URI documentUri;

        private String targetNamespace = "";
        private final Map<String, QName> messageElements = new HashMap<>();
        private final Map<String, String> operationInputs = new LinkedHashMap<>();
        private final Map<String, String> soapActions = new HashMap<>();
        private String address;

        private final Map<QName, Sequence> elementSequences = new HashMap<>();
        private final Map<QName, QName> elementTypes = new HashMap<>();
        private final Map<QName, Sequence> typeSequences = new HashMap<>();
        private final Set<URI> seenSchemas = new HashSet<>();
        private final Deque<URI> pendingSchemas = new ArrayDeque<>();

        private URI base;
        private String section;
        private String currentMessage;
        private String currentOperation;

        private final Deque<String> schemaPath = new ArrayDeque<>();
        private String schemaNamespace = "";
        private boolean schemaQualified;
        private QName owner;
        private boolean ownerIsType;
        private List<String> ownerChildren;

        private Document(String locator, URI documentUri) {
            this.locator = locator;
            this.documentUri = documentUri;
        }

        /**
         * 아직 가져오지 않은 외부 스키마 위치.
         *
         * @return 다음 스키마 URI, 없으면 null
         */
        public URI nextSchema() {
            return pendingSchemas.poll();
        }

        /**
         * 외부 스키마 추가 (중첩 import는 다시 대기열에 들어감).
         *
         * @param location 스키마 URI (상대 schemaLocation 해석 기준)
         * @param xsd 스키마 문서
         * @throws DescriptorLoadException XML 문법 오류인 경우
         */
        public void addSchema(URI location, String xsd) {
            if (xsd == null || xsd.isBlank()) {
                throw new DescriptorLoadException("Schema " + location + " referenced by " + locator + " is empty");
            }
            consume(location, xsd, "Schema " + location + " referenced by " + locator);
        }

        /**
         * ServiceDescriptor 생성.
         *
         * @throws DescriptorLoadException Operation이 있는데 soap:address가 없는 경우
         */
        public ServiceDescriptor toDescriptor() {
            List<OperationSpec> operations = new ArrayList<>(operationInputs.size());
            if (operationInputs.isEmpty()) {
                return new ServiceDescriptor(locator, operations);
            }
            if (address == null || address.isBlank()) {
                throw new DescriptorLoadException("Service descriptor " + locator + " declares no soap:address");
            }
            String endpoint = documentUri == null ? address : documentUri.resolve(address.trim()).toString();

            for (Map.Entry<String, String> entry : operationInputs.entrySet()) {
                String operation = entry.getKey();
                QName element = entry.getValue() == null ? null : messageElements.get(entry.getValue());
                Sequence sequence = requestSequence(element);
                operations.add(new OperationSpec(
                    operation,
                    endpoint,
                    soapActions.getOrDefault(operation, ""),
                    element != null ? element.getNamespaceURI() : targetNamespace,
                    element != null ? element.getLocalPart() : operation,
                    sequence.names(),
                    sequence.qualified()
                ));
            }
            return new ServiceDescriptor(locator, operations);
        }

        private void consume(URI source, String xml, String label) {
            base = source;
            schemaPath.clear();
            owner = null;
            try {
                XMLStreamReader2 reader = (XMLStreamReader2) FACTORY.get().createXMLStreamReader(new StringReader(xml));
                while (reader.hasNext()) {
                    int event = reader.next();
                    if (event == XMLStreamConstants.START_ELEMENT) {
                        onStart(reader);
                    } else if (event == XMLStreamConstants.END_ELEMENT) {
                        onEnd(reader);
                    }
                }
                reader.closeCompletely();
            } catch (XMLStreamException e) {
                throw new DescriptorLoadException(label + " is not valid XML: " + e.getMessage(), e);
            }
        }

        private void onStart(XMLStreamReader2 reader) {
            String namespace = reader.getNamespaceURI();
            String local = reader.getLocalName();

            if (XSD_NS.equals(namespace)) {
                onSchemaStart(reader, local);
                return;
            }

            if (WSDL_NS.equals(namespace)) {
                switch (local) {
                    case "definitions":
                        targetNamespace = attribute(reader, "targetNamespace", "");
                        break;
                    case "message":
                    case "portType":
                    case "binding":
                    case "service":
                        section = local;
                        currentMessage = "message".equals(local) ? attribute(reader, "name", null) : null;
                        break;
                    case "part":
                        onPart(reader);
                        break;
                    case "operation":
                        currentOperation = attribute(reader, "name", null);
                        if ("portType".equals(section) && currentOperation != null) {
                            operationInputs.putIfAbsent(currentOperation, null);
                        }
                        break;
                    case "input":
                        if ("portType".equals(section) && currentOperation != null) {
                            String message = attribute(reader, "message", null);
                            operationInputs.put(currentOperation, message == null ? null : localPart(message));
                        }
                        break;
                    default:
                        break;
                }
                return;
            }

            if (SOAP11_BINDING_NS.equals(namespace) || SOAP12_BINDING_NS.equals(namespace)) {
                if ("operation".equals(local) && "binding".equals(section) && currentOperation != null) {
                    soapActions.putIfAbsent(currentOperation, attribute(reader, "soapAction", ""));
                } else if ("address".equals(local) && "service".equals(section) && address == null) {
                    address = attribute(reader, "location", null);
                }
            }
        }

        private void onEnd(XMLStreamReader2 reader) {
            String namespace = reader.getNamespaceURI();
            String local = reader.getLocalName();
            if (XSD_NS.equals(namespace)) {
                onSchemaEnd();
                return;
            }
            if (!WSDL_NS.equals(namespace)) {
                return;
            }
            if ("operation".equals(local)) {
                currentOperation = null;
            } else if (local.equals(section)) {
                section = null;
                currentMessage = null;
            }
        }

        private void onPart(XMLStreamReader2 reader) {
            if (!"message".equals(section) || currentMessage == null || messageElements.containsKey(currentMessage)) {
                return;
            }
            String element = attribute(reader, "element", null);
            if (element != null) {
                messageElements.put(currentMessage, qualify(reader, element));
            }
        }

        // ------------------------------------------------------------
        // XML Schema
        // ------------------------------------------------------------

        private void onSchemaStart(XMLStreamReader2 reader, String local) {
            int depth = schemaPath.size();
            switch (local) {
                case "schema":
                    if (depth == 0) {
                        schemaNamespace = attribute(reader, "targetNamespace", "");
                        schemaQualified = "qualified".equals(attribute(reader, "elementFormDefault", "unqualified"));
                    }
                    break;
                case "import":
                case "include":
                    if (depth == 1) {
                        enqueueSchema(attribute(reader, "schemaLocation", null));
                    }
                    break;
                case "element":
                    if (depth == 1) {
                        String name = attribute(reader, "name", null);
                        if (name != null) {
                            QName declared = new QName(schemaNamespace, name);
                            String type = attribute(reader, "type", null);
                            if (type != null) {
                                elementTypes.put(declared, qualify(reader, type));
                            }
                            startOwner(declared, false);
                        }
                    } else if (owner != null && insideOwnerGroup()) {
                        String name = attribute(reader, "name", null);
                        String ref = attribute(reader, "ref", null);
                        if (name != null) {
                            ownerChildren.add(name);
                        } else if (ref != null) {
                            ownerChildren.add(localPart(ref));
                        }
                    }
                    break;
                case "complexType":
                    if (depth == 1) {
                        String name = attribute(reader, "name", null);
                        if (name != null) {
                            startOwner(new QName(schemaNamespace, name), true);
                        }
                    }
                    break;
                default:
                    break;
            }
            schemaPath.push(local);
        }

        private void onSchemaEnd() {
            schemaPath.pop();
            if (schemaPath.size() == 1 && owner != null) {
                Sequence sequence = new Sequence(List.copyOf(ownerChildren), schemaQualified);
                if (ownerIsType) {
                    typeSequences.put(owner, sequence);
                } else if (!elementTypes.containsKey(owner)) {
                    elementSequences.put(owner, sequence);
                }
                owner = null;
            }
        }

        private void startOwner(QName name, boolean isType) {
            owner = name;
            ownerIsType = isType;
            ownerChildren = new ArrayList<>();
        }

        /**
         * 현재 위치가 선언 중인 타입의 최상위 모델 그룹(sequence/all/choice) 안인지.
         *
         * <p>경로: schema, [element,] complexType, 그룹...</p>
         */
        private boolean insideOwnerGroup() {
            int skip = ownerIsType ? 2 : 3;
            if (schemaPath.size() <= skip) {
                return false;
            }
            Iterator<String> fromRoot = schemaPath.descendingIterator();
            for (int i = 0; i < skip; i++) {
                fromRoot.next();
            }
            while (fromRoot.hasNext()) {
                if (!GROUPS.contains(fromRoot.next())) {
                    return false;
                }
            }
            return true;
        }

        private void enqueueSchema(String location) {
            if (location == null || location.isBlank()) {
                return;
            }
            URI resolved = base == null ? URI.create(location.trim()) : base.resolve(location.trim());
            if (seenSchemas.add(resolved)) {
                pendingSchemas.add(resolved);
            }
        }

        private Sequence requestSequence(QName element) {
            if (element == null) {
                return UNKNOWN;
            }
            Sequence inline = elementSequences.get(element);
            if (inline != null) {
                return inline;
            }
            QName type = elementTypes.get(element);
            Sequence named = type == null ? null : typeSequences.get(type);
            return named != null ? named : UNKNOWN;
        }

        private static QName qualify(XMLStreamReader2 reader, String qualified) {
            int colon = qualified.indexOf(':');
            String prefix = colon < 0 ? "" : qualified.substring(0, colon);
            String namespace = reader.getNamespaceContext().getNamespaceURI(prefix);
            return new QName(namespace == null ? "" : namespace, localPart(qualified));
        }

        private static String attribute(XMLStreamReader2 reader, String name, String defaultValue) {
            String value = reader.getAttributeValue(null, name);
            return value == null ? defaultValue : value;
        }

        private static String localPart(String qualified) {
            int colon = qualified.indexOf(':');
            return colon < 0 ? qualified : qualified.substring(colon + 1);
        }

        private record Sequence(List<String> names, boolean qualified) {
        }
    }
}
