package com.al.clinicalconverter.parser.xml;

import com.al.clinicalconverter.exception.InvalidFormatException;
import com.al.clinicalconverter.model.enums.ConversionType;
import com.al.clinicalconverter.model.value.Repeated;
import com.al.clinicalconverter.model.value.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.al.clinicalconverter.util.MappingConstants.XML_ATTRIBUTES_KEY;

/**
 * Parses well-formed XML into a {@link Value} tree.
 *
 * <pre>
 * &lt;prescription id="RX1"&gt;&lt;drug&gt;A&lt;/drug&gt;&lt;drug&gt;B&lt;/drug&gt;&lt;note/&gt;&lt;/prescription&gt;
 *   { prescription: { @attributes: { id: RX1 }, drug: [A, B], note: {} } }
 * </pre>
 *
 * <p>
 * A childless element with text becomes that trimmed text, dropping its
 * attributes. A childless element without text becomes a mapping holding
 * only its attributes (or nothing).
 */
@Slf4j
@Component
public class XmlTreeNormalizer {

    /** Thread-local, hardened DOM builder (no external entities or DTDs). */
    private static final ThreadLocal<DocumentBuilder> TL_DOM = ThreadLocal.withInitial(() -> {
        try {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setNamespaceAware(false);
            f.setValidating(false);
            f.setXIncludeAware(false);
            f.setExpandEntityReferences(false);

            // DOCTYPE is well-formed XML and accepted; nothing external is ever loaded
            f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", false);
            f.setFeature("http://xml.org/sax/features/external-general-entities", false);
            f.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            f.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            f.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            f.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");

            DocumentBuilder builder = f.newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Failed to init secure XML builder", e);
        }
    });

    /**
     * @return a mapping with the root tag as its only key
     * @throws InvalidFormatException with the parser diagnostic when the
     *                                text is not well-formed
     */
    public Value normalize(String xml) {
        Element root = parseDocument(xml).getDocumentElement();
        Map<String, Repeated<Value>> tree = new LinkedHashMap<>();
        tree.put(root.getTagName(), Repeated.one(normalizeElement(root)));
        return Value.mapping(tree);
    }

    public boolean isWellFormed(String xml) {
        try {
            parseDocument(xml);
            return true;
        } catch (InvalidFormatException e) {
            log.debug("XML is not well-formed: {}", e.getMessage());
            return false;
        }
    }

    private Document parseDocument(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new InvalidFormatException(ConversionType.XML, "Invalid XML data: document is empty");
        }
        DocumentBuilder builder = TL_DOM.get();
        builder.reset();
        builder.setErrorHandler(new RethrowingErrorHandler());
        try {
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXException e) {
            throw new InvalidFormatException(ConversionType.XML, "Invalid XML data: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new InvalidFormatException(ConversionType.XML, "Unable to read XML data: " + e.getMessage(), e);
        }
    }

    private Value normalizeElement(Element element) {
        Map<String, Repeated<Value>> entries = new LinkedHashMap<>();

        NamedNodeMap attributes = element.getAttributes();
        if (attributes.getLength() > 0) {
            Map<String, Repeated<Value>> attributeMap = new LinkedHashMap<>();
            for (int i = 0; i < attributes.getLength(); i++) {
                Node attribute = attributes.item(i);
                attributeMap.put(attribute.getNodeName(), Repeated.one(Value.primitive(attribute.getNodeValue())));
            }
            entries.put(XML_ATTRIBUTES_KEY, Repeated.one(Value.mapping(attributeMap)));
        }

        boolean hasChildElements = false;
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            hasChildElements = true;
            Element child = (Element) node;
            entries.merge(child.getTagName(), Repeated.one(normalizeElement(child)),
                    (existing, added) -> existing.append(added.first()));
        }

        if (!hasChildElements) {
            String text = element.getTextContent() == null ? "" : element.getTextContent().trim();
            if (!text.isEmpty()) {
                return Value.primitive(text);
            }
        }
        return Value.mapping(entries);
    }

    /**
     * Keeps the JDK parser from printing fatal errors to stderr.
     */
    private static final class RethrowingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            log.debug("XML parser warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
