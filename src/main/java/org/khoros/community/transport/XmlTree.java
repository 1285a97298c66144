package org.khoros.community.transport;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts v1 XML responses into the same tree shape the v1 API produces when it
 * answers in JSON.
 *
 * <p>Attributes and child elements become map keys (repeated children become a list).
 * An element that has attributes or children keeps its text under {@code "$"};
 * a plain leaf element becomes its text. So
 * {@code <response status="success"><value type="int">544</value></response>} becomes
 * {@code {"response": {"status": "success", "value": {"type": "int", "$": "544"}}}}.
 */
public final class XmlTree {

    private XmlTree() {}

    /**
     * Parse an XML document.
     *
     * @throws IllegalArgumentException if the text is not well-formed XML
     */
    public static Map<String, Object> parse(String xml) {
        try {
            var factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setNamespaceAware(false);

            var builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new RaisingErrorHandler());
            var document = builder.parse(new InputSource(new StringReader(xml.strip())));
            var root = document.getDocumentElement();

            var tree = new LinkedHashMap<String, Object>();
            tree.put(root.getTagName(), convert(root));
            return tree;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        } catch (SAXException | IOException e) {
            throw new IllegalArgumentException("Malformed XML: " + e.getMessage(), e);
        }
    }

    private static Object convert(Element element) {
        var map = new LinkedHashMap<String, Object>();

        var attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            var attribute = attributes.item(i);
            map.put(attribute.getNodeName(), attribute.getNodeValue());
        }

        var grouped = new LinkedHashMap<String, List<Object>>();
        var text = new StringBuilder();
        var children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            var child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                var childElement = (Element) child;
                grouped.computeIfAbsent(childElement.getTagName(), k -> new ArrayList<>())
                        .add(convert(childElement));
            } else if (child.getNodeType() == Node.TEXT_NODE
                    || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(child.getNodeValue());
            }
        }
        grouped.forEach((name, values) -> map.put(name, values.size() == 1 ? values.get(0) : values));

        var content = text.toString().strip();
        if (map.isEmpty()) {
            return content;
        }
        if (!content.isEmpty()) {
            map.put("$", content);
        }
        return map;
    }

    private static final class RaisingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException e) {
            // recoverable; the document is still usable
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
