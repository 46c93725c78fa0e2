/* dCache - http://www.dcache.org/
 *
 * Copyright (C) 2019 Deutsches Elektronen-Synchrotron
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.dcache.webdav.xml;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.dcache.webdav.DavMalformedResponseException;

/**
 * DOM utilities that compare elements by local name only.  Servers are
 * inconsistent in how they declare the DAV: namespace ("D:", "d:", a
 * default namespace, or an undeclared prefix), so every parser in this
 * package goes through these methods rather than matching on qualified
 * names.
 */
public final class XmlHelper
{
    public static final String DAV_NAMESPACE = "DAV:";

    private XmlHelper()
    {
    }

    /**
     * Parse a response body.  If the document is not namespace
     * well-formed (typically because a prefix is used without being
     * declared), it is parsed again without namespace processing.
     */
    public static Document parse(byte[] body) throws DavMalformedResponseException
    {
        if (body == null || body.length == 0) {
            throw new DavMalformedResponseException("Empty XML document");
        }

        try {
            return parse(body, true);
        } catch (SAXException e) {
            try {
                return parse(body, false);
            } catch (SAXException | IOException retry) {
                throw new DavMalformedResponseException("Bad XML: " + e.getMessage(), e);
            }
        } catch (IOException e) {
            throw new DavMalformedResponseException("Unable to read XML: " + e.getMessage(), e);
        }
    }

    private static Document parse(byte[] body, boolean namespaceAware)
            throws SAXException, IOException
    {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(namespaceAware);
        factory.setExpandEntityReferences(false);
        factory.setXIncludeAware(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return builder.parse(new InputSource(new ByteArrayInputStream(body)));
        } catch (ParserConfigurationException e) {
            throw new RuntimeException("XML parser misconfigured: " + e, e);
        }
    }

    /** The name of a node without any namespace prefix. */
    public static String localName(Node node)
    {
        String name = node.getLocalName();
        if (name == null) {
            name = node.getNodeName();
            int colon = name.indexOf(':');
            if (colon >= 0) {
                name = name.substring(colon + 1);
            }
        }
        return name;
    }

    public static boolean isNamed(Node node, String localName)
    {
        return node.getNodeType() == Node.ELEMENT_NODE && localName(node).equals(localName);
    }

    /** All element children, in document order. */
    public static List<Element> children(Element parent)
    {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    public static List<Element> children(Element parent, String localName)
    {
        List<Element> result = new ArrayList<>();
        for (Element child : children(parent)) {
            if (localName(child).equals(localName)) {
                result.add(child);
            }
        }
        return result;
    }

    public static Optional<Element> firstChild(Element parent)
    {
        return children(parent).stream().findFirst();
    }

    public static Optional<Element> firstChild(Element parent, String localName)
    {
        return children(parent, localName).stream().findFirst();
    }

    /** All descendants with the given local name, in document order. */
    public static List<Element> descendants(Element ancestor, String localName)
    {
        List<Element> result = new ArrayList<>();
        collectDescendants(ancestor, localName, result);
        return result;
    }

    private static void collectDescendants(Element parent, String localName, List<Element> result)
    {
        for (Element child : children(parent)) {
            if (localName(child).equals(localName)) {
                result.add(child);
            }
            collectDescendants(child, localName, result);
        }
    }

    public static Optional<Element> firstDescendant(Element ancestor, String localName)
    {
        for (Element child : children(ancestor)) {
            if (localName(child).equals(localName)) {
                return Optional.of(child);
            }
            Optional<Element> found = firstDescendant(child, localName);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    public static boolean hasDescendant(Element ancestor, String localName)
    {
        return firstDescendant(ancestor, localName).isPresent();
    }

    /** The trimmed text content of an element. */
    public static String text(Element element)
    {
        String content = element.getTextContent();
        return content == null ? "" : content.trim();
    }

    /**
     * The trimmed text of the first descendant with the given name, if that
     * text is non-empty.
     */
    public static Optional<String> textOfFirstDescendant(Element ancestor, String localName)
    {
        return firstDescendant(ancestor, localName)
                .map(XmlHelper::text)
                .filter(s -> !s.isEmpty());
    }

    /** Trimmed, non-empty texts of all descendant {@literal href} elements. */
    public static List<String> hrefs(Element ancestor)
    {
        List<String> result = new ArrayList<>();
        for (Element href : descendants(ancestor, "href")) {
            String value = text(href);
            if (!value.isEmpty()) {
                result.add(value);
            }
        }
        return result;
    }
}
