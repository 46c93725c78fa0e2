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

import org.w3c.dom.Element;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.dcache.webdav.DavMalformedResponseException;
import org.dcache.webdav.DavResource;

import static org.dcache.webdav.xml.XmlHelper.children;
import static org.dcache.webdav.xml.XmlHelper.firstChild;
import static org.dcache.webdav.xml.XmlHelper.hasDescendant;
import static org.dcache.webdav.xml.XmlHelper.isNamed;
import static org.dcache.webdav.xml.XmlHelper.localName;
import static org.dcache.webdav.xml.XmlHelper.text;

/**
 * Parser for 207 Multi-Status bodies.
 */
public final class MultistatusParser
{
    private MultistatusParser()
    {
    }

    public static Multistatus parse(byte[] body) throws DavMalformedResponseException
    {
        Element root = XmlHelper.parse(body).getDocumentElement();
        if (!isNamed(root, "multistatus")) {
            throw new DavMalformedResponseException("Expected multistatus, found " + localName(root));
        }

        List<MultistatusResponse> responses = new ArrayList<>();
        for (Element response : XmlHelper.children(root, "response")) {
            responses.add(parseResponse(response));
        }

        return new Multistatus(responses,
                firstChild(root, "sync-token").map(XmlHelper::text).orElse(null),
                firstChild(root, "responsedescription").map(XmlHelper::text).orElse(null));
    }

    private static MultistatusResponse parseResponse(Element response)
            throws DavMalformedResponseException
    {
        String href = firstChild(response, "href").map(XmlHelper::text)
                .filter(h -> !h.isEmpty())
                .orElseThrow(() -> new DavMalformedResponseException("response without href"));
        String description = firstChild(response, "responsedescription")
                .map(XmlHelper::text).orElse(null);

        List<Propstat> propstats = new ArrayList<>();
        for (Element propstat : XmlHelper.children(response, "propstat")) {
            String statusLine = firstChild(propstat, "status").map(XmlHelper::text)
                    .orElseThrow(() -> new DavMalformedResponseException("propstat without status for " + href));
            PropertySet properties = firstChild(propstat, "prop")
                    .map(PropertySet::of)
                    .orElse(PropertySet.empty());
            propstats.add(new Propstat(parseStatus(statusLine), statusLine, properties));
        }

        if (!propstats.isEmpty()) {
            return MultistatusResponse.withPropstats(href, propstats, description);
        }

        String statusLine = firstChild(response, "status").map(XmlHelper::text)
                .orElseThrow(() -> new DavMalformedResponseException("response for " + href
                        + " has neither status nor propstat"));
        return MultistatusResponse.withStatus(href, parseStatus(statusLine), statusLine, description);
    }

    /**
     * Extract the code from a status line such as "HTTP/1.1 404 Not Found".
     * Returns -1 if there is no code.
     */
    public static int parseStatus(String statusLine)
    {
        String[] parts = statusLine.trim().split("\\s+");
        if (parts.length >= 2) {
            try {
                return Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                return -1;
            }
        }
        return -1;
    }

    public static List<DavResource> parseResources(byte[] body) throws DavMalformedResponseException
    {
        return toResources(parse(body));
    }

    public static List<DavResource> toResources(Multistatus multistatus)
            throws DavMalformedResponseException
    {
        List<DavResource> resources = new ArrayList<>();
        for (MultistatusResponse response : multistatus.getResponses()) {
            resources.add(toResource(response));
        }
        return resources;
    }

    /**
     * Build a resource from the successful propstats of a response.  A
     * property returned without a value is present with an empty value.
     */
    public static DavResource toResource(MultistatusResponse response)
            throws DavMalformedResponseException
    {
        Map<String,String> properties = new LinkedHashMap<>();
        List<String> resourceTypes = new ArrayList<>();
        for (Propstat propstat : response.getPropstats()) {
            if (propstat.isSuccessful()) {
                properties.putAll(propstat.getProperties().asMap());
                propstat.getProperties().getElement("resourcetype")
                        .ifPresent(e -> resourceTypes.addAll(resourceTypes(e)));
            }
        }

        return DavResource.builder(toUri(response.getHref()))
                .statusCode(statusOf(response))
                .creation(parseDate(properties.get("creationdate")).orElse(null))
                .modified(parseDate(properties.get("getlastmodified")).orElse(null))
                .contentType(nonEmpty(properties.get("getcontenttype")))
                .etag(nonEmpty(properties.get("getetag")))
                .displayName(nonEmpty(properties.get("displayname")))
                .contentLanguage(nonEmpty(properties.get("getcontentlanguage")))
                .contentLength(parseLength(properties.get("getcontentlength")))
                .resourceTypes(resourceTypes)
                .customProperties(properties)
                .build();
    }

    private static List<String> resourceTypes(Element resourcetype)
    {
        List<String> types = new ArrayList<>();
        for (Element child : children(resourcetype)) {
            types.add(localName(child));
        }
        if (!types.contains(PropertySet.COLLECTION) && hasDescendant(resourcetype, PropertySet.COLLECTION)) {
            types.add(PropertySet.COLLECTION);
        }
        return types;
    }

    private static int statusOf(MultistatusResponse response)
    {
        if (response.getStatus().isPresent()) {
            return response.getStatus().getAsInt();
        }
        return response.getPropstats().stream()
                .filter(Propstat::isSuccessful)
                .findFirst()
                .orElse(response.getPropstats().get(0))
                .getStatus();
    }

    static URI toUri(String href) throws DavMalformedResponseException
    {
        try {
            return new URI(href);
        } catch (URISyntaxException e) {
            try {
                // unescaped characters in the path
                return new URI(null, null, href, null);
            } catch (URISyntaxException retry) {
                throw new DavMalformedResponseException("Bad href \"" + href + "\": " + e.getMessage(), e);
            }
        }
    }

    private static String nonEmpty(String value)
    {
        return value == null || value.isEmpty() ? null : value;
    }

    private static long parseLength(String value)
    {
        if (value == null || value.isEmpty()) {
            return DavResource.DEFAULT_CONTENT_LENGTH;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return DavResource.DEFAULT_CONTENT_LENGTH;
        }
    }

    /**
     * Parse a date in either RFC 1123 format (getlastmodified) or ISO 8601
     * format (creationdate).
     */
    public static Optional<Instant> parseDate(String value)
    {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(OffsetDateTime.parse(value).toInstant());
            } catch (DateTimeParseException iso) {
                return Optional.empty();
            }
        }
    }
}
