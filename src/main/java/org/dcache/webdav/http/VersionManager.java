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
package org.dcache.webdav.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.net.URI;
import java.util.List;
import java.util.Optional;

import org.dcache.webdav.DavException;
import org.dcache.webdav.DavMalformedResponseException;
import org.dcache.webdav.Depth;
import org.dcache.webdav.xml.Multistatus;
import org.dcache.webdav.xml.MultistatusParser;
import org.dcache.webdav.xml.XmlHelper;
import org.dcache.webdav.xml.XmlRequestEncoder;

import static java.util.Collections.singleton;
import static java.util.Objects.requireNonNull;
import static org.dcache.webdav.xml.XmlHelper.DAV_NAMESPACE;
import static org.dcache.webdav.xml.XmlRequestEncoder.propertyName;

/**
 * The RFC 3253 versioning methods and retrieval of a named version.
 */
public class VersionManager
{
    private static final Logger LOGGER = LoggerFactory.getLogger(VersionManager.class);

    /** Header selecting a version by label, from RFC 3253. */
    public static final String LABEL = "Label";

    private final RequestDispatcher dispatcher;

    public VersionManager(RequestDispatcher dispatcher)
    {
        this.dispatcher = requireNonNull(dispatcher);
    }

    /**
     * Fetch the content of a version.  The version is looked for inside
     * the resource's version-history collection; if there is no history,
     * or it cannot be read, the resource itself is requested with a Label
     * header.  Only a failure of that last request is reported.
     */
    public byte[] getVersion(String url, String version) throws DavException
    {
        try {
            Optional<URI> history = getVersionHistoryUrl(url);
            if (history.isPresent()) {
                String versionUrl = UrlResolver.join(history.get().toString(), version);
                return dispatcher.send(DavRequest.builder("GET", versionUrl).build()).getBody();
            }
            LOGGER.debug("{} has no version-history, selecting version by label", url);
        } catch (DavException e) {
            LOGGER.debug("Version lookup through history of {} failed, selecting by label: {}",
                    url, e.getMessage());
        }

        DavRequest request = DavRequest.builder("GET", url).header(LABEL, version).build();
        return dispatcher.send(request).getBody();
    }

    /** The absolute URL of the version-history collection, if the server has one. */
    public Optional<URI> getVersionHistoryUrl(String url) throws DavException
    {
        Optional<String> href = versionHistory(url)
                .map(e -> {
                    List<String> hrefs = XmlHelper.hrefs(e);
                    return hrefs.isEmpty() ? XmlHelper.text(e) : hrefs.get(0);
                })
                .filter(h -> !h.isEmpty());
        if (!href.isPresent()) {
            return Optional.empty();
        }
        try {
            return Optional.of(dispatcher.resolve(url).resolve(href.get()));
        } catch (IllegalArgumentException e) {
            throw new DavMalformedResponseException("Bad version-history href \"" + href.get() + "\"", e);
        }
    }

    /** All hrefs listed in the version-history property. */
    public List<String> getVersionHistory(String url) throws DavException
    {
        return versionHistory(url).map(XmlHelper::hrefs).orElseGet(List::of);
    }

    private Optional<Element> versionHistory(String url) throws DavException
    {
        DavRequest request = DavRequest.builder("PROPFIND", url)
                .depth(Depth.ZERO)
                .xml(XmlRequestEncoder.propfind(singleton(propertyName("version-history", DAV_NAMESPACE))))
                .build();
        Multistatus multistatus = dispatcher.send(request).parse(MultistatusParser::parse);
        return multistatus.first()
                .flatMap(r -> r.successfulPropertiesWith("version-history"))
                .flatMap(p -> p.getElement("version-history"));
    }

    public void versionControl(String url) throws DavException
    {
        dispatcher.send(DavRequest.builder("VERSION-CONTROL", url)
                .xml(XmlRequestEncoder.versionControl(null)).build());
    }

    /** Check out a resource and return the URL of the checked-out resource. */
    public String checkout(String url) throws DavException
    {
        return location(dispatcher.send(DavRequest.builder("CHECKOUT", url)
                .xml(XmlRequestEncoder.checkout(null)).build()), url);
    }

    /** Check in a resource and return the URL of the new version. */
    public String checkin(String url, boolean keepCheckedOut) throws DavException
    {
        return location(dispatcher.send(DavRequest.builder("CHECKIN", url)
                .xml(XmlRequestEncoder.checkin(keepCheckedOut)).build()), url);
    }

    public void uncheckout(String url) throws DavException
    {
        dispatcher.send(DavRequest.builder("UNCHECKOUT", url)
                .xml(XmlRequestEncoder.uncheckout()).build());
    }

    public void baselineControl(String url) throws DavException
    {
        dispatcher.send(DavRequest.builder("BASELINE-CONTROL", url)
                .xml(XmlRequestEncoder.baselineControl(null)).build());
    }

    /** Create a baseline and return its URL. */
    public String makeBaseline(String url) throws DavException
    {
        return location(dispatcher.send(DavRequest.builder("MKBASELINE", url)
                .xml(XmlRequestEncoder.mkbaseline()).build()), url);
    }

    /**
     * The URL of the resource created by a versioning method: the Location
     * header, else the first href in the body, else the request URL.
     */
    private static String location(DavResponse response, String url)
    {
        Optional<String> location = response.getFirstHeader("Location");
        if (location.isPresent()) {
            return location.get();
        }
        if (response.hasBody()) {
            try {
                Optional<String> href = XmlHelper.textOfFirstDescendant(
                        response.parse(XmlHelper::parse).getDocumentElement(), "href");
                if (href.isPresent()) {
                    return href.get();
                }
            } catch (DavMalformedResponseException e) {
                LOGGER.debug("Ignoring unreadable {} reply body: {}", response.getMethod(), e.getMessage());
            }
        }
        return url;
    }
}
