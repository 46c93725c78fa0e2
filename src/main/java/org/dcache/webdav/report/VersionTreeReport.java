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
package org.dcache.webdav.report;

import com.google.common.collect.ImmutableList;

import javax.xml.namespace.QName;

import java.util.Collection;
import java.util.List;

import org.dcache.webdav.DavMalformedResponseException;
import org.dcache.webdav.DavResource;
import org.dcache.webdav.xml.Multistatus;
import org.dcache.webdav.xml.MultistatusParser;
import org.dcache.webdav.xml.XmlHelper;
import org.dcache.webdav.xml.XmlRequestEncoder;

import static java.util.stream.Collectors.toList;

/**
 * The RFC 3253 DAV:version-tree report, describing every version of a
 * version-controlled resource.
 */
public class VersionTreeReport implements DavReport<List<DavResource>>
{
    public static final List<String> DEFAULT_PROPERTIES = ImmutableList.of("version-name",
            "creator-displayname", "creation-date", "successor-set", "predecessor-set");

    private final List<QName> properties;

    public VersionTreeReport()
    {
        this(DEFAULT_PROPERTIES);
    }

    public VersionTreeReport(Collection<String> properties)
    {
        this.properties = properties.stream()
                .map(p -> XmlRequestEncoder.propertyName(p, XmlHelper.DAV_NAMESPACE))
                .collect(toList());
    }

    @Override
    public String toXml()
    {
        return XmlRequestEncoder.versionTree(properties);
    }

    @Override
    public List<DavResource> fromMultistatus(Multistatus multistatus)
            throws DavMalformedResponseException
    {
        return MultistatusParser.toResources(multistatus);
    }
}
