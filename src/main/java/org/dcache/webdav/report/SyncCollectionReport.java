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
import java.util.OptionalInt;

import org.dcache.webdav.DavMalformedResponseException;
import org.dcache.webdav.Depth;
import org.dcache.webdav.xml.Multistatus;
import org.dcache.webdav.xml.MultistatusParser;
import org.dcache.webdav.xml.XmlHelper;
import org.dcache.webdav.xml.XmlRequestEncoder;

import static java.util.stream.Collectors.toList;

/**
 * The RFC 6578 sync-collection report.  An empty or null token asks for
 * the initial synchronisation.  The depth given here becomes the
 * sync-level of the request.
 */
public class SyncCollectionReport implements DavReport<SyncResult>
{
    public static final List<String> DEFAULT_PROPERTIES = ImmutableList.of("getetag",
            "getcontentlength", "getlastmodified");

    private final String syncToken;
    private final int depth;
    private final List<QName> properties;
    private final Integer limit;

    public SyncCollectionReport(String syncToken)
    {
        this(syncToken, Depth.ONE, DEFAULT_PROPERTIES, null);
    }

    public SyncCollectionReport(String syncToken, int depth, Collection<String> properties,
            Integer limit)
    {
        this.syncToken = syncToken;
        this.depth = depth;
        this.properties = properties.stream()
                .map(p -> XmlRequestEncoder.propertyName(p, XmlHelper.DAV_NAMESPACE))
                .collect(toList());
        this.limit = limit;
    }

    @Override
    public String toXml()
    {
        return XmlRequestEncoder.syncCollection(syncToken, Depth.depthToString(depth),
                limit, properties);
    }

    /** The scope travels in sync-level; the report itself is always Depth 0. */
    @Override
    public OptionalInt getDepth()
    {
        return OptionalInt.of(Depth.ZERO);
    }

    @Override
    public SyncResult fromMultistatus(Multistatus multistatus)
            throws DavMalformedResponseException
    {
        return new SyncResult(MultistatusParser.toResources(multistatus),
                multistatus.getSyncToken().orElse(null));
    }
}
