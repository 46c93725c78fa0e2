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

import java.util.Collections;
import java.util.Map;
import java.util.OptionalInt;

import org.dcache.webdav.DavException;
import org.dcache.webdav.xml.Multistatus;

/**
 * A REPORT request: the body to send and how to interpret the multistatus
 * that comes back.
 * @param <T> the type of the interpreted result
 */
public interface DavReport<T>
{
    String toXml();

    /**
     * A Depth value this report insists on, overriding the caller's depth.
     */
    default OptionalInt getDepth()
    {
        return OptionalInt.empty();
    }

    default Map<String,String> getHeaders()
    {
        return Collections.emptyMap();
    }

    T fromMultistatus(Multistatus multistatus) throws DavException;
}
