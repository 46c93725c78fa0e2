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
package org.dcache.webdav;

import java.net.URI;

/**
 * A response body could not be parsed or lacks a required element.
 */
public class DavMalformedResponseException extends DavException
{
    private static final long serialVersionUID = 1L;

    public DavMalformedResponseException(String reason)
    {
        this(reason, null);
    }

    public DavMalformedResponseException(String reason, Throwable cause)
    {
        super(reason, null, null, NO_STATUS, null, null, cause);
    }

    public DavMalformedResponseException(String method, URI url, int statusCode,
            String reason, Throwable cause)
    {
        super(describe(method, url, reason), method, url, statusCode, null, null, cause);
    }
}
