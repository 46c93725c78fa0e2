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

import com.google.common.collect.ImmutableList;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * The base class for all failures reported by the WebDAV client.  Each
 * failure carries the HTTP method and URL of the operation that failed.
 * Where the server replied, the status code, the raw response body and any
 * machine-readable conditions from a DAV:error body are also available.
 */
public class DavException extends IOException
{
    private static final long serialVersionUID = 1L;

    public static final int NO_STATUS = -1;

    private final String method;
    private final URI url;
    private final int statusCode;
    private final String body;
    private final List<String> conditions;

    protected DavException(String message, String method, URI url, int statusCode,
            String body, List<String> conditions, Throwable cause)
    {
        super(message, cause);
        this.method = method;
        this.url = url;
        this.statusCode = statusCode;
        this.body = body;
        this.conditions = conditions == null ? ImmutableList.of() : ImmutableList.copyOf(conditions);
    }

    protected static String describe(String method, URI url, String reason)
    {
        if (method == null) {
            return reason;
        }
        return method + " " + url + " failed: " + reason;
    }

    /** The HTTP method of the failed request, if known. */
    public String getMethod()
    {
        return method;
    }

    /** The URL of the failed request, if known. */
    public URI getUrl()
    {
        return url;
    }

    /** The status code the server replied with, or {@link #NO_STATUS}. */
    public int getStatusCode()
    {
        return statusCode;
    }

    public Optional<String> getResponseBody()
    {
        return Optional.ofNullable(body);
    }

    /**
     * The local names of the precondition or postcondition elements found
     * in the response body; e.g., {@literal lock-token-submitted}.
     */
    public List<String> getConditions()
    {
        return conditions;
    }
}
