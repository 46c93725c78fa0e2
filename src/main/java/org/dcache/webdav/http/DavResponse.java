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

import com.google.common.collect.ImmutableListMultimap;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.dcache.webdav.DavMalformedResponseException;

/**
 * A completed exchange with a fully read, decoded body.
 */
public class DavResponse
{
    /** Converts a response body into a value. */
    @FunctionalInterface
    public interface BodyParser<T>
    {
        T parse(byte[] body) throws DavMalformedResponseException;
    }

    private final String method;
    private final URI url;
    private final int statusCode;
    private final String reasonPhrase;
    private final ImmutableListMultimap<String,String> headers;
    private final byte[] body;

    public DavResponse(String method, URI url, int statusCode, String reasonPhrase,
            ImmutableListMultimap<String,String> headers, byte[] body)
    {
        this.method = method;
        this.url = url;
        this.statusCode = statusCode;
        this.reasonPhrase = reasonPhrase == null ? "" : reasonPhrase;
        this.headers = headers;
        this.body = body;
    }

    public String getMethod()
    {
        return method;
    }

    /** The resolved URL the request was sent to. */
    public URI getUrl()
    {
        return url;
    }

    public int getStatusCode()
    {
        return statusCode;
    }

    public String getReasonPhrase()
    {
        return reasonPhrase;
    }

    /** Header values; names are case-insensitive. */
    public List<String> getHeaders(String name)
    {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public Optional<String> getFirstHeader(String name)
    {
        return getHeaders(name).stream().findFirst();
    }

    public byte[] getBody()
    {
        return body;
    }

    public boolean hasBody()
    {
        return body.length > 0;
    }

    public String getBodyAsString()
    {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * Parse the body, attributing any failure to this request.
     */
    public <T> T parse(BodyParser<T> parser) throws DavMalformedResponseException
    {
        try {
            return parser.parse(body);
        } catch (DavMalformedResponseException e) {
            if (e.getMethod() != null) {
                throw e;
            }
            throw new DavMalformedResponseException(method, url, statusCode, e.getMessage(), e);
        }
    }

    @Override
    public String toString()
    {
        return method + " " + url + " " + statusCode + " " + reasonPhrase;
    }
}
