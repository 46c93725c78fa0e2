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

import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.methods.CloseableHttpResponse;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Optional;

/**
 * A successful response whose body has not been read yet.  Closing it
 * releases the connection.
 */
public class StreamedResponse implements Closeable
{
    private final String method;
    private final URI url;
    private final CloseableHttpResponse response;

    StreamedResponse(String method, URI url, CloseableHttpResponse response)
    {
        this.method = method;
        this.url = url;
        this.response = response;
    }

    public String getMethod()
    {
        return method;
    }

    public URI getUrl()
    {
        return url;
    }

    public int getStatusCode()
    {
        return response.getStatusLine().getStatusCode();
    }

    /** The declared length of the (possibly encoded) body, or -1. */
    public long getContentLength()
    {
        HttpEntity entity = response.getEntity();
        return entity == null ? -1 : entity.getContentLength();
    }

    public Optional<String> getContentEncoding()
    {
        return getFirstHeader("Content-Encoding");
    }

    public Optional<String> getFirstHeader(String name)
    {
        Header header = response.getFirstHeader(name);
        return header == null ? Optional.empty() : Optional.of(header.getValue());
    }

    /** The body as sent by the server, without decoding. */
    public InputStream getRawStream() throws IOException
    {
        HttpEntity entity = response.getEntity();
        return entity == null ? new ByteArrayInputStream(new byte[0]) : entity.getContent();
    }

    @Override
    public void close() throws IOException
    {
        response.close();
    }
}
