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

import com.google.common.io.CountingInputStream;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

import org.dcache.webdav.DavException;
import org.dcache.webdav.DavNetworkException;

/**
 * The decoded body of a download.  Failures while reading are reported as
 * {@link DavNetworkException}; closing the stream releases the connection
 * even if the body was not read to the end.
 */
public class DownloadStream extends FilterInputStream
{
    private final StreamedResponse response;
    private final CountingInputStream counter;

    private DownloadStream(InputStream decoded, CountingInputStream counter, StreamedResponse response)
    {
        super(decoded);
        this.response = response;
        this.counter = counter;
    }

    public static DownloadStream open(StreamedResponse response) throws DavNetworkException
    {
        try {
            CountingInputStream counter = new CountingInputStream(response.getRawStream());
            InputStream decoded = ContentDecoding.decode(counter, response.getContentEncoding().orElse(null));
            return new DownloadStream(decoded, counter, response);
        } catch (IOException e) {
            DavNetworkException failure = new DavNetworkException(response.getMethod(), response.getUrl(), e);
            try {
                response.close();
            } catch (IOException suppressed) {
                failure.addSuppressed(suppressed);
            }
            throw failure;
        }
    }

    /** Bytes received from the server so far, before decoding. */
    public long getReceivedBytes()
    {
        return counter.getCount();
    }

    /** The declared length of the body as sent, or -1. */
    public long getExpectedBytes()
    {
        return response.getContentLength();
    }

    @Override
    public int read() throws IOException
    {
        try {
            return super.read();
        } catch (DavException e) {
            throw e;
        } catch (IOException e) {
            throw new DavNetworkException(response.getMethod(), response.getUrl(), e);
        }
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException
    {
        try {
            return super.read(b, off, len);
        } catch (DavException e) {
            throw e;
        } catch (IOException e) {
            throw new DavNetworkException(response.getMethod(), response.getUrl(), e);
        }
    }

    @Override
    public void close() throws IOException
    {
        // releases the connection, or aborts it if the body was not read to the end
        try {
            response.close();
        } finally {
            super.close();
        }
    }
}
