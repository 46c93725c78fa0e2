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

import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.util.Locale;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Undoes the Content-Encoding of a response body.  Only gzip and deflate
 * are supported; any other encoding is passed through unchanged, as is an
 * empty body.  Deflate bodies are accepted both with the zlib wrapper and
 * without it, since servers disagree on which one "deflate" means.
 */
public final class ContentDecoding
{
    private static final int BUFFER_SIZE = 8192;

    private ContentDecoding()
    {
    }

    public static boolean isSupported(String contentEncoding)
    {
        if (contentEncoding == null) {
            return false;
        }
        String encoding = contentEncoding.toLowerCase(Locale.ROOT);
        return encoding.contains("gzip") || encoding.contains("deflate");
    }

    public static InputStream decode(InputStream raw, String contentEncoding) throws IOException
    {
        if (!isSupported(contentEncoding)) {
            return raw;
        }

        PushbackInputStream in = new PushbackInputStream(raw, 2);
        int first = in.read();
        if (first == -1) {
            // an empty body has no header to decode
            return in;
        }
        in.unread(first);

        if (contentEncoding.toLowerCase(Locale.ROOT).contains("gzip")) {
            return new GZIPInputStream(in, BUFFER_SIZE);
        }
        Inflater inflater = new Inflater(!hasZlibHeader(in));
        return new InflaterInputStream(in, inflater, BUFFER_SIZE) {
            @Override
            public void close() throws IOException
            {
                try {
                    super.close();
                } finally {
                    inflater.end();
                }
            }
        };
    }

    private static boolean hasZlibHeader(PushbackInputStream in) throws IOException
    {
        byte[] header = new byte[2];
        int count = in.readNBytes(header, 0, 2);
        in.unread(header, 0, count);
        if (count < 2) {
            return false;
        }
        int cmf = header[0] & 0xff;
        int flg = header[1] & 0xff;
        return (cmf & 0x0f) == 8 && ((cmf << 8) | flg) % 31 == 0;
    }
}
