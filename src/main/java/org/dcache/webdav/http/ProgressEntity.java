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

import com.google.common.io.MoreFiles;
import org.apache.http.entity.AbstractHttpEntity;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * A request body that is copied to the connection in chunks, reporting
 * progress after each chunk.  A body backed by a file can be sent again;
 * a body backed by a caller's stream can be sent only once.
 */
public class ProgressEntity extends AbstractHttpEntity
{
    private static final int BUFFER_SIZE = 64 * 1024;

    @FunctionalInterface
    private interface Source
    {
        InputStream open() throws IOException;
    }

    private final Source source;
    private final long length;
    private final boolean repeatable;
    private final ProgressListener listener;
    private boolean consumed;

    private ProgressEntity(Source source, long length, boolean repeatable, String contentType,
            ProgressListener listener)
    {
        this.source = source;
        this.length = length;
        this.repeatable = repeatable;
        this.listener = listener;
        if (contentType != null) {
            setContentType(contentType);
        }
    }

    /**
     * A body read from a stream.  If the length is negative, the stream is
     * sent with chunked encoding until it ends.
     */
    public static ProgressEntity ofStream(InputStream in, long length, String contentType,
            ProgressListener listener)
    {
        requireNonNull(in);
        return new ProgressEntity(() -> in, length, false, contentType, listener);
    }

    public static ProgressEntity ofFile(Path file, String contentType, ProgressListener listener)
            throws IOException
    {
        return new ProgressEntity(MoreFiles.asByteSource(file)::openStream, Files.size(file), true,
                contentType, listener);
    }

    @Override
    public boolean isRepeatable()
    {
        return repeatable;
    }

    @Override
    public long getContentLength()
    {
        return length;
    }

    @Override
    public InputStream getContent() throws IOException
    {
        return open();
    }

    private synchronized InputStream open() throws IOException
    {
        if (!repeatable) {
            if (consumed) {
                throw new IllegalStateException("Stream body has already been sent");
            }
            consumed = true;
        }
        return source.open();
    }

    @Override
    public void writeTo(OutputStream out) throws IOException
    {
        byte[] buffer = new byte[BUFFER_SIZE];
        long sent = 0;
        try (InputStream in = open()) {
            while (length < 0 || sent < length) {
                int max = length < 0 ? buffer.length : (int) Math.min(buffer.length, length - sent);
                int count = in.read(buffer, 0, max);
                if (count == -1) {
                    break;
                }
                out.write(buffer, 0, count);
                sent += count;
                if (listener != null) {
                    listener.onProgress(sent, length);
                }
            }
        }
    }

    @Override
    public boolean isStreaming()
    {
        return !repeatable && !consumed;
    }
}
