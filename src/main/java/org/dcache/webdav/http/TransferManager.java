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
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.dcache.webdav.DavException;

import static java.util.Objects.requireNonNull;

/**
 * Moves file content to and from the server without holding it in
 * memory.  Uploads are copied to the connection chunk by chunk; downloads
 * are decoded on the fly.
 * <p>
 * If a download to a file fails part-way, the file is closed but not
 * removed: whatever was received remains on disk and it is up to the
 * caller to delete it.
 */
public class TransferManager
{
    private static final int BUFFER_SIZE = 64 * 1024;

    private final RequestDispatcher dispatcher;

    public TransferManager(RequestDispatcher dispatcher)
    {
        this.dispatcher = requireNonNull(dispatcher);
    }

    /**
     * Upload the content of a stream.  The stream is read once and closed.
     * Since it cannot be sent twice, a server that challenges the upload
     * causes an authentication failure; use preemptive authentication.
     *
     * @param length the number of bytes to send, or -1 to send until the
     * stream ends
     */
    public void upload(String url, InputStream source, long length, String contentType,
            ProgressListener listener, Map<String,String> headers) throws DavException
    {
        DavRequest request = DavRequest.builder("PUT", url)
                .headers(headers)
                .entity(ProgressEntity.ofStream(source, length, contentType, listener))
                .build();
        dispatcher.send(request);
    }

    /** Upload a file.  The file is read again if the server asks for credentials. */
    public void uploadFile(String url, Path file, String contentType, ProgressListener listener,
            Map<String,String> headers) throws IOException
    {
        DavRequest request = DavRequest.builder("PUT", url)
                .headers(headers)
                .entity(ProgressEntity.ofFile(file, contentType, listener))
                .build();
        dispatcher.send(request);
    }

    /**
     * Start a download.  The returned stream yields the decoded content and
     * must be closed by the caller.
     */
    public DownloadStream download(String url, Map<String,String> headers) throws DavException
    {
        DavRequest request = DavRequest.builder("GET", url).headers(headers).build();
        return DownloadStream.open(dispatcher.open(request));
    }

    /**
     * Download to a file, replacing it if it exists.  Progress is reported
     * in bytes received from the server, which for compressed content is
     * less than the bytes written.
     */
    public void downloadToPath(String url, Path target, ProgressListener listener,
            Map<String,String> headers) throws IOException
    {
        try (DownloadStream in = download(url, headers);
             OutputStream out = Files.newOutputStream(target)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int count;
            while ((count = in.read(buffer)) != -1) {
                out.write(buffer, 0, count);
                if (listener != null) {
                    listener.onProgress(in.getReceivedBytes(), in.getExpectedBytes());
                }
            }
        }
    }
}
