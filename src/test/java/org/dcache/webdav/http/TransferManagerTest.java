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

import com.google.common.io.ByteStreams;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPOutputStream;

import org.dcache.webdav.Configuration;
import org.dcache.webdav.DavNetworkException;
import org.dcache.webdav.DavProtocolException;
import org.dcache.webdav.auth.AuthenticationNegotiator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TransferManagerTest
{
    private static final byte[] CONTENT = repeat("The quick brown fox jumps over the lazy dog. ", 2000);

    private MockWebServer server;
    private RequestDispatcher dispatcher;
    private TransferManager transfers;

    @TempDir
    Path dir;

    private static byte[] repeat(String text, int times)
    {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < times; i++) {
            sb.append(text);
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] gzip(byte[] data) throws IOException
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (GZIPOutputStream out = new GZIPOutputStream(bytes)) {
            out.write(data);
        }
        return bytes.toByteArray();
    }

    private static byte[] deflate(byte[] data, boolean zlibWrapper) throws IOException
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, !zlibWrapper);
        try (DeflaterOutputStream out = new DeflaterOutputStream(bytes, deflater)) {
            out.write(data);
        } finally {
            deflater.end();
        }
        return bytes.toByteArray();
    }

    private static MockResponse encoded(byte[] body, String encoding)
    {
        return new MockResponse().setResponseCode(200)
                .addHeader("Content-Encoding", encoding)
                .setBody(new Buffer().write(body));
    }

    @BeforeEach
    public void setup() throws Exception
    {
        server = new MockWebServer();
        server.start();
        dispatcher = new RequestDispatcher(HttpClientFactory.create(new Configuration()),
                new AuthenticationNegotiator(),
                RequestDefaults.defaults().withBaseUrl(server.url("/").uri()).withCompression(true));
        transfers = new TransferManager(dispatcher);
    }

    @AfterEach
    public void tearDown() throws Exception
    {
        dispatcher.close();
        server.shutdown();
    }

    @Test
    public void shouldDecodeGzipDownload() throws Exception
    {
        byte[] compressed = gzip(CONTENT);
        server.enqueue(encoded(compressed, "gzip"));

        try (DownloadStream in = transfers.download("file", Map.of())) {
            assertThat(ByteStreams.toByteArray(in)).isEqualTo(CONTENT);
            assertThat(in.getReceivedBytes()).isEqualTo(compressed.length);
            assertThat(in.getExpectedBytes()).isEqualTo(compressed.length);
        }

        assertThat(server.takeRequest().getHeader("Accept-Encoding")).isEqualTo("gzip, deflate");
    }

    @Test
    public void shouldDecodeRawDeflateDownload() throws Exception
    {
        server.enqueue(encoded(deflate(CONTENT, false), "deflate"));

        try (InputStream in = transfers.download("file", Map.of())) {
            assertThat(ByteStreams.toByteArray(in)).isEqualTo(CONTENT);
        }
    }

    @Test
    public void shouldDecodeZlibDeflateDownload() throws Exception
    {
        server.enqueue(encoded(deflate(CONTENT, true), "deflate"));

        try (InputStream in = transfers.download("file", Map.of())) {
            assertThat(ByteStreams.toByteArray(in)).isEqualTo(CONTENT);
        }
    }

    @Test
    public void shouldReportDownloadProgress() throws Exception
    {
        byte[] compressed = gzip(CONTENT);
        server.enqueue(encoded(compressed, "gzip"));
        List<long[]> progress = new ArrayList<>();
        Path target = dir.resolve("out.txt");

        transfers.downloadToPath("file", target, (done, total) -> progress.add(new long[] {done, total}),
                Map.of());

        assertThat(Files.readAllBytes(target)).isEqualTo(CONTENT);
        assertThat(progress).isNotEmpty();
        long[] last = progress.get(progress.size() - 1);
        assertThat(last[0]).isEqualTo(compressed.length);
        assertThat(last[1]).isEqualTo(compressed.length);
        for (int i = 1; i < progress.size(); i++) {
            assertThat(progress.get(i)[0]).isGreaterThanOrEqualTo(progress.get(i - 1)[0]);
        }
    }

    @Test
    public void shouldDownloadEmptyGzipBody() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(200).addHeader("Content-Encoding", "gzip"));
        Path target = dir.resolve("empty.txt");

        transfers.downloadToPath("empty", target, null, Map.of());

        assertThat(target).exists();
        assertThat(Files.size(target)).isZero();
    }

    @Test
    public void shouldStreamEmptyDeflateBody() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(200).addHeader("Content-Encoding", "deflate"));

        try (DownloadStream in = transfers.download("empty", Map.of())) {
            assertThat(in.read()).isEqualTo(-1);
            assertThat(in.getReceivedBytes()).isZero();
        }
    }

    @Test
    public void shouldReportBrokenDownloadAsNetworkError() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(200)
                .setBody(new Buffer().write(CONTENT))
                .setSocketPolicy(SocketPolicy.DISCONNECT_DURING_RESPONSE_BODY));
        Path target = dir.resolve("partial.txt");

        assertThatThrownBy(() -> transfers.downloadToPath("file", target, null, Map.of()))
                .isInstanceOfSatisfying(DavNetworkException.class,
                        e -> assertThat(e.getMethod()).isEqualTo("GET"));

        // the partial file is left for the caller, and is no longer held open
        assertThat(target).exists();
        assertThat(Files.size(target)).isLessThan(CONTENT.length);
        Files.delete(target);
        assertThat(target).doesNotExist();
    }

    @Test
    public void shouldPassThroughPlainDownload() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("plain text"));

        try (InputStream in = transfers.download("file", Map.of())) {
            assertThat(new String(ByteStreams.toByteArray(in), StandardCharsets.UTF_8)).isEqualTo("plain text");
        }
    }

    @Test
    public void shouldFailDownloadOfMissingFile()
    {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("not here"));

        assertThatThrownBy(() -> transfers.download("missing", Map.of()))
                .isInstanceOfSatisfying(DavProtocolException.class, e -> assertThat(e.isNotFound()).isTrue());
    }

    @Test
    public void shouldReleaseConnectionOnEarlyClose() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(new Buffer().write(CONTENT)));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("second"));

        try (InputStream in = transfers.download("big", Map.of())) {
            assertThat(in.read()).isEqualTo('T');
        }

        try (InputStream in = transfers.download("small", Map.of())) {
            assertThat(new String(ByteStreams.toByteArray(in), StandardCharsets.UTF_8)).isEqualTo("second");
        }
    }

    @Test
    public void shouldUploadStreamWithProgress() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(201));
        List<Long> progress = new ArrayList<>();

        transfers.upload("upload", new ByteArrayInputStream(CONTENT), CONTENT.length, "text/plain",
                (done, total) -> {
                    assertThat(total).isEqualTo(CONTENT.length);
                    progress.add(done);
                }, Map.of());

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getBody().readByteArray()).isEqualTo(CONTENT);
        assertThat(request.getHeader("Content-Length")).isEqualTo(String.valueOf(CONTENT.length));
        assertThat(progress).last().isEqualTo((long) CONTENT.length);
    }

    @Test
    public void shouldUploadFile() throws Exception
    {
        Path file = dir.resolve("in.bin");
        Files.write(file, CONTENT);
        server.enqueue(new MockResponse().setResponseCode(204));

        transfers.uploadFile("dir/in.bin", file, "application/octet-stream", null,
                Map.of("Content-Type", "application/octet-stream"));

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/dir/in.bin");
        assertThat(request.getHeader("Content-Type")).isEqualTo("application/octet-stream");
        assertThat(request.getBody().readByteArray()).isEqualTo(CONTENT);
    }

    @Test
    public void shouldResendFileAfterChallenge() throws Exception
    {
        dispatcher.getNegotiator().setCredentials("alice", "secret");
        Path file = dir.resolve("in.bin");
        Files.write(file, CONTENT);
        server.enqueue(new MockResponse().setResponseCode(401).addHeader("WWW-Authenticate", "Basic"));
        server.enqueue(new MockResponse().setResponseCode(201));

        transfers.uploadFile("in.bin", file, "application/octet-stream", null, Map.of());

        server.takeRequest();
        RecordedRequest retry = server.takeRequest();
        assertThat(retry.getHeader("Authorization")).startsWith("Basic ");
        assertThat(retry.getBody().readByteArray()).isEqualTo(CONTENT);
    }
}
