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

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import org.dcache.webdav.Configuration;
import org.dcache.webdav.DavProtocolException;
import org.dcache.webdav.auth.AuthenticationNegotiator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class VersionManagerTest
{
    private MockWebServer server;
    private RequestDispatcher dispatcher;
    private VersionManager versions;

    @BeforeEach
    public void setup() throws Exception
    {
        server = new MockWebServer();
        server.start();
        dispatcher = new RequestDispatcher(HttpClientFactory.create(new Configuration()),
                new AuthenticationNegotiator(), RequestDefaults.defaults().withBaseUrl(server.url("/").uri()));
        versions = new VersionManager(dispatcher);
    }

    @AfterEach
    public void tearDown() throws Exception
    {
        dispatcher.close();
        server.shutdown();
    }

    private static MockResponse history(String href)
    {
        return new MockResponse().setResponseCode(207).setBody(
                "<D:multistatus xmlns:D='DAV:'><D:response><D:href>/doc.txt</D:href><D:propstat>"
                + "<D:prop><D:version-history><D:href>" + href + "</D:href></D:version-history></D:prop>"
                + "<D:status>HTTP/1.1 200 OK</D:status></D:propstat></D:response></D:multistatus>");
    }

    @Test
    public void shouldFetchVersionFromHistory() throws Exception
    {
        server.enqueue(history("/his/doc/"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("version two"));

        byte[] content = versions.getVersion("doc.txt", "V2");

        assertThat(new String(content, StandardCharsets.UTF_8)).isEqualTo("version two");
        RecordedRequest propfind = server.takeRequest();
        assertThat(propfind.getMethod()).isEqualTo("PROPFIND");
        assertThat(propfind.getHeader("Depth")).isEqualTo("0");
        assertThat(propfind.getBody().readUtf8()).contains("version-history");
        assertThat(server.takeRequest().getPath()).isEqualTo("/his/doc/V2");
    }

    @Test
    public void shouldFallBackToLabelWhenHistoryUnavailable() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("labelled"));

        byte[] content = versions.getVersion("doc.txt", "V2");

        assertThat(new String(content, StandardCharsets.UTF_8)).isEqualTo("labelled");
        server.takeRequest();
        RecordedRequest get = server.takeRequest();
        assertThat(get.getMethod()).isEqualTo("GET");
        assertThat(get.getPath()).isEqualTo("/doc.txt");
        assertThat(get.getHeader(VersionManager.LABEL)).isEqualTo("V2");
    }

    @Test
    public void shouldFallBackToLabelWhenVersionMissingFromHistory() throws Exception
    {
        server.enqueue(history("/his/doc/"));
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("labelled"));

        assertThat(new String(versions.getVersion("doc.txt", "V9"), StandardCharsets.UTF_8))
                .isEqualTo("labelled");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    public void shouldReportFailureOfLabelRequest()
    {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThatThrownBy(() -> versions.getVersion("doc.txt", "V2"))
                .isInstanceOfSatisfying(DavProtocolException.class, e -> assertThat(e.isNotFound()).isTrue());
    }

    @Test
    public void shouldReturnLocationOfCheckout() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(201).addHeader("Location", "/wr/doc.txt"));
        server.enqueue(new MockResponse().setResponseCode(201).setBody(
                "<D:checkin-response xmlns:D='DAV:'><D:href>/his/doc/V3</D:href></D:checkin-response>"));
        server.enqueue(new MockResponse().setResponseCode(200));

        assertThat(versions.checkout("doc.txt")).isEqualTo("/wr/doc.txt");
        assertThat(versions.checkin("doc.txt", true)).isEqualTo("/his/doc/V3");
        assertThat(versions.makeBaseline("coll/")).isEqualTo("coll/");

        assertThat(server.takeRequest().getMethod()).isEqualTo("CHECKOUT");
        RecordedRequest checkin = server.takeRequest();
        assertThat(checkin.getMethod()).isEqualTo("CHECKIN");
        assertThat(checkin.getBody().readUtf8()).contains("keep-checked-out");
        assertThat(server.takeRequest().getMethod()).isEqualTo("MKBASELINE");
    }

    @Test
    public void shouldListHistoryHrefs() throws Exception
    {
        server.enqueue(history("/his/doc/"));

        assertThat(versions.getVersionHistory("doc.txt")).containsExactly("/his/doc/");
    }
}
