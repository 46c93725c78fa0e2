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

import java.util.List;

import org.dcache.webdav.Configuration;
import org.dcache.webdav.DavMalformedResponseException;
import org.dcache.webdav.auth.AuthenticationNegotiator;
import org.dcache.webdav.xml.ActiveLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LockManagerTest
{
    private static final String TOKEN = "opaquelocktoken:e71d4fae-5dec-22d6-fea5-00a0c91e6be4";

    private static final String LOCK_BODY = "<?xml version='1.0' encoding='utf-8'?>"
            + "<D:prop xmlns:D='DAV:'><D:lockdiscovery><D:activelock>"
            + "<D:locktype><D:write/></D:locktype><D:lockscope><D:exclusive/></D:lockscope>"
            + "<D:depth>0</D:depth><D:timeout>Second-3600</D:timeout>"
            + "<D:locktoken><D:href>" + TOKEN + "</D:href></D:locktoken>"
            + "</D:activelock></D:lockdiscovery></D:prop>";

    private MockWebServer server;
    private RequestDispatcher dispatcher;
    private LockManager locks;

    @BeforeEach
    public void setup() throws Exception
    {
        server = new MockWebServer();
        server.start();
        dispatcher = new RequestDispatcher(HttpClientFactory.create(new Configuration()),
                new AuthenticationNegotiator(), RequestDefaults.defaults().withBaseUrl(server.url("/").uri()));
        locks = new LockManager(dispatcher);
    }

    @AfterEach
    public void tearDown() throws Exception
    {
        dispatcher.close();
        server.shutdown();
    }

    @Test
    public void shouldTakeTokenFromBody() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(LOCK_BODY));

        String token = locks.lock("file", 600, "alice");

        assertThat(token).isEqualTo(TOKEN);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("LOCK");
        assertThat(request.getHeader("Timeout")).isEqualTo("Second-600");
        assertThat(request.getBody().readUtf8())
                .contains("<D:exclusive/>")
                .contains("<D:owner>alice</D:owner>");
    }

    @Test
    public void shouldTakeTokenFromHeader() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(201).addHeader("Lock-Token", "<" + TOKEN + ">"));

        assertThat(locks.lock("file", LockManager.DEFAULT_TIMEOUT, "alice")).isEqualTo(TOKEN);
    }

    @Test
    public void shouldFailWithoutToken()
    {
        server.enqueue(new MockResponse().setResponseCode(200));

        assertThatThrownBy(() -> locks.lock("file", 60, "alice"))
                .isInstanceOfSatisfying(DavMalformedResponseException.class, e -> {
                    assertThat(e.getMethod()).isEqualTo("LOCK");
                    assertThat(e.getStatusCode()).isEqualTo(200);
                });
    }

    @Test
    public void shouldKeepTokenWhenRefreshReturnsNone() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(200));

        String token = locks.refreshLock("file", TOKEN);

        assertThat(token).isEqualTo(TOKEN);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("If")).isEqualTo("(<" + TOKEN + ">)");
        assertThat(request.getHeader("Timeout")).isEqualTo("Second-3600");
        assertThat(request.getBodySize()).isZero();
    }

    @Test
    public void shouldUseNewTokenFromRefresh() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(LOCK_BODY));

        assertThat(locks.refreshLock("file", "opaquelocktoken:old")).isEqualTo(TOKEN);
    }

    @Test
    public void shouldSendLockTokenOnUnlock() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(204));

        locks.unlock("file", TOKEN);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("UNLOCK");
        assertThat(request.getHeader("Lock-Token")).isEqualTo("<" + TOKEN + ">");
    }

    @Test
    public void shouldDiscoverLocks() throws Exception
    {
        String multistatus = "<D:multistatus xmlns:D='DAV:'><D:response><D:href>/file</D:href>"
                + "<D:propstat>" + LOCK_BODY.substring(LOCK_BODY.indexOf("<D:prop ")).replace(" xmlns:D='DAV:'", "")
                + "<D:status>HTTP/1.1 200 OK</D:status></D:propstat></D:response></D:multistatus>";
        server.enqueue(new MockResponse().setResponseCode(207).setBody(multistatus));
        server.enqueue(new MockResponse().setResponseCode(207).setBody(multistatus));

        List<ActiveLock> active = locks.discoverLocks("file");

        assertThat(active).hasSize(1);
        assertThat(active.get(0).getToken()).contains(TOKEN);
        assertThat(locks.getLockToken("file")).contains(TOKEN);
        assertThat(server.takeRequest().getHeader("Depth")).isEqualTo("0");
    }

    @Test
    public void shouldReportUnlockedResource() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(207).setBody(
                "<D:multistatus xmlns:D='DAV:'><D:response><D:href>/file</D:href><D:propstat>"
                + "<D:prop><D:lockdiscovery/></D:prop><D:status>HTTP/1.1 200 OK</D:status>"
                + "</D:propstat></D:response></D:multistatus>"));

        assertThat(locks.isLocked("file")).isFalse();
    }
}
