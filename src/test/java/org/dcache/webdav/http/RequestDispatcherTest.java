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

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.dcache.webdav.Configuration;
import org.dcache.webdav.DavAuthenticationException;
import org.dcache.webdav.DavException;
import org.dcache.webdav.DavInvalidUrlException;
import org.dcache.webdav.DavNetworkException;
import org.dcache.webdav.DavProtocolException;
import org.dcache.webdav.Depth;
import org.dcache.webdav.auth.AuthenticationNegotiator;
import org.dcache.webdav.auth.NtlmAuthenticationHandler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RequestDispatcherTest
{
    private static final String MULTISTATUS = "<?xml version='1.0' encoding='utf-8'?>"
            + "<D:multistatus xmlns:D='DAV:'><D:response><D:href>/dav/</D:href>"
            + "<D:propstat><D:prop><D:resourcetype><D:collection/></D:resourcetype></D:prop>"
            + "<D:status>HTTP/1.1 200 OK</D:status></D:propstat></D:response></D:multistatus>";

    private MockWebServer server;
    private AuthenticationNegotiator negotiator;
    private RequestDispatcher dispatcher;

    @BeforeEach
    public void setup() throws Exception
    {
        server = new MockWebServer();
        server.start();
        negotiator = new AuthenticationNegotiator();
        dispatcher = new RequestDispatcher(HttpClientFactory.create(new Configuration()), negotiator,
                RequestDefaults.defaults().withBaseUrl(server.url("/dav/").uri()));
    }

    @AfterEach
    public void tearDown() throws Exception
    {
        dispatcher.close();
        server.shutdown();
    }

    private static MockResponse challenge()
    {
        return new MockResponse().setResponseCode(401).addHeader("WWW-Authenticate", "Basic realm=\"dCache\"");
    }

    @Test
    public void shouldReplayOnceAfterChallenge() throws Exception
    {
        negotiator.setCredentials("alice", "secret");
        server.enqueue(challenge());
        server.enqueue(new MockResponse().setResponseCode(200).setBody("hello"));

        DavResponse response = dispatcher.send(DavRequest.builder("GET", "file").build());

        assertThat(response.getBodyAsString()).isEqualTo("hello");
        assertThat(server.getRequestCount()).isEqualTo(2);
        assertThat(server.takeRequest().getHeader("Authorization")).isNull();
        RecordedRequest retry = server.takeRequest();
        assertThat(retry.getPath()).isEqualTo("/dav/file");
        assertThat(retry.getHeader("Authorization")).isEqualTo("Basic YWxpY2U6c2VjcmV0");
    }

    @Test
    public void shouldGiveUpAfterSecondChallenge()
    {
        negotiator.setCredentials("alice", "wrong");
        server.enqueue(challenge());
        server.enqueue(challenge());

        Outcome outcome = dispatcher.execute(DavRequest.builder("DELETE", "file").build());

        assertThat(outcome.getKind()).isEqualTo(Outcome.Kind.AUTHENTICATION_ERROR);
        assertThat(outcome.getError().get()).isInstanceOf(DavAuthenticationException.class)
                .hasMessageContaining("credentials rejected");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    public void shouldNotRetryPreemptiveCredentialsThatFailed()
    {
        negotiator.setCredentials("alice", "wrong");
        negotiator.enablePreemptive();
        server.enqueue(challenge());

        assertThatThrownBy(() -> dispatcher.send(DavRequest.builder("GET", "file").build()))
                .isInstanceOf(DavAuthenticationException.class);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    public void shouldFailChallengeWithoutCredentials()
    {
        server.enqueue(challenge());

        Outcome outcome = dispatcher.execute(DavRequest.builder("GET", "file").build());

        assertThat(outcome.getKind()).isEqualTo(Outcome.Kind.AUTHENTICATION_ERROR);
        assertThat(outcome.getError().get().getStatusCode()).isEqualTo(401);
    }

    @Test
    public void shouldNotReplayStreamedBody()
    {
        negotiator.setCredentials("alice", "secret");
        server.enqueue(challenge());
        server.enqueue(new MockResponse().setResponseCode(201));
        byte[] data = "payload".getBytes(StandardCharsets.UTF_8);

        DavRequest request = DavRequest.builder("PUT", "upload")
                .entity(ProgressEntity.ofStream(new ByteArrayInputStream(data), data.length,
                        "text/plain", null))
                .build();
        Outcome outcome = dispatcher.execute(request);

        assertThat(outcome.getKind()).isEqualTo(Outcome.Kind.AUTHENTICATION_ERROR);
        assertThat(outcome.getError().get()).hasMessageContaining("preemptive");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    public void shouldParseErrorConditions() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(423)
                .setBody("<D:error xmlns:D='DAV:'><D:lock-token-submitted><D:href>/dav/file</D:href>"
                        + "</D:lock-token-submitted></D:error>"));

        Outcome outcome = dispatcher.execute(DavRequest.builder("DELETE", "file").build());

        assertThat(outcome.getKind()).isEqualTo(Outcome.Kind.PROTOCOL_ERROR);
        assertThat(outcome.getResponse()).isPresent();
        DavProtocolException error = (DavProtocolException) outcome.getError().get();
        assertThat(error.getStatusCode()).isEqualTo(423);
        assertThat(error.getConditions()).containsExactly("lock-token-submitted");
        assertThat(error.getFirstCondition()).contains("lock-token-submitted");
        assertThat(error.isClientError()).isTrue();
        assertThat(error.getMethod()).isEqualTo("DELETE");
    }

    @Test
    public void shouldKeepUnstructuredErrorBody()
    {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("<html>boom</html>"));

        assertThatThrownBy(() -> dispatcher.send(DavRequest.builder("GET", "file").build()))
                .isInstanceOfSatisfying(DavProtocolException.class, e -> {
                    assertThat(e.isServerError()).isTrue();
                    assertThat(e.getConditions()).isEmpty();
                    assertThat(e.getResponseBody()).contains("<html>boom</html>");
                });
    }

    @Test
    public void shouldRequireMultistatusForPropfind()
    {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(MULTISTATUS));

        Outcome outcome = dispatcher.execute(DavRequest.builder("PROPFIND", "").depth(Depth.ZERO).build());

        assertThat(outcome.getKind()).isEqualTo(Outcome.Kind.PROTOCOL_ERROR);
        assertThat(outcome.getError().get().getStatusCode()).isEqualTo(200);
    }

    @Test
    public void shouldSendWebdavHeaders() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(207).setBody(MULTISTATUS));
        server.enqueue(new MockResponse().setResponseCode(201));

        dispatcher.send(DavRequest.builder("PROPFIND", "").depth(Depth.INFINITY).xml("<x/>").build());
        dispatcher.send(DavRequest.builder("MOVE", "a")
                .destination("b")
                .overwrite(false)
                .ifLockToken("opaquelocktoken:1")
                .build());

        RecordedRequest propfind = server.takeRequest();
        assertThat(propfind.getMethod()).isEqualTo("PROPFIND");
        assertThat(propfind.getHeader("Depth")).isEqualTo("infinity");
        assertThat(propfind.getHeader("Content-Type")).isEqualTo(DavRequest.XML_CONTENT_TYPE);
        assertThat(propfind.getHeader("User-Agent")).isEqualTo(RequestDefaults.DEFAULT_USER_AGENT);
        assertThat(propfind.getBody().readUtf8()).isEqualTo("<x/>");

        RecordedRequest move = server.takeRequest();
        assertThat(move.getHeader("Destination")).isEqualTo(server.url("/dav/b").toString());
        assertThat(move.getHeader("Overwrite")).isEqualTo("F");
        assertThat(move.getHeader("If")).isEqualTo("(<opaquelocktoken:1>)");
    }

    @Test
    public void shouldLetRequestHeadersOverrideDefaults() throws Exception
    {
        dispatcher.updateDefaults(d -> d.withHeaders(Map.of("X-Trace", "default", "X-Other", "kept")));
        server.enqueue(new MockResponse().setResponseCode(200));

        dispatcher.send(DavRequest.builder("GET", "file").header("x-trace", "request").build());

        RecordedRequest request = server.takeRequest();
        assertThat(request.getHeader("X-Trace")).isEqualTo("request");
        assertThat(request.getHeaders().values("X-Trace")).hasSize(1);
        assertThat(request.getHeader("X-Other")).isEqualTo("kept");
    }

    @Test
    public void shouldClassifyMultistatus() throws Exception
    {
        server.enqueue(new MockResponse().setResponseCode(207).setBody(MULTISTATUS));

        Outcome outcome = dispatcher.execute(DavRequest.builder("PROPFIND", "").build());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getResponse().get().getStatusCode()).isEqualTo(207);
    }

    @Test
    public void shouldCompleteNtlmHandshakeWithinOneRetry() throws Exception
    {
        negotiator.setHandler(new NtlmAuthenticationHandler("alice", "secret", "DOM", "WS1") {
            @Override
            protected String createType1Message()
            {
                return "TYPE1";
            }

            @Override
            protected String createType3Message(String type2Challenge)
            {
                return "TYPE3-" + type2Challenge;
            }
        });
        negotiator.enablePreemptive();
        server.enqueue(new MockResponse().setResponseCode(401).addHeader("WWW-Authenticate", "NTLM T2"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("welcome"));

        DavResponse response = dispatcher.send(DavRequest.builder("GET", "file").build());

        assertThat(response.getBodyAsString()).isEqualTo("welcome");
        assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("NTLM TYPE1");
        assertThat(server.takeRequest().getHeader("Authorization")).isEqualTo("NTLM TYPE3-T2");
    }

    @Test
    public void shouldClassifyRelativeUrlWithoutBase() throws Exception
    {
        dispatcher.updateDefaults(d -> d.withBaseUrl(null));

        Outcome outcome = dispatcher.execute(DavRequest.builder("GET", "foo/bar").build());

        assertThat(outcome.getKind()).isEqualTo(Outcome.Kind.INVALID_URL);
        assertThat(outcome.getResponse()).isEmpty();
        assertThat(outcome.getError().get()).isInstanceOfSatisfying(DavInvalidUrlException.class, e -> {
            assertThat(e.getMethod()).isEqualTo("GET");
            assertThat(e.getRawUrl()).contains("foo/bar");
            assertThat(e.getUrl()).isNull();
            assertThat(e.getMessage()).startsWith("GET foo/bar failed: ");
        });
        assertThat(server.getRequestCount()).isEqualTo(0);
    }

    @Test
    public void shouldRejectMalformedUrlBeforeSending()
    {
        assertThatThrownBy(() -> dispatcher.send(DavRequest.builder("DELETE", "http://exa mple.com/%%").build()))
                .isInstanceOf(DavInvalidUrlException.class)
                .hasMessageContaining("DELETE");
        assertThatThrownBy(() -> dispatcher.open(DavRequest.builder("GET", "http://exa mple.com/%%").build()))
                .isInstanceOf(DavInvalidUrlException.class);
        assertThat(server.getRequestCount()).isEqualTo(0);
    }

    @Test
    public void shouldRejectMalformedDestination() throws Exception
    {
        Outcome outcome = dispatcher.execute(DavRequest.builder("MOVE", "a")
                .destination("http://exa mple.com/%%").build());

        assertThat(outcome.getKind()).isEqualTo(Outcome.Kind.INVALID_URL);
        assertThat(outcome.getError().get().getMethod()).isEqualTo("MOVE");
        assertThat(server.getRequestCount()).isEqualTo(0);
    }

    @Test
    public void shouldReportNetworkErrorAfterClose() throws Exception
    {
        dispatcher.close();

        Outcome outcome = dispatcher.execute(DavRequest.builder("GET", "file").build());

        assertThat(outcome.getKind()).isEqualTo(Outcome.Kind.NETWORK_ERROR);
        assertThat(outcome.getError().get()).isInstanceOf(DavNetworkException.class);
        assertThat(server.getRequestCount()).isEqualTo(0);
    }

    @Test
    public void shouldReportNetworkErrorForUnreachableServer()
    {
        String url = "http://127.0.0.1:1/gone";

        assertThatThrownBy(() -> dispatcher.send(DavRequest.builder("GET", url).build()))
                .isInstanceOf(DavNetworkException.class)
                .isInstanceOf(DavException.class);
    }
}
