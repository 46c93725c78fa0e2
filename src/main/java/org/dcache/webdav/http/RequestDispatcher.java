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
import com.google.common.io.ByteStreams;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.methods.RequestBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

import org.dcache.webdav.DavAuthenticationException;
import org.dcache.webdav.DavException;
import org.dcache.webdav.DavInvalidUrlException;
import org.dcache.webdav.DavNetworkException;
import org.dcache.webdav.DavProtocolException;
import org.dcache.webdav.auth.AuthChallenge;
import org.dcache.webdav.auth.AuthenticationNegotiator;
import org.dcache.webdav.xml.DavError;

import static java.util.Objects.requireNonNull;
import static org.dcache.webdav.auth.AuthenticationNegotiator.AUTHORIZATION;

/**
 * Sends WebDAV requests.  Every request goes through here: the target is
 * resolved against the base URL, default and authentication headers are
 * added, a 401 is answered at most once, and the reply is classified.
 * <p>
 * The dispatcher keeps no per-request state, so one instance may be used
 * from several threads at once.
 */
public class RequestDispatcher implements Closeable
{
    private static final Logger LOGGER = LoggerFactory.getLogger(RequestDispatcher.class);

    private final CloseableHttpClient client;
    private final AuthenticationNegotiator negotiator;
    private volatile RequestDefaults defaults;
    private volatile boolean closed;

    public RequestDispatcher(CloseableHttpClient client, AuthenticationNegotiator negotiator,
            RequestDefaults defaults)
    {
        this.client = requireNonNull(client);
        this.negotiator = requireNonNull(negotiator);
        this.defaults = requireNonNull(defaults);
    }

    public RequestDefaults getDefaults()
    {
        return defaults;
    }

    public synchronized void updateDefaults(UnaryOperator<RequestDefaults> update)
    {
        defaults = requireNonNull(update.apply(defaults));
    }

    public AuthenticationNegotiator getNegotiator()
    {
        return negotiator;
    }

    /** Resolve a URL against the current base URL. */
    public URI resolve(String url) throws DavInvalidUrlException
    {
        return resolve(null, url, defaults);
    }

    private static URI resolve(String method, String url, RequestDefaults current)
            throws DavInvalidUrlException
    {
        try {
            return current.resolve(url);
        } catch (IllegalArgumentException e) {
            throw new DavInvalidUrlException(method, url, e);
        }
    }

    /**
     * Send a request and read the whole reply.  This method does not throw
     * for failed requests; the failure is described by the outcome.
     */
    public Outcome execute(DavRequest request)
    {
        URI url;
        try {
            url = resolve(request.getMethod(), request.getUrl(), defaults);
        } catch (DavInvalidUrlException e) {
            return Outcome.invalidUrl(e);
        }
        LOGGER.debug("{} {}", request.getMethod(), url);

        try (CloseableHttpResponse response = exchange(request, url)) {
            DavResponse reply = read(request, url, response);
            LOGGER.debug("{} {} {}", request.getMethod(), url, reply.getStatusCode());
            if (isSuccess(request, reply.getStatusCode())) {
                return Outcome.success(reply);
            }
            return Outcome.protocolError(reply, protocolError(reply));
        } catch (DavAuthenticationException e) {
            return Outcome.authenticationError(e);
        } catch (DavInvalidUrlException e) {
            return Outcome.invalidUrl(e);
        } catch (IOException e) {
            return Outcome.networkError(new DavNetworkException(request.getMethod(), url, e));
        }
    }

    /** Send a request, returning the reply only if it was successful. */
    public DavResponse send(DavRequest request) throws DavException
    {
        return execute(request).getOrThrow();
    }

    /**
     * Send a request and return the reply without reading the body.  The
     * caller must close the returned response.
     */
    public StreamedResponse open(DavRequest request) throws DavException
    {
        URI url = resolve(request.getMethod(), request.getUrl(), defaults);
        LOGGER.debug("{} {} (streamed)", request.getMethod(), url);

        CloseableHttpResponse response;
        try {
            response = exchange(request, url);
        } catch (DavAuthenticationException | DavInvalidUrlException e) {
            throw e;
        } catch (IOException e) {
            throw new DavNetworkException(request.getMethod(), url, e);
        }

        int status = response.getStatusLine().getStatusCode();
        if (isSuccess(request, status)) {
            return new StreamedResponse(request.getMethod(), url, response);
        }

        DavResponse reply;
        try (CloseableHttpResponse failed = response) {
            reply = read(request, url, failed);
        } catch (IOException e) {
            throw new DavNetworkException(request.getMethod(), url, e);
        }
        throw protocolError(reply);
    }

    private static boolean isSuccess(DavRequest request, int status)
    {
        return request.expectsMultistatus() ? status == 207 : status >= 200 && status < 300;
    }

    /**
     * Send the request, answering a 401 challenge at most once.  A request
     * whose body cannot be sent a second time is not retried.
     */
    private CloseableHttpResponse exchange(DavRequest request, URI url) throws IOException
    {
        if (closed) {
            throw new IOException("client has been shut down");
        }

        RequestDefaults current = defaults;
        Map<String,String> headers = headersFor(request, url, current);
        String sentAuthorization = headers.get(AUTHORIZATION);

        CloseableHttpResponse response = client.execute(build(request, url, current, headers));
        if (response.getStatusLine().getStatusCode() != 401) {
            return response;
        }

        AuthChallenge challenge = new AuthChallenge(request.getMethod(), url,
                values(response, "WWW-Authenticate"), sentAuthorization);
        discard(response);

        if (!request.isReplayable()) {
            throw new DavAuthenticationException(request.getMethod(), url,
                    "authentication required for streamed upload, use preemptive authentication");
        }

        Optional<String> answer = negotiator.respondToChallenge(challenge);
        if (!answer.isPresent()) {
            throw new DavAuthenticationException(request.getMethod(), url,
                    "server requires authentication " + challenge.getSchemes());
        }
        if (answer.get().equals(sentAuthorization)) {
            throw new DavAuthenticationException(request.getMethod(), url, "credentials rejected");
        }

        LOGGER.debug("Retrying {} {} after {} challenge", request.getMethod(), url, challenge.getSchemes());
        headers.put(AUTHORIZATION, answer.get());
        CloseableHttpResponse retry = client.execute(build(request, url, current, headers));
        if (retry.getStatusLine().getStatusCode() == 401) {
            discard(retry);
            LOGGER.info("Server rejected credentials for {} {}", request.getMethod(), url);
            throw new DavAuthenticationException(request.getMethod(), url, "credentials rejected");
        }
        return retry;
    }

    private Map<String,String> headersFor(DavRequest request, URI url, RequestDefaults current)
            throws DavInvalidUrlException
    {
        Map<String,String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(current.headers());
        headers.putAll(negotiator.headersForRequest(url));
        headers.putAll(request.getHeaders());
        Optional<String> destination = request.getDestination();
        if (destination.isPresent()) {
            headers.put("Destination",
                    resolve(request.getMethod(), destination.get(), current).toASCIIString());
        }
        return headers;
    }

    private static HttpUriRequest build(DavRequest request, URI url, RequestDefaults current,
            Map<String,String> headers)
    {
        RequestBuilder builder = RequestBuilder.create(request.getMethod()).setUri(url);
        headers.forEach((name, value) -> {
            // set by the HTTP client from the entity
            if (!name.equalsIgnoreCase("Content-Length") && !name.equalsIgnoreCase("Transfer-Encoding")) {
                builder.setHeader(name, value);
            }
        });
        request.getEntity().ifPresent(builder::setEntity);
        current.requestConfig().ifPresent(builder::setConfig);
        return builder.build();
    }

    private static void discard(CloseableHttpResponse response) throws IOException
    {
        try (CloseableHttpResponse closing = response) {
            EntityUtils.consume(closing.getEntity());
        }
    }

    private static List<String> values(CloseableHttpResponse response, String name)
    {
        List<String> values = new ArrayList<>();
        for (Header header : response.getHeaders(name)) {
            values.add(header.getValue());
        }
        return values;
    }

    private static DavResponse read(DavRequest request, URI url, CloseableHttpResponse response)
            throws IOException
    {
        ImmutableListMultimap.Builder<String,String> headers = ImmutableListMultimap.builder();
        for (Header header : response.getAllHeaders()) {
            headers.put(header.getName().toLowerCase(Locale.ROOT), header.getValue());
        }

        byte[] body = new byte[0];
        HttpEntity entity = response.getEntity();
        if (entity != null) {
            try (InputStream in = entity.getContent()) {
                body = ByteStreams.toByteArray(in);
            }
            Header encoding = response.getFirstHeader("Content-Encoding");
            if (body.length > 0 && encoding != null && ContentDecoding.isSupported(encoding.getValue())) {
                try (InputStream in = ContentDecoding.decode(new ByteArrayInputStream(body), encoding.getValue())) {
                    body = ByteStreams.toByteArray(in);
                }
            }
        }

        return new DavResponse(request.getMethod(), url, response.getStatusLine().getStatusCode(),
                response.getStatusLine().getReasonPhrase(), headers.build(), body);
    }

    private static DavProtocolException protocolError(DavResponse reply)
    {
        Optional<DavError> error = DavError.parse(reply.getBody());
        if (!error.isPresent() && reply.hasBody()) {
            LOGGER.debug("{} {} failed with unstructured body", reply.getMethod(), reply.getUrl());
        }
        return new DavProtocolException(reply.getMethod(), reply.getUrl(), reply.getStatusCode(),
                reply.getReasonPhrase(), reply.getBodyAsString(),
                error.map(DavError::getConditions).orElse(null),
                error.flatMap(DavError::getDescription).orElse(null));
    }

    @Override
    public void close() throws IOException
    {
        closed = true;
        client.close();
    }
}
