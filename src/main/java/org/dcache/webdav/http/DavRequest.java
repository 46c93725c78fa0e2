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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.apache.http.HttpEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.dcache.webdav.Depth;

import static java.util.Objects.requireNonNull;

/**
 * A WebDAV request before it is sent: method, target URL (absolute, or
 * relative to the base URL), headers and an optional body.
 */
public final class DavRequest
{
    public static final String XML_CONTENT_TYPE = "application/xml; charset=utf-8";

    /** Methods whose successful reply is a 207 Multi-Status body. */
    private static final Set<String> MULTISTATUS_METHODS =
            ImmutableSet.of("PROPFIND", "PROPPATCH", "REPORT", "SEARCH");

    private final String method;
    private final String url;
    private final String destination;
    private final ImmutableMap<String,String> headers;
    private final HttpEntity entity;

    private DavRequest(Builder builder)
    {
        method = builder.method;
        url = builder.url;
        destination = builder.destination;
        headers = ImmutableMap.copyOf(builder.headers);
        entity = builder.entity;
    }

    public static Builder builder(String method, String url)
    {
        return new Builder(method, url);
    }

    public String getMethod()
    {
        return method;
    }

    public String getUrl()
    {
        return url;
    }

    /** The Destination of a COPY or MOVE, resolved like the target URL. */
    public Optional<String> getDestination()
    {
        return Optional.ofNullable(destination);
    }

    public Map<String,String> getHeaders()
    {
        return headers;
    }

    public Optional<HttpEntity> getEntity()
    {
        return Optional.ofNullable(entity);
    }

    /** Whether the request can be sent a second time after a 401. */
    public boolean isReplayable()
    {
        return entity == null || entity.isRepeatable();
    }

    public boolean expectsMultistatus()
    {
        return MULTISTATUS_METHODS.contains(method);
    }

    @Override
    public String toString()
    {
        return method + " " + url;
    }

    /** Builder for requests. */
    public static class Builder
    {
        private final String method;
        private final String url;
        private final Map<String,String> headers = new LinkedHashMap<>();
        private String destination;
        private HttpEntity entity;

        private Builder(String method, String url)
        {
            this.method = requireNonNull(method);
            this.url = requireNonNull(url);
        }

        public Builder header(String name, String value)
        {
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String,String> values)
        {
            headers.putAll(values);
            return this;
        }

        public Builder depth(int depth)
        {
            return header("Depth", Depth.depthToString(depth));
        }

        public Builder destination(String url)
        {
            destination = url;
            return this;
        }

        public Builder overwrite(boolean overwrite)
        {
            return header("Overwrite", overwrite ? "T" : "F");
        }

        /** Submit a lock token through an untagged If header. */
        public Builder ifLockToken(String token)
        {
            return token == null ? this : header("If", "(<" + token + ">)");
        }

        public Builder lockToken(String token)
        {
            return header("Lock-Token", "<" + token + ">");
        }

        public Builder timeout(int seconds)
        {
            return header("Timeout", "Second-" + seconds);
        }

        public Builder expectContinue()
        {
            return header("Expect", "100-continue");
        }

        public Builder xml(String body)
        {
            header("Content-Type", XML_CONTENT_TYPE);
            entity = new StringEntity(body, ContentType.create("application/xml", StandardCharsets.UTF_8));
            return this;
        }

        public Builder entity(HttpEntity body)
        {
            entity = body;
            return this;
        }

        public DavRequest build()
        {
            return new DavRequest(this);
        }
    }
}
