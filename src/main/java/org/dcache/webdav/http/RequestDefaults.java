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
import org.apache.http.client.config.CookieSpecs;
import org.apache.http.client.config.RequestConfig;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The settings applied to every request: base URL, user agent,
 * compression, cookie policy and extra headers.  Instances are immutable;
 * each {@code with} method returns a modified copy.
 */
public final class RequestDefaults
{
    public static final String DEFAULT_USER_AGENT = "dCache-WebDAV-Client/1.0";
    public static final String ACCEPT_ENCODING = "gzip, deflate";

    private static final RequestDefaults DEFAULTS = new RequestDefaults(null, DEFAULT_USER_AGENT,
            false, false, ImmutableMap.of(), null);

    private final URI baseUrl;
    private final String userAgent;
    private final boolean compression;
    private final boolean ignoreCookies;
    private final ImmutableMap<String,String> headers;
    private final RequestConfig requestConfig;

    private RequestDefaults(URI baseUrl, String userAgent, boolean compression,
            boolean ignoreCookies, ImmutableMap<String,String> headers, RequestConfig requestConfig)
    {
        this.baseUrl = baseUrl;
        this.userAgent = requireNonNull(userAgent);
        this.compression = compression;
        this.ignoreCookies = ignoreCookies;
        this.headers = headers;
        this.requestConfig = requestConfig;
    }

    public static RequestDefaults defaults()
    {
        return DEFAULTS;
    }

    public RequestDefaults withBaseUrl(URI url)
    {
        return new RequestDefaults(url, userAgent, compression, ignoreCookies, headers, requestConfig);
    }

    public RequestDefaults withUserAgent(String agent)
    {
        return new RequestDefaults(baseUrl, agent, compression, ignoreCookies, headers, requestConfig);
    }

    public RequestDefaults withCompression(boolean enabled)
    {
        return new RequestDefaults(baseUrl, userAgent, enabled, ignoreCookies, headers, requestConfig);
    }

    public RequestDefaults withIgnoreCookies(boolean ignore)
    {
        return new RequestDefaults(baseUrl, userAgent, compression, ignore, headers, requestConfig);
    }

    public RequestDefaults withHeaders(Map<String,String> extra)
    {
        return new RequestDefaults(baseUrl, userAgent, compression, ignoreCookies,
                ImmutableMap.copyOf(extra), requestConfig);
    }

    /** The timeouts and other transport settings to apply per request. */
    public RequestDefaults withRequestConfig(RequestConfig config)
    {
        return new RequestDefaults(baseUrl, userAgent, compression, ignoreCookies, headers, config);
    }

    public Optional<URI> getBaseUrl()
    {
        return Optional.ofNullable(baseUrl);
    }

    public String getUserAgent()
    {
        return userAgent;
    }

    public boolean isCompressionEnabled()
    {
        return compression;
    }

    public boolean isIgnoringCookies()
    {
        return ignoreCookies;
    }

    /** The headers sent with every request. */
    public Map<String,String> headers()
    {
        Map<String,String> result = new LinkedHashMap<>();
        result.put("User-Agent", userAgent);
        result.put("Accept", "*/*");
        if (compression) {
            result.put("Accept-Encoding", ACCEPT_ENCODING);
        }
        result.putAll(headers);
        return result;
    }

    /**
     * The per-request configuration, if any setting differs from what the
     * HTTP client already uses.
     */
    public Optional<RequestConfig> requestConfig()
    {
        if (!ignoreCookies) {
            return Optional.ofNullable(requestConfig);
        }
        RequestConfig.Builder builder = requestConfig == null
                ? RequestConfig.custom()
                : RequestConfig.copy(requestConfig);
        return Optional.of(builder.setCookieSpec(CookieSpecs.IGNORE_COOKIES).build());
    }

    public URI resolve(String url)
    {
        return UrlResolver.resolve(baseUrl, url);
    }
}
