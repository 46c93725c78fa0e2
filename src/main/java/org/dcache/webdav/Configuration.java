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
package org.dcache.webdav;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.http.client.config.RequestConfig;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import org.dcache.webdav.http.RequestDefaults;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Data class to hold the client configuration.
 */
public class Configuration
{
    public static class Authentication
    {
        private String username;
        private String password;
        private String domain;
        private String workstation;
        private boolean preemptive;

        public String getUsername()
        {
            return username;
        }

        public void setUsername(String username)
        {
            this.username = username;
        }

        public String getPassword()
        {
            return password;
        }

        public void setPassword(String password)
        {
            this.password = password;
        }

        public String getDomain()
        {
            return domain;
        }

        public void setDomain(String domain)
        {
            this.domain = domain;
        }

        public String getWorkstation()
        {
            return workstation;
        }

        public void setWorkstation(String workstation)
        {
            this.workstation = workstation;
        }

        public boolean isPreemptive()
        {
            return preemptive;
        }

        public void setPreemptive(boolean preemptive)
        {
            this.preemptive = preemptive;
        }

        public void checkValid()
        {
            checkArgument(username != null, "Missing username");
            checkArgument(!username.trim().isEmpty(), "Empty username");
            checkArgument(password != null, "Missing password");
        }
    }

    @JsonProperty("base-url")
    private URI baseUrl;

    @JsonProperty("user-agent")
    private String userAgent = RequestDefaults.DEFAULT_USER_AGENT;

    private boolean compression;

    @JsonProperty("ignore-cookies")
    private boolean ignoreCookies;

    @JsonProperty("connect-timeout")
    private Duration connectTimeout = Duration.ofSeconds(30);

    @JsonProperty("socket-timeout")
    private Duration socketTimeout = Duration.ofMinutes(5);

    @JsonProperty("trust-self-signed")
    private boolean trustSelfSigned;

    @JsonProperty("max-connections")
    private int maxConnections = 20;

    @JsonProperty("default-headers")
    private Map<String,String> defaultHeaders = new HashMap<>();

    private Authentication authentication;

    public URI getBaseUrl()
    {
        return baseUrl;
    }

    public void setBaseUrl(URI url)
    {
        baseUrl = url;
    }

    public String getUserAgent()
    {
        return userAgent;
    }

    public void setUserAgent(String agent)
    {
        userAgent = agent;
    }

    public boolean isCompression()
    {
        return compression;
    }

    public void setCompression(boolean enabled)
    {
        compression = enabled;
    }

    public boolean isIgnoreCookies()
    {
        return ignoreCookies;
    }

    public void setIgnoreCookies(boolean ignore)
    {
        ignoreCookies = ignore;
    }

    public Duration getConnectTimeout()
    {
        return connectTimeout;
    }

    @JsonProperty("connect-timeout")
    public void setConnectTimeout(String timeout)
    {
        connectTimeout = Duration.parse(timeout);
    }

    public Duration getSocketTimeout()
    {
        return socketTimeout;
    }

    @JsonProperty("socket-timeout")
    public void setSocketTimeout(String timeout)
    {
        socketTimeout = Duration.parse(timeout);
    }

    public boolean isTrustSelfSigned()
    {
        return trustSelfSigned;
    }

    public void setTrustSelfSigned(boolean trust)
    {
        trustSelfSigned = trust;
    }

    public int getMaxConnections()
    {
        return maxConnections;
    }

    public void setMaxConnections(int max)
    {
        maxConnections = max;
    }

    public Map<String,String> getDefaultHeaders()
    {
        return defaultHeaders;
    }

    public void setDefaultHeaders(Map<String,String> headers)
    {
        defaultHeaders = headers;
    }

    public Authentication getAuthentication()
    {
        return authentication;
    }

    public void setAuthentication(Authentication authentication)
    {
        this.authentication = authentication;
    }

    public void checkValid()
    {
        if (baseUrl != null) {
            checkArgument(baseUrl.isAbsolute(), "Bad base-url: not absolute");
            checkArgument(!baseUrl.isOpaque(), "Bad base-url: is opaque");
        }
        checkArgument(userAgent != null && !userAgent.trim().isEmpty(), "Empty user-agent");
        checkArgument(!connectTimeout.isNegative(), "Negative connect-timeout");
        checkArgument(!socketTimeout.isNegative(), "Negative socket-timeout");
        checkArgument(maxConnections > 0, "max-connections must be positive");
        if (authentication != null) {
            authentication.checkValid();
        }
    }

    public RequestDefaults toRequestDefaults()
    {
        return RequestDefaults.defaults()
                .withBaseUrl(baseUrl)
                .withUserAgent(userAgent)
                .withCompression(compression)
                .withIgnoreCookies(ignoreCookies)
                .withHeaders(defaultHeaders == null ? Map.of() : defaultHeaders)
                .withRequestConfig(toRequestConfig());
    }

    public RequestConfig toRequestConfig()
    {
        return RequestConfig.custom()
                .setConnectTimeout((int) connectTimeout.toMillis())
                .setSocketTimeout((int) socketTimeout.toMillis())
                .build();
    }
}
