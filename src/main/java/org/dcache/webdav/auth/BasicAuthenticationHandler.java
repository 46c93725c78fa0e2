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
package org.dcache.webdav.auth;

import com.google.common.io.BaseEncoding;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * HTTP Basic authentication.  If a domain is given, the user name is
 * prefixed with the domain and a backslash, for servers that expect
 * Windows-style account names.
 */
public class BasicAuthenticationHandler implements AuthenticationHandler
{
    private final String username;
    private final String password;
    private final String domain;

    public BasicAuthenticationHandler(String username, String password)
    {
        this(username, password, null);
    }

    public BasicAuthenticationHandler(String username, String password, String domain)
    {
        checkArgument(!requireNonNull(username).isEmpty(), "Empty username");
        this.username = username;
        this.password = requireNonNull(password);
        this.domain = domain == null || domain.isEmpty() ? null : domain;
    }

    public String getUsername()
    {
        return username;
    }

    public Optional<String> getDomain()
    {
        return Optional.ofNullable(domain);
    }

    public String authorization()
    {
        String user = domain == null ? username : domain + "\\" + username;
        String credentials = user + ":" + password;
        return "Basic " + BaseEncoding.base64().encode(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String getSchemeName()
    {
        return "Basic";
    }

    @Override
    public boolean canHandle(String challenge)
    {
        return challenge.toLowerCase(Locale.ROOT).contains("basic");
    }

    @Override
    public Optional<String> getPreemptiveAuthorization(URI url)
    {
        return Optional.of(authorization());
    }

    @Override
    public CompletableFuture<Optional<String>> handleChallenge(AuthChallenge challenge)
    {
        return CompletableFuture.completedFuture(Optional.of(authorization()));
    }

    @Override
    public String toString()
    {
        return "Basic " + (domain == null ? "" : domain + "\\") + username;
    }
}
