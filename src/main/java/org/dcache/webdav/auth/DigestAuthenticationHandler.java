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

import java.net.URI;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Base for Digest support.  Subclasses compute the response for a
 * challenge; Digest cannot be sent preemptively.
 */
public abstract class DigestAuthenticationHandler implements AuthenticationHandler
{
    protected final String username;
    protected final String password;

    protected DigestAuthenticationHandler(String username, String password)
    {
        this.username = username;
        this.password = password;
    }

    /** The complete Authorization value answering a Digest challenge. */
    protected abstract String createDigestResponse(String challenge, AuthChallenge request);

    @Override
    public String getSchemeName()
    {
        return "Digest";
    }

    @Override
    public boolean canHandle(String challenge)
    {
        return challenge.toLowerCase(Locale.ROOT).contains("digest");
    }

    @Override
    public Optional<String> getPreemptiveAuthorization(URI url)
    {
        return Optional.empty();
    }

    @Override
    public CompletableFuture<Optional<String>> handleChallenge(AuthChallenge challenge)
    {
        Optional<String> response = challenge.getChallenges().stream()
                .filter(this::canHandle)
                .findFirst()
                .map(c -> createDigestResponse(c, challenge));
        return CompletableFuture.completedFuture(response);
    }
}
