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
 * Base for NTLM support.  The message exchange is left to subclasses; this
 * class only drives the two-step challenge and response.
 * <p>
 * A request is answered at most once after a 401, so the handshake only
 * completes when preemptive authentication is enabled: the type 1 message
 * goes out with the request and the single retry carries the type 3
 * message.  Without preemption the retry can only send type 1, and the
 * type 2 challenge that follows fails the request.
 */
public abstract class NtlmAuthenticationHandler implements AuthenticationHandler
{
    protected final String username;
    protected final String password;
    protected final String domain;
    protected final String workstation;

    protected NtlmAuthenticationHandler(String username, String password, String domain,
            String workstation)
    {
        this.username = username;
        this.password = password;
        this.domain = domain;
        this.workstation = workstation;
    }

    /** The base64-encoded type 1 (negotiate) message. */
    protected abstract String createType1Message();

    /** The base64-encoded type 3 (authenticate) message for a type 2 challenge. */
    protected abstract String createType3Message(String type2Challenge);

    @Override
    public String getSchemeName()
    {
        return "NTLM";
    }

    @Override
    public boolean canHandle(String challenge)
    {
        return challenge.toLowerCase(Locale.ROOT).contains("ntlm");
    }

    @Override
    public Optional<String> getPreemptiveAuthorization(URI url)
    {
        return Optional.of("NTLM " + createType1Message());
    }

    @Override
    public CompletableFuture<Optional<String>> handleChallenge(AuthChallenge challenge)
    {
        for (String value : challenge.getChallenges()) {
            String trimmed = value.trim();
            if (trimmed.equalsIgnoreCase("ntlm")) {
                return CompletableFuture.completedFuture(Optional.of("NTLM " + createType1Message()));
            }
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("ntlm ")) {
                String type2 = trimmed.substring(5).trim();
                return CompletableFuture.completedFuture(Optional.of("NTLM " + createType3Message(type2)));
            }
        }
        return CompletableFuture.completedFuture(Optional.empty());
    }
}
