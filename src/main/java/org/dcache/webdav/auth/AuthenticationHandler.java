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
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Produces Authorization header values for one authentication scheme.
 */
public interface AuthenticationHandler
{
    /** The scheme name, as it appears in the Authorization header. */
    String getSchemeName();

    /**
     * Whether this handler can answer a challenge with the given
     * WWW-Authenticate value or scheme token.
     */
    boolean canHandle(String challenge);

    /**
     * The Authorization value to send before any challenge, or empty if the
     * scheme needs a challenge first.
     */
    Optional<String> getPreemptiveAuthorization(URI url);

    /**
     * Answer a 401 challenge.  The future completes with the Authorization
     * value for the retry, or empty if this handler has no better answer.
     */
    CompletableFuture<Optional<String>> handleChallenge(AuthChallenge challenge);
}
