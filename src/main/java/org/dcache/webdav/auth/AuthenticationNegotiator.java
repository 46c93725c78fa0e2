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

import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Holds the client's authentication state and decides which headers
 * authenticate a request.  Either a username and password (optionally
 * with a domain and workstation) or a pluggable handler is active, never
 * both; installing one discards the other.  Preemptive authentication is
 * controlled separately.
 * <p>
 * The state may be read concurrently with dispatching requests.  Changing
 * it while requests are in flight has no defined ordering with respect to
 * those requests; callers should serialise such changes themselves.
 */
public class AuthenticationNegotiator
{
    private static final Logger LOGGER = LoggerFactory.getLogger(AuthenticationNegotiator.class);

    public static final String AUTHORIZATION = "Authorization";
    public static final String WORKSTATION = "X-Workstation";

    /** The active credentials; at most one of basic and handler is set. */
    private static class Mode
    {
        private static final Mode NONE = new Mode(null, null, null);

        private final BasicAuthenticationHandler basic;
        private final String workstation;
        private final AuthenticationHandler handler;

        Mode(BasicAuthenticationHandler basic, String workstation, AuthenticationHandler handler)
        {
            this.basic = basic;
            this.workstation = workstation == null || workstation.isEmpty() ? null : workstation;
            this.handler = handler;
        }
    }

    /** Where credentials are sent without waiting for a challenge. */
    private static class Preemption
    {
        private static final Preemption DISABLED = new Preemption(false, null, ImmutableSet.of());
        private static final Preemption EVERYWHERE = new Preemption(true, null, ImmutableSet.of());

        private final boolean enabled;
        private final String host;
        private final Set<Integer> ports;

        Preemption(boolean enabled, String host, Set<Integer> ports)
        {
            this.enabled = enabled;
            this.host = host;
            this.ports = ports;
        }

        boolean appliesTo(URI url)
        {
            if (!enabled) {
                return false;
            }
            if (host != null && !host.equalsIgnoreCase(url.getHost())) {
                return false;
            }
            return ports.isEmpty() || ports.contains(effectivePort(url));
        }

        private static int effectivePort(URI url)
        {
            if (url.getPort() != -1) {
                return url.getPort();
            }
            return "https".equalsIgnoreCase(url.getScheme()) ? 443 : 80;
        }
    }

    private volatile Mode mode = Mode.NONE;
    private volatile Preemption preemption = Preemption.DISABLED;

    public void setCredentials(String username, String password)
    {
        setCredentials(username, password, null, null);
    }

    public void setCredentials(String username, String password, String domain,
            String workstation)
    {
        mode = new Mode(new BasicAuthenticationHandler(username, password, domain), workstation, null);
    }

    public void setHandler(AuthenticationHandler handler)
    {
        mode = new Mode(null, null, requireNonNull(handler));
    }

    public void clear()
    {
        mode = Mode.NONE;
    }

    public void enablePreemptive()
    {
        preemption = Preemption.EVERYWHERE;
    }

    public void enablePreemptive(String host)
    {
        preemption = new Preemption(true, requireNonNull(host), ImmutableSet.of());
    }

    public void enablePreemptive(String host, int httpPort, int httpsPort)
    {
        preemption = new Preemption(true, requireNonNull(host), ImmutableSet.of(httpPort, httpsPort));
    }

    public void disablePreemptive()
    {
        preemption = Preemption.DISABLED;
    }

    public boolean isPreemptive()
    {
        return preemption.enabled;
    }

    public boolean hasCredentials()
    {
        Mode current = mode;
        return current.basic != null || current.handler != null;
    }

    public Optional<String> getUsername()
    {
        return Optional.ofNullable(mode.basic).map(BasicAuthenticationHandler::getUsername);
    }

    public Optional<String> getWorkstation()
    {
        return Optional.ofNullable(mode.workstation);
    }

    public Optional<AuthenticationHandler> getHandler()
    {
        return Optional.ofNullable(mode.handler);
    }

    /**
     * The authentication headers for a request to the given URL before any
     * challenge has been seen.
     */
    public Map<String,String> headersForRequest(URI url)
    {
        Mode current = mode;
        Map<String,String> headers = new LinkedHashMap<>();

        if (preemption.appliesTo(url)) {
            preemptiveAuthorization(current, url).ifPresent(v -> headers.put(AUTHORIZATION, v));
        }

        if (current.workstation != null) {
            headers.put(WORKSTATION, current.workstation);
        }

        return headers;
    }

    private static Optional<String> preemptiveAuthorization(Mode current, URI url)
    {
        if (current.handler != null) {
            try {
                return current.handler.getPreemptiveAuthorization(url);
            } catch (RuntimeException e) {
                LOGGER.warn("{} handler failed to authorize {}: {}",
                        current.handler.getSchemeName(), url, e.toString());
            }
        }
        if (current.basic != null) {
            return Optional.of(current.basic.authorization());
        }
        return Optional.empty();
    }

    /**
     * Compute the Authorization value for retrying a request that was
     * rejected with a 401.  The installed handler is asked first; if it
     * fails or has no answer, Basic credentials are used when present.
     * Empty means there is nothing to retry with.
     */
    public Optional<String> respondToChallenge(AuthChallenge challenge)
    {
        Mode current = mode;

        if (current.handler != null && accepts(current.handler, challenge)) {
            try {
                Optional<String> answer = current.handler.handleChallenge(challenge).join();
                if (answer.isPresent()) {
                    return answer;
                }
                LOGGER.debug("{} handler has no answer for {}",
                        current.handler.getSchemeName(), challenge);
            } catch (RuntimeException e) {
                LOGGER.warn("{} handler failed on challenge for {}: {}",
                        current.handler.getSchemeName(), challenge.getUrl(), e.toString());
            }
        }

        if (current.basic != null) {
            return Optional.of(current.basic.authorization());
        }

        return Optional.empty();
    }

    private static boolean accepts(AuthenticationHandler handler, AuthChallenge challenge)
    {
        return challenge.getChallenges().isEmpty()
                || challenge.getChallenges().stream().anyMatch(handler::canHandle);
    }
}
