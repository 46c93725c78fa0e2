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

import com.google.common.collect.ImmutableList;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A 401 response as seen by an authentication handler: the request that
 * was rejected and the WWW-Authenticate values the server sent.
 */
public class AuthChallenge
{
    private final String method;
    private final URI url;
    private final List<String> challenges;
    private final String rejectedAuthorization;

    public AuthChallenge(String method, URI url, List<String> challenges,
            String rejectedAuthorization)
    {
        this.method = requireNonNull(method);
        this.url = requireNonNull(url);
        this.challenges = ImmutableList.copyOf(challenges);
        this.rejectedAuthorization = rejectedAuthorization;
    }

    public String getMethod()
    {
        return method;
    }

    public URI getUrl()
    {
        return url;
    }

    /** The raw WWW-Authenticate header values, e.g. "Basic realm=dCache". */
    public List<String> getChallenges()
    {
        return challenges;
    }

    /** The Authorization value sent with the rejected request, or null. */
    public String getRejectedAuthorization()
    {
        return rejectedAuthorization;
    }

    /** The scheme tokens offered by the server, in lower case. */
    public List<String> getSchemes()
    {
        return challenges.stream()
                .map(String::trim)
                .filter(c -> !c.isEmpty())
                .map(c -> c.split("\\s+", 2)[0].toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    @Override
    public String toString()
    {
        return method + " " + url + " " + challenges;
    }
}
