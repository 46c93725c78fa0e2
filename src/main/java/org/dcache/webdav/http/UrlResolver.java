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

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Turns the URLs given to the client into absolute URIs.  A URL with a
 * scheme is used as given; anything else is a path joined to the base URL
 * with exactly one slash between them.
 */
public final class UrlResolver
{
    private static final Pattern HAS_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://.*");

    private UrlResolver()
    {
    }

    public static boolean isAbsolute(String url)
    {
        return HAS_SCHEME.matcher(url).matches();
    }

    public static URI resolve(URI base, String target)
    {
        if (isAbsolute(target)) {
            return toUri(target);
        }

        checkArgument(base != null, "Relative URL \"%s\" but no base URL", target);

        try {
            // already escaped
            return new URI(base.getScheme() + "://" + base.getRawAuthority()
                    + join(base.getRawPath(), target));
        } catch (URISyntaxException e) {
            try {
                return new URI(base.getScheme(), base.getAuthority(), join(base.getPath(), target),
                        null, null);
            } catch (URISyntaxException retry) {
                throw new IllegalArgumentException("Bad URL: " + retry.getMessage(), retry);
            }
        }
    }

    /** Join two path fragments with exactly one slash. */
    public static String join(String base, String path)
    {
        if (base == null || base.isEmpty()) {
            return path.startsWith("/") ? path : "/" + path;
        }
        if (path.isEmpty()) {
            return base;
        }

        int end = base.length();
        while (end > 0 && base.charAt(end - 1) == '/') {
            end--;
        }
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') {
            start++;
        }
        return base.substring(0, end) + "/" + path.substring(start);
    }

    /**
     * Parse an absolute URL.  Characters that are not legal in a URI, such
     * as spaces in the path, are quoted.
     */
    public static URI toUri(String url)
    {
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            try {
                URL parsed = new URL(url);
                return new URI(parsed.getProtocol(), parsed.getUserInfo(), parsed.getHost(),
                        parsed.getPort(), parsed.getPath(), parsed.getQuery(), parsed.getRef());
            } catch (MalformedURLException | URISyntaxException retry) {
                throw new IllegalArgumentException("Bad URL \"" + url + "\": " + e.getMessage(), e);
            }
        }
    }
}
