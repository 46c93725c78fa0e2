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

import java.util.Optional;

/**
 * A URL given to the client could not be turned into an absolute URI:
 * it is relative and no base URL is set, or it is not a valid URL.  No
 * request was sent.
 */
public class DavInvalidUrlException extends DavException
{
    private static final long serialVersionUID = 1L;

    private final String rawUrl;

    public DavInvalidUrlException(String method, String rawUrl, IllegalArgumentException cause)
    {
        super(method == null
                ? cause.getMessage()
                : method + " " + rawUrl + " failed: " + cause.getMessage(),
                method, null, NO_STATUS, null, null, cause);
        this.rawUrl = rawUrl;
    }

    /** The URL as the caller supplied it. */
    public Optional<String> getRawUrl()
    {
        return Optional.ofNullable(rawUrl);
    }
}
