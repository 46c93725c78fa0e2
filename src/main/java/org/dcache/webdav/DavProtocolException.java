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

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * The server replied with a status code that does not indicate success.
 */
public class DavProtocolException extends DavException
{
    private static final long serialVersionUID = 1L;

    private final String description;

    public DavProtocolException(String method, URI url, int statusCode,
            String reasonPhrase, String body, List<String> conditions,
            String description)
    {
        super(describe(method, url, statusCode + " " + reasonPhrase
                + (conditions == null || conditions.isEmpty() ? "" : " " + conditions)),
                method, url, statusCode, body, conditions, null);
        this.description = description;
    }

    public boolean isClientError()
    {
        return getStatusCode() >= 400 && getStatusCode() < 500;
    }

    public boolean isServerError()
    {
        return getStatusCode() >= 500 && getStatusCode() < 600;
    }

    public boolean isNotFound()
    {
        return getStatusCode() == 404;
    }

    public Optional<String> getFirstCondition()
    {
        return getConditions().stream().findFirst();
    }

    /** The human-readable text of the DAV:error body, if any. */
    public Optional<String> getErrorDescription()
    {
        return Optional.ofNullable(description);
    }
}
