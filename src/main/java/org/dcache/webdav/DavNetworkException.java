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

import java.io.IOException;
import java.net.URI;

/**
 * The client was unable to talk to the server: name resolution failed, the
 * connection was refused or reset, a timeout expired, or the transfer broke
 * off part-way.  The request may be retried by the caller.
 */
public class DavNetworkException extends DavException
{
    private static final long serialVersionUID = 1L;

    public DavNetworkException(String method, URI url, IOException cause)
    {
        super(describe(method, url, String.valueOf(cause.getMessage())), method, url,
                NO_STATUS, null, null, cause);
    }
}
