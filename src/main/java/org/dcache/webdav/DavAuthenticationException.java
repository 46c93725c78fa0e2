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

/**
 * The server demanded authentication and the client could not satisfy it
 * within a single retry.
 */
public class DavAuthenticationException extends DavException
{
    private static final long serialVersionUID = 1L;

    public DavAuthenticationException(String method, URI url, String reason)
    {
        super(describe(method, url, reason), method, url, 401, null, null, null);
    }
}
