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

import java.util.Optional;

import org.dcache.webdav.DavAuthenticationException;
import org.dcache.webdav.DavException;
import org.dcache.webdav.DavInvalidUrlException;
import org.dcache.webdav.DavNetworkException;
import org.dcache.webdav.DavProtocolException;

import static java.util.Objects.requireNonNull;

/**
 * The classified result of dispatching a request.
 */
public final class Outcome
{
    public enum Kind
    {
        /** 2xx, or 207 for methods that reply with a multistatus body. */
        SUCCESS,

        /** The server replied with any other status. */
        PROTOCOL_ERROR,

        /** The server could not be reached or the exchange broke off. */
        NETWORK_ERROR,

        /** A 401 that could not be answered within one retry. */
        AUTHENTICATION_ERROR,

        /** The target or destination URL could not be resolved; nothing was sent. */
        INVALID_URL
    }

    private final Kind kind;
    private final DavResponse response;
    private final DavException error;

    private Outcome(Kind kind, DavResponse response, DavException error)
    {
        this.kind = kind;
        this.response = response;
        this.error = error;
    }

    public static Outcome success(DavResponse response)
    {
        return new Outcome(Kind.SUCCESS, requireNonNull(response), null);
    }

    public static Outcome protocolError(DavResponse response, DavProtocolException error)
    {
        return new Outcome(Kind.PROTOCOL_ERROR, requireNonNull(response), requireNonNull(error));
    }

    public static Outcome networkError(DavNetworkException error)
    {
        return new Outcome(Kind.NETWORK_ERROR, null, requireNonNull(error));
    }

    public static Outcome authenticationError(DavAuthenticationException error)
    {
        return new Outcome(Kind.AUTHENTICATION_ERROR, null, requireNonNull(error));
    }

    public static Outcome invalidUrl(DavInvalidUrlException error)
    {
        return new Outcome(Kind.INVALID_URL, null, requireNonNull(error));
    }

    public Kind getKind()
    {
        return kind;
    }

    public boolean isSuccess()
    {
        return kind == Kind.SUCCESS;
    }

    /** The server's reply; absent when the server did not reply. */
    public Optional<DavResponse> getResponse()
    {
        return Optional.ofNullable(response);
    }

    public Optional<DavException> getError()
    {
        return Optional.ofNullable(error);
    }

    public DavResponse getOrThrow() throws DavException
    {
        if (error != null) {
            throw error;
        }
        return response;
    }

    @Override
    public String toString()
    {
        return kind + (error == null ? " " + response : " " + error.getMessage());
    }
}
