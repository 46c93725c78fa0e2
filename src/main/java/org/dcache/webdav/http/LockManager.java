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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import org.dcache.webdav.DavException;
import org.dcache.webdav.DavMalformedResponseException;
import org.dcache.webdav.Depth;
import org.dcache.webdav.xml.ActiveLock;
import org.dcache.webdav.xml.LockParser;
import org.dcache.webdav.xml.Multistatus;
import org.dcache.webdav.xml.MultistatusParser;
import org.dcache.webdav.xml.XmlRequestEncoder;

import static java.util.Collections.singleton;
import static java.util.Objects.requireNonNull;
import static org.dcache.webdav.xml.XmlHelper.DAV_NAMESPACE;
import static org.dcache.webdav.xml.XmlRequestEncoder.propertyName;

/**
 * Acquires, refreshes and releases write locks.  Tokens are only held by
 * the caller; nothing is remembered here.
 */
public class LockManager
{
    private static final Logger LOGGER = LoggerFactory.getLogger(LockManager.class);

    public static final int DEFAULT_TIMEOUT = 3600;

    private final RequestDispatcher dispatcher;

    public LockManager(RequestDispatcher dispatcher)
    {
        this.dispatcher = requireNonNull(dispatcher);
    }

    /** Take an exclusive write lock and return its token. */
    public String lock(String url, int timeoutSeconds, String owner) throws DavException
    {
        DavRequest request = DavRequest.builder("LOCK", url)
                .timeout(timeoutSeconds)
                .xml(XmlRequestEncoder.lockInfo(true, owner))
                .build();
        DavResponse response = dispatcher.send(request);
        Optional<String> token = tokenFrom(response);
        if (!token.isPresent()) {
            throw new DavMalformedResponseException(response.getMethod(), response.getUrl(),
                    response.getStatusCode(), "no lock token in response", null);
        }
        return token.get();
    }

    /**
     * Extend a lock.  If the reply carries a token, that token replaces the
     * old one; otherwise the given token is still valid and is returned.
     */
    public String refreshLock(String url, String token) throws DavException
    {
        DavRequest request = DavRequest.builder("LOCK", url)
                .ifLockToken(token)
                .timeout(DEFAULT_TIMEOUT)
                .build();
        DavResponse response = dispatcher.send(request);
        try {
            return tokenFrom(response).orElse(token);
        } catch (DavMalformedResponseException e) {
            LOGGER.debug("Ignoring unreadable LOCK refresh reply for {}: {}", url, e.getMessage());
            return token;
        }
    }

    public void unlock(String url, String token) throws DavException
    {
        dispatcher.send(DavRequest.builder("UNLOCK", url).lockToken(token).build());
    }

    public List<ActiveLock> discoverLocks(String url) throws DavException
    {
        DavRequest request = DavRequest.builder("PROPFIND", url)
                .depth(Depth.ZERO)
                .xml(XmlRequestEncoder.propfind(singleton(propertyName("lockdiscovery", DAV_NAMESPACE))))
                .build();
        Multistatus multistatus = dispatcher.send(request).parse(MultistatusParser::parse);
        return multistatus.first()
                .flatMap(r -> r.successfulPropertiesWith("lockdiscovery"))
                .flatMap(p -> p.getElement("lockdiscovery"))
                .map(LockParser::parseActiveLocks)
                .orElseGet(List::of);
    }

    public boolean isLocked(String url) throws DavException
    {
        return !discoverLocks(url).isEmpty();
    }

    public Optional<String> getLockToken(String url) throws DavException
    {
        return discoverLocks(url).stream()
                .flatMap(l -> l.getToken().stream())
                .findFirst();
    }

    private static Optional<String> tokenFrom(DavResponse response) throws DavMalformedResponseException
    {
        if (response.hasBody()) {
            Optional<String> token = response.parse(LockParser::parseLockToken);
            if (token.isPresent()) {
                return token;
            }
        }
        return response.getFirstHeader("Lock-Token")
                .map(LockManager::stripBrackets)
                .filter(t -> !t.isEmpty());
    }

    private static String stripBrackets(String value)
    {
        String token = value.trim();
        if (token.startsWith("<") && token.endsWith(">")) {
            token = token.substring(1, token.length() - 1).trim();
        }
        return token;
    }
}
