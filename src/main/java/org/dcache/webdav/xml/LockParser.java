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
package org.dcache.webdav.xml;

import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.dcache.webdav.DavMalformedResponseException;

import static org.dcache.webdav.xml.XmlHelper.firstChild;
import static org.dcache.webdav.xml.XmlHelper.firstDescendant;
import static org.dcache.webdav.xml.XmlHelper.hasDescendant;
import static org.dcache.webdav.xml.XmlHelper.textOfFirstDescendant;

/**
 * Extracts lock information from LOCK response bodies and lockdiscovery
 * properties.
 */
public final class LockParser
{
    private LockParser()
    {
    }

    /**
     * The token of the first active lock in a LOCK response body, taken
     * from activelock/locktoken/href.
     */
    public static Optional<String> parseLockToken(byte[] body) throws DavMalformedResponseException
    {
        Element root = XmlHelper.parse(body).getDocumentElement();
        return parseActiveLocks(root).stream()
                .flatMap(l -> l.getToken().stream())
                .findFirst();
    }

    /** All active locks below the given element. */
    public static List<ActiveLock> parseActiveLocks(Element ancestor)
    {
        List<ActiveLock> locks = new ArrayList<>();
        for (Element activelock : XmlHelper.descendants(ancestor, "activelock")) {
            ActiveLock.Scope scope = firstDescendant(activelock, "lockscope")
                    .filter(s -> hasDescendant(s, "shared"))
                    .map(s -> ActiveLock.Scope.SHARED)
                    .orElse(ActiveLock.Scope.EXCLUSIVE);
            String type = firstDescendant(activelock, "locktype")
                    .flatMap(XmlHelper::firstChild)
                    .map(XmlHelper::localName)
                    .orElse("write");
            String token = firstChild(activelock, "locktoken")
                    .flatMap(t -> textOfFirstDescendant(t, "href"))
                    .orElse(null);
            String root = firstChild(activelock, "lockroot")
                    .flatMap(r -> textOfFirstDescendant(r, "href"))
                    .orElse(null);
            locks.add(new ActiveLock(scope, type,
                    firstChild(activelock, "depth").map(XmlHelper::text).orElse("0"),
                    firstChild(activelock, "owner").map(XmlHelper::text).filter(s -> !s.isEmpty()).orElse(null),
                    firstChild(activelock, "timeout").map(XmlHelper::text).orElse(null),
                    token, root));
        }
        return locks;
    }
}
