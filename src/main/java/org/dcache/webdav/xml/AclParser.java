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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.dcache.webdav.DavAce;

import static org.dcache.webdav.xml.XmlHelper.descendants;
import static org.dcache.webdav.xml.XmlHelper.firstChild;
import static org.dcache.webdav.xml.XmlHelper.firstDescendant;
import static org.dcache.webdav.xml.XmlHelper.hasDescendant;
import static org.dcache.webdav.xml.XmlHelper.textOfFirstDescendant;

/**
 * Parser for the RFC 3744 acl and current-user-privilege-set properties.
 */
public final class AclParser
{
    private AclParser()
    {
    }

    /** The entries of an acl property element. */
    public static List<DavAce> parseAces(Element acl)
    {
        List<DavAce> aces = new ArrayList<>();
        for (Element ace : descendants(acl, "ace")) {
            String principal = firstDescendant(ace, "principal")
                    .map(AclParser::principalOf)
                    .orElse("unknown");

            Optional<Element> grant = firstDescendant(ace, "grant");
            Optional<Element> deny = firstDescendant(ace, "deny");
            boolean isGrant = grant.isPresent() && !deny.isPresent();
            Set<String> privileges = grant.or(() -> deny)
                    .map(AclParser::privilegeNames)
                    .orElseGet(LinkedHashSet::new);

            aces.add(new DavAce(principal, isGrant, privileges,
                    hasDescendant(ace, "inherited"), hasDescendant(ace, "protected")));
        }
        return aces;
    }

    private static String principalOf(Element principal)
    {
        Optional<String> href = textOfFirstDescendant(principal, "href");
        if (href.isPresent()) {
            return href.get();
        }
        if (firstChild(principal, "all").isPresent()) {
            return DavAce.ALL;
        }
        if (firstChild(principal, "authenticated").isPresent()) {
            return DavAce.AUTHENTICATED;
        }
        if (firstChild(principal, "unauthenticated").isPresent()) {
            return DavAce.UNAUTHENTICATED;
        }
        if (firstChild(principal, "self").isPresent()) {
            return DavAce.SELF;
        }
        return "unknown";
    }

    /**
     * The names of the privileges listed below an element, taken from the
     * first child of each privilege element.
     */
    public static Set<String> privilegeNames(Element container)
    {
        Set<String> names = new LinkedHashSet<>();
        for (Element privilege : descendants(container, "privilege")) {
            XmlHelper.firstChild(privilege).map(XmlHelper::localName).ifPresent(names::add);
        }
        return names;
    }
}
