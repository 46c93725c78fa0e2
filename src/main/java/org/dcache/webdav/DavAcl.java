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

import com.google.common.collect.ImmutableList;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The access control list of a resource.
 */
public class DavAcl
{
    private final List<DavAce> aces;
    private final String resourceUrl;

    public DavAcl(List<DavAce> aces, String resourceUrl)
    {
        this.aces = ImmutableList.copyOf(aces);
        this.resourceUrl = resourceUrl;
    }

    public List<DavAce> getAces()
    {
        return aces;
    }

    public Optional<String> getResourceUrl()
    {
        return Optional.ofNullable(resourceUrl);
    }

    public List<DavAce> getAcesForPrincipal(String principal)
    {
        return aces.stream().filter(a -> a.getPrincipal().equals(principal)).collect(Collectors.toList());
    }

    public List<DavAce> getGrants()
    {
        return aces.stream().filter(DavAce::isGrant).collect(Collectors.toList());
    }

    public List<DavAce> getDenies()
    {
        return aces.stream().filter(DavAce::isDeny).collect(Collectors.toList());
    }

    public List<DavAce> getInherited()
    {
        return aces.stream().filter(DavAce::isInherited).collect(Collectors.toList());
    }

    public List<DavAce> getProtected()
    {
        return aces.stream().filter(DavAce::isProtected).collect(Collectors.toList());
    }

    /**
     * Whether the principal is granted the privilege.  A matching deny
     * entry takes precedence over any grant.
     */
    public boolean isGranted(String principal, String privilege)
    {
        List<DavAce> relevant = getAcesForPrincipal(principal);
        if (relevant.stream().anyMatch(a -> a.isDeny() && a.covers(privilege))) {
            return false;
        }
        return relevant.stream().anyMatch(a -> a.isGrant() && a.covers(privilege));
    }

    public Set<String> getPrincipals()
    {
        return aces.stream().map(DavAce::getPrincipal).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> getPrivileges()
    {
        return aces.stream().flatMap(a -> a.getPrivileges().stream())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean isEmpty()
    {
        return aces.isEmpty();
    }

    @Override
    public String toString()
    {
        return "ACL " + (resourceUrl == null ? "" : resourceUrl + " ") + aces;
    }
}
