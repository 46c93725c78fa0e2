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

import com.google.common.collect.ImmutableSet;

import java.util.Objects;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * One access control entry: a principal is granted or denied a set of
 * privileges.  The principal is either an href or one of the DAV: pseudo
 * principals.
 */
public class DavAce
{
    public static final String ALL = "DAV:all";
    public static final String AUTHENTICATED = "DAV:authenticated";
    public static final String UNAUTHENTICATED = "DAV:unauthenticated";
    public static final String SELF = "DAV:self";

    private final String principal;
    private final boolean grant;
    private final Set<String> privileges;
    private final boolean inherited;
    private final boolean isProtected;

    public DavAce(String principal, boolean grant, Set<String> privileges)
    {
        this(principal, grant, privileges, false, false);
    }

    public DavAce(String principal, boolean grant, Set<String> privileges,
            boolean inherited, boolean isProtected)
    {
        this.principal = requireNonNull(principal);
        this.grant = grant;
        this.privileges = ImmutableSet.copyOf(privileges);
        this.inherited = inherited;
        this.isProtected = isProtected;
    }

    public String getPrincipal()
    {
        return principal;
    }

    public boolean isGrant()
    {
        return grant;
    }

    public boolean isDeny()
    {
        return !grant;
    }

    public Set<String> getPrivileges()
    {
        return privileges;
    }

    public boolean isInherited()
    {
        return inherited;
    }

    public boolean isProtected()
    {
        return isProtected;
    }

    /** Whether this entry covers the privilege, directly or through "all". */
    public boolean covers(String privilege)
    {
        return privileges.contains(privilege) || privileges.contains("all");
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof DavAce)) {
            return false;
        }
        DavAce that = (DavAce) other;
        return principal.equals(that.principal) && grant == that.grant
                && privileges.equals(that.privileges) && inherited == that.inherited
                && isProtected == that.isProtected;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(principal, grant, privileges, inherited, isProtected);
    }

    @Override
    public String toString()
    {
        return (grant ? "grant " : "deny ") + privileges + " to " + principal
                + (inherited ? " (inherited)" : "") + (isProtected ? " (protected)" : "");
    }
}
