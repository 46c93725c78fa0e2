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

import java.util.Optional;

/**
 * A lock reported in a lockdiscovery property.
 */
public class ActiveLock
{
    public enum Scope
    {
        EXCLUSIVE, SHARED
    }

    private final Scope scope;
    private final String type;
    private final String depth;
    private final String owner;
    private final String timeout;
    private final String token;
    private final String root;

    public ActiveLock(Scope scope, String type, String depth, String owner, String timeout,
            String token, String root)
    {
        this.scope = scope;
        this.type = type;
        this.depth = depth;
        this.owner = owner;
        this.timeout = timeout;
        this.token = token;
        this.root = root;
    }

    public Scope getScope()
    {
        return scope;
    }

    public String getType()
    {
        return type;
    }

    public String getDepth()
    {
        return depth;
    }

    public Optional<String> getOwner()
    {
        return Optional.ofNullable(owner);
    }

    public Optional<String> getTimeout()
    {
        return Optional.ofNullable(timeout);
    }

    public Optional<String> getToken()
    {
        return Optional.ofNullable(token);
    }

    public Optional<String> getLockRoot()
    {
        return Optional.ofNullable(root);
    }

    @Override
    public String toString()
    {
        return scope + " " + type + " lock " + token + (owner == null ? "" : " owned by " + owner);
    }
}
