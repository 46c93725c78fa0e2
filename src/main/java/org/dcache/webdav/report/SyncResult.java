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
package org.dcache.webdav.report;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

import org.dcache.webdav.DavResource;

import static java.util.Objects.requireNonNull;

/**
 * The changes reported by a sync-collection report, together with the
 * token to present on the next synchronisation.
 */
public class SyncResult
{
    private final List<DavResource> resources;
    private final String syncToken;

    public SyncResult(List<DavResource> resources, String syncToken)
    {
        this.resources = ImmutableList.copyOf(requireNonNull(resources));
        this.syncToken = syncToken;
    }

    public List<DavResource> getResources()
    {
        return resources;
    }

    public Optional<String> getSyncToken()
    {
        return Optional.ofNullable(syncToken);
    }

    @Override
    public String toString()
    {
        return "SyncResult[" + resources.size() + " changes, token=" + syncToken + "]";
    }
}
