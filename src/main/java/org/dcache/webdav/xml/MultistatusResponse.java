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

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * The outcome for one href in a multistatus body.  A response either
 * carries a status for the resource as a whole or one or more propstat
 * blocks, never both.
 */
public class MultistatusResponse
{
    private final String href;
    private final Integer status;
    private final String statusLine;
    private final List<Propstat> propstats;
    private final String description;

    private MultistatusResponse(String href, Integer status, String statusLine,
            List<Propstat> propstats, String description)
    {
        this.href = requireNonNull(href);
        this.status = status;
        this.statusLine = statusLine;
        this.propstats = ImmutableList.copyOf(propstats);
        this.description = description;
    }

    public static MultistatusResponse withStatus(String href, int status, String statusLine,
            String description)
    {
        return new MultistatusResponse(href, status, statusLine, ImmutableList.of(), description);
    }

    public static MultistatusResponse withPropstats(String href, List<Propstat> propstats,
            String description)
    {
        checkArgument(!propstats.isEmpty(), "A response needs at least one propstat");
        return new MultistatusResponse(href, null, null, propstats, description);
    }

    public String getHref()
    {
        return href;
    }

    /** The resource-wide status, present only when there are no propstats. */
    public OptionalInt getStatus()
    {
        return status == null ? OptionalInt.empty() : OptionalInt.of(status);
    }

    public Optional<String> getStatusLine()
    {
        return Optional.ofNullable(statusLine);
    }

    public List<Propstat> getPropstats()
    {
        return propstats;
    }

    public Optional<String> getDescription()
    {
        return Optional.ofNullable(description);
    }

    /** The first property with the given name in a successful propstat. */
    public Optional<PropertySet> successfulPropertiesWith(String name)
    {
        return propstats.stream()
                .filter(Propstat::isSuccessful)
                .map(Propstat::getProperties)
                .filter(p -> p.contains(name))
                .findFirst();
    }

    @Override
    public String toString()
    {
        return href + (status == null ? " " + propstats : " " + statusLine);
    }
}
