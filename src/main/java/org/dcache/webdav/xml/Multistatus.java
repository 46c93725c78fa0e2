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

/**
 * A parsed 207 Multi-Status body.
 */
public class Multistatus
{
    private final List<MultistatusResponse> responses;
    private final String syncToken;
    private final String description;

    public Multistatus(List<MultistatusResponse> responses, String syncToken, String description)
    {
        this.responses = ImmutableList.copyOf(responses);
        this.syncToken = syncToken;
        this.description = description;
    }

    public List<MultistatusResponse> getResponses()
    {
        return responses;
    }

    /** The new sync token of a sync-collection report. */
    public Optional<String> getSyncToken()
    {
        return Optional.ofNullable(syncToken);
    }

    public Optional<String> getDescription()
    {
        return Optional.ofNullable(description);
    }

    public Optional<MultistatusResponse> first()
    {
        return responses.stream().findFirst();
    }
}
