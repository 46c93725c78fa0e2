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

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A principal found through principal discovery.
 */
public class DavPrincipal
{
    public enum Type
    {
        USER, GROUP, PROPERTY, SPECIAL
    }

    private final String url;
    private final String displayName;
    private final Type type;
    private final Map<String,String> properties;

    public DavPrincipal(String url, String displayName, Type type, Map<String,String> properties)
    {
        this.url = requireNonNull(url);
        this.displayName = displayName;
        this.type = requireNonNull(type);
        this.properties = ImmutableMap.copyOf(properties);
    }

    public String getUrl()
    {
        return url;
    }

    public Optional<String> getDisplayName()
    {
        return Optional.ofNullable(displayName);
    }

    public Type getType()
    {
        return type;
    }

    public Map<String,String> getProperties()
    {
        return properties;
    }

    /** The display name or, failing that, the last segment of the URL. */
    public String getName()
    {
        if (displayName != null && !displayName.isEmpty()) {
            return displayName;
        }
        String trimmed = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    @Override
    public String toString()
    {
        return type + " " + url + (displayName == null ? "" : " (" + displayName + ")");
    }
}
