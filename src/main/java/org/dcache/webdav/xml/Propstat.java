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

/**
 * A group of properties that share one status within a multistatus
 * response.
 */
public class Propstat
{
    private final int status;
    private final String statusLine;
    private final PropertySet properties;

    public Propstat(int status, String statusLine, PropertySet properties)
    {
        this.status = status;
        this.statusLine = statusLine;
        this.properties = properties;
    }

    public int getStatus()
    {
        return status;
    }

    public String getStatusLine()
    {
        return statusLine;
    }

    public PropertySet getProperties()
    {
        return properties;
    }

    public boolean isSuccessful()
    {
        return status >= 200 && status < 300;
    }

    @Override
    public String toString()
    {
        return statusLine + " " + properties;
    }
}
