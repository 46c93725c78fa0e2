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

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Quota information for a collection, as given by the
 * quota-available-bytes and quota-used-bytes properties.  A server that
 * does not report the available space is treated as unlimited.
 */
public class DavQuota
{
    public static final long UNLIMITED = Long.MAX_VALUE;

    private final long quotaAvailableBytes;
    private final long quotaUsedBytes;
    private final String resourceUrl;

    public DavQuota(long quotaAvailableBytes, long quotaUsedBytes, String resourceUrl)
    {
        this.quotaAvailableBytes = quotaAvailableBytes;
        this.quotaUsedBytes = quotaUsedBytes;
        this.resourceUrl = resourceUrl;
    }

    public long getQuotaAvailableBytes()
    {
        return quotaAvailableBytes;
    }

    public long getQuotaUsedBytes()
    {
        return quotaUsedBytes;
    }

    public Optional<String> getResourceUrl()
    {
        return Optional.ofNullable(resourceUrl);
    }

    public boolean isLimited()
    {
        return quotaAvailableBytes != UNLIMITED;
    }

    /** Used space as a percentage of used plus available space. */
    public OptionalDouble getUsagePercentage()
    {
        if (!isLimited() || quotaAvailableBytes + quotaUsedBytes <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(100.0 * quotaUsedBytes / (quotaAvailableBytes + quotaUsedBytes));
    }

    @Override
    public String toString()
    {
        return "used " + quotaUsedBytes + ", available "
                + (isLimited() ? String.valueOf(quotaAvailableBytes) : "unlimited");
    }
}
