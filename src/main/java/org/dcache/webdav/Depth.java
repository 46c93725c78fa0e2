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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Conversion between the integer depth used by the client API and the
 * three tokens allowed in a Depth request header.
 */
public final class Depth
{
    private static final Logger LOGGER = LoggerFactory.getLogger(Depth.class);

    public static final int ZERO = 0;
    public static final int ONE = 1;
    public static final int INFINITY = -1;

    private Depth()
    {
    }

    /**
     * Convert a depth to its header token.  Values other than 0, 1 and -1
     * are sent as "1".
     */
    public static String depthToString(int depth)
    {
        switch (depth) {
        case ZERO:
            return "0";
        case ONE:
            return "1";
        case INFINITY:
            return "infinity";
        default:
            LOGGER.debug("Unsupported depth {}, using 1", depth);
            return "1";
        }
    }

    /**
     * Convert a Depth header token to an integer depth.  Unknown tokens
     * parse as 1.
     */
    public static int parseDepth(String value)
    {
        if (value == null) {
            return ONE;
        }

        switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "0":
            return ZERO;
        case "infinity":
            return INFINITY;
        default:
            return ONE;
        }
    }
}
