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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class DepthTest
{
    @Test
    public void shouldFormatKnownDepths()
    {
        assertThat(Depth.depthToString(Depth.ZERO)).isEqualTo("0");
        assertThat(Depth.depthToString(Depth.ONE)).isEqualTo("1");
        assertThat(Depth.depthToString(Depth.INFINITY)).isEqualTo("infinity");
    }

    @Test
    public void shouldFormatOtherDepthsAsOne()
    {
        assertThat(Depth.depthToString(2)).isEqualTo("1");
        assertThat(Depth.depthToString(-7)).isEqualTo("1");
    }

    @Test
    public void shouldParseTokens()
    {
        assertThat(Depth.parseDepth("0")).isEqualTo(Depth.ZERO);
        assertThat(Depth.parseDepth("1")).isEqualTo(Depth.ONE);
        assertThat(Depth.parseDepth(" Infinity ")).isEqualTo(Depth.INFINITY);
        assertThat(Depth.parseDepth("2")).isEqualTo(Depth.ONE);
        assertThat(Depth.parseDepth(null)).isEqualTo(Depth.ONE);
    }
}
