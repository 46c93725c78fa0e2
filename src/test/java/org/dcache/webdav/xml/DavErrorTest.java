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

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class DavErrorTest
{
    @Test
    public void shouldListConditions()
    {
        byte[] body = ("<D:error xmlns:D='DAV:'><D:lock-token-submitted><D:href>/locked/</D:href>"
                + "</D:lock-token-submitted><D:no-conflicting-lock/>"
                + "<D:responsedescription>resource is locked</D:responsedescription></D:error>")
                .getBytes(StandardCharsets.UTF_8);

        Optional<DavError> error = DavError.parse(body);

        assertThat(error).isPresent();
        assertThat(error.get().getConditions()).containsExactly("lock-token-submitted", "no-conflicting-lock");
        assertThat(error.get().getDescription()).contains("resource is locked");
    }

    @Test
    public void shouldIgnoreNonXmlBody()
    {
        assertThat(DavError.parse("<html><body>Oops</body>".getBytes(StandardCharsets.UTF_8))).isEmpty();
        assertThat(DavError.parse("Internal error".getBytes(StandardCharsets.UTF_8))).isEmpty();
        assertThat(DavError.parse(new byte[0])).isEmpty();
    }
}
