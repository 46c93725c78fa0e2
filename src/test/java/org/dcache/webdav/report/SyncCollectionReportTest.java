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

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.dcache.webdav.Depth;
import org.dcache.webdav.xml.MultistatusParser;

import static org.assertj.core.api.Assertions.assertThat;

public class SyncCollectionReportTest
{
    private static byte[] bytes(String xml)
    {
        return xml.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void shouldAskForInitialSyncWithoutToken()
    {
        String xml = new SyncCollectionReport(null).toXml();

        assertThat(xml).contains("<D:sync-token></D:sync-token>")
                .contains("<D:sync-level>1</D:sync-level>")
                .doesNotContain("<D:limit>");
    }

    @Test
    public void shouldIncludeLimitAndLevel()
    {
        SyncCollectionReport report = new SyncCollectionReport("tok-1", Depth.INFINITY,
                List.of("displayname"), 10);

        assertThat(report.toXml()).contains("<D:sync-level>infinity</D:sync-level>")
                .contains("<D:limit><D:nresults>10</D:nresults></D:limit>")
                .contains("<D:displayname/>");
        assertThat(report.getDepth()).hasValue(Depth.ZERO);
        assertThat(report.getHeaders()).isEmpty();
    }

    @Test
    public void shouldReturnRemovedMembersAndNewToken() throws Exception
    {
        SyncResult result = new SyncCollectionReport("tok-1").fromMultistatus(MultistatusParser.parse(bytes(
                "<d:multistatus xmlns:d='DAV:'>"
                + "<d:response><d:href>/col/gone.txt</d:href><d:status>HTTP/1.1 404 Not Found</d:status></d:response>"
                + "<d:sync-token>tok-2</d:sync-token></d:multistatus>")));

        assertThat(result.getResources()).hasSize(1);
        assertThat(result.getResources().get(0).getStatusCode()).isEqualTo(404);
        assertThat(result.getSyncToken()).contains("tok-2");
    }

    @Test
    public void shouldHaveNoTokenWhenServerOmitsIt() throws Exception
    {
        SyncResult result = new SyncCollectionReport("tok-1").fromMultistatus(MultistatusParser.parse(bytes(
                "<d:multistatus xmlns:d='DAV:'/>")));

        assertThat(result.getResources()).isEmpty();
        assertThat(result.getSyncToken()).isEmpty();
    }

    @Test
    public void shouldRequestDefaultVersionProperties()
    {
        String xml = new VersionTreeReport().toXml();

        assertThat(xml).contains("<D:version-name/>").contains("<D:successor-set/>");
        assertThat(new VersionTreeReport().getDepth()).isEmpty();
    }
}
