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

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class DavResourceTest
{
    @Test
    public void shouldRecogniseCollectionByResourceType()
    {
        DavResource resource = DavResource.builder(URI.create("/data/dir/"))
                .resourceTypes(List.of("collection"))
                .build();

        assertThat(resource.isDirectory()).isTrue();
        assertThat(resource.isFile()).isFalse();
        assertThat(resource.getName()).isEqualTo("dir");
    }

    @Test
    public void shouldRecogniseCollectionByContentType()
    {
        DavResource resource = DavResource.builder(URI.create("/data/dir"))
                .contentType(DavResource.HTTPD_UNIX_DIRECTORY_CONTENT_TYPE)
                .build();

        assertThat(resource.isDirectory()).isTrue();
    }

    @Test
    public void shouldApplyDefaults()
    {
        DavResource resource = DavResource.builder(URI.create("http://example.org/a%20b.txt")).build();

        assertThat(resource.isFile()).isTrue();
        assertThat(resource.getContentType()).isEqualTo(DavResource.DEFAULT_CONTENT_TYPE);
        assertThat(resource.getContentLength()).isEqualTo(DavResource.DEFAULT_CONTENT_LENGTH);
        assertThat(resource.getStatusCode()).isEqualTo(DavResource.DEFAULT_STATUS_CODE);
        assertThat(resource.getModified()).isEmpty();
        assertThat(resource.getName()).isEqualTo("a b.txt");
        assertThat(resource.getPath()).isEqualTo("/a b.txt");
    }

    @Test
    public void shouldCompareByHref()
    {
        DavResource a = DavResource.builder(URI.create("/x")).displayName("one").build();
        DavResource b = DavResource.builder(URI.create("/x")).displayName("two").build();
        DavResource c = DavResource.builder(URI.create("/y")).build();

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(c);
    }
}
