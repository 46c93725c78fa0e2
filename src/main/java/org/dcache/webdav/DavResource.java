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

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A resource as described by one response of a multistatus body.
 * Resources are equal if they have the same href.
 */
public class DavResource
{
    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
    public static final long DEFAULT_CONTENT_LENGTH = -1;
    public static final String HTTPD_UNIX_DIRECTORY_CONTENT_TYPE = "httpd/unix-directory";
    public static final int DEFAULT_STATUS_CODE = 200;

    private final URI href;
    private final int statusCode;
    private final Instant creation;
    private final Instant modified;
    private final String contentType;
    private final String etag;
    private final String displayName;
    private final List<String> resourceTypes;
    private final String contentLanguage;
    private final long contentLength;
    private final Map<String,String> customProperties;

    private DavResource(Builder builder)
    {
        href = requireNonNull(builder.href);
        statusCode = builder.statusCode;
        creation = builder.creation;
        modified = builder.modified;
        contentType = builder.contentType == null ? DEFAULT_CONTENT_TYPE : builder.contentType;
        etag = builder.etag;
        displayName = builder.displayName;
        resourceTypes = Collections.unmodifiableList(new ArrayList<>(builder.resourceTypes));
        contentLanguage = builder.contentLanguage;
        contentLength = builder.contentLength;
        customProperties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.customProperties));
    }

    public static Builder builder(URI href)
    {
        return new Builder(href);
    }

    public URI getHref()
    {
        return href;
    }

    public int getStatusCode()
    {
        return statusCode;
    }

    public Optional<Instant> getCreation()
    {
        return Optional.ofNullable(creation);
    }

    public Optional<Instant> getModified()
    {
        return Optional.ofNullable(modified);
    }

    public String getContentType()
    {
        return contentType;
    }

    public Optional<String> getEtag()
    {
        return Optional.ofNullable(etag);
    }

    public Optional<String> getDisplayName()
    {
        return Optional.ofNullable(displayName);
    }

    public List<String> getResourceTypes()
    {
        return resourceTypes;
    }

    public Optional<String> getContentLanguage()
    {
        return Optional.ofNullable(contentLanguage);
    }

    /** The length in bytes, or {@link #DEFAULT_CONTENT_LENGTH} if unknown. */
    public long getContentLength()
    {
        return contentLength;
    }

    /** Every property the server returned with a successful status. */
    public Map<String,String> getCustomProperties()
    {
        return customProperties;
    }

    /**
     * Whether the resource is a collection.  Some servers mark collections
     * only through the resource type, others only through the content type,
     * so both are checked.
     */
    public boolean isDirectory()
    {
        return resourceTypes.contains("collection")
                || HTTPD_UNIX_DIRECTORY_CONTENT_TYPE.equals(contentType);
    }

    public boolean isFile()
    {
        return !isDirectory();
    }

    public String getPath()
    {
        String path = href.getPath();
        return path == null ? href.toString() : path;
    }

    /** The last non-empty path segment. */
    public String getName()
    {
        String path = getPath();
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        int start = path.lastIndexOf('/', end - 1) + 1;
        return path.substring(start, end);
    }

    @Override
    public boolean equals(Object other)
    {
        if (other == this) {
            return true;
        }
        if (!(other instanceof DavResource)) {
            return false;
        }
        return href.equals(((DavResource) other).href);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(href);
    }

    @Override
    public String toString()
    {
        return href + " [" + (isDirectory() ? "collection" : contentType + ", " + contentLength) + "]";
    }

    /** Mutable builder for resources. */
    public static class Builder
    {
        private final URI href;
        private int statusCode = DEFAULT_STATUS_CODE;
        private Instant creation;
        private Instant modified;
        private String contentType;
        private String etag;
        private String displayName;
        private List<String> resourceTypes = new ArrayList<>();
        private String contentLanguage;
        private long contentLength = DEFAULT_CONTENT_LENGTH;
        private Map<String,String> customProperties = new LinkedHashMap<>();

        private Builder(URI href)
        {
            this.href = href;
        }

        public Builder statusCode(int code)
        {
            statusCode = code;
            return this;
        }

        public Builder creation(Instant when)
        {
            creation = when;
            return this;
        }

        public Builder modified(Instant when)
        {
            modified = when;
            return this;
        }

        public Builder contentType(String type)
        {
            contentType = type;
            return this;
        }

        public Builder etag(String value)
        {
            etag = value;
            return this;
        }

        public Builder displayName(String name)
        {
            displayName = name;
            return this;
        }

        public Builder resourceTypes(List<String> types)
        {
            resourceTypes = new ArrayList<>(types);
            return this;
        }

        public Builder contentLanguage(String language)
        {
            contentLanguage = language;
            return this;
        }

        public Builder contentLength(long length)
        {
            contentLength = length;
            return this;
        }

        public Builder customProperties(Map<String,String> properties)
        {
            customProperties = new LinkedHashMap<>(properties);
            return this;
        }

        public DavResource build()
        {
            return new DavResource(this);
        }
    }
}
