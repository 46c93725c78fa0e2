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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import javax.xml.namespace.QName;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.dcache.webdav.auth.AuthenticationHandler;
import org.dcache.webdav.auth.AuthenticationNegotiator;
import org.dcache.webdav.http.DavRequest;
import org.dcache.webdav.http.DavResponse;
import org.dcache.webdav.http.DownloadStream;
import org.dcache.webdav.http.HttpClientFactory;
import org.dcache.webdav.http.LockManager;
import org.dcache.webdav.http.ProgressListener;
import org.dcache.webdav.http.RequestDefaults;
import org.dcache.webdav.http.RequestDispatcher;
import org.dcache.webdav.http.TransferManager;
import org.dcache.webdav.http.UrlResolver;
import org.dcache.webdav.http.VersionManager;
import org.dcache.webdav.report.DavReport;
import org.dcache.webdav.report.SyncCollectionReport;
import org.dcache.webdav.report.SyncResult;
import org.dcache.webdav.report.VersionTreeReport;
import org.dcache.webdav.xml.AclParser;
import org.dcache.webdav.xml.ActiveLock;
import org.dcache.webdav.xml.Multistatus;
import org.dcache.webdav.xml.MultistatusParser;
import org.dcache.webdav.xml.MultistatusResponse;
import org.dcache.webdav.xml.ReportSetParser;
import org.dcache.webdav.xml.XmlHelper;
import org.dcache.webdav.xml.XmlRequestEncoder;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.stream.Collectors.toList;
import static org.dcache.webdav.xml.XmlHelper.DAV_NAMESPACE;

/**
 * A blocking WebDAV client.  Each operation returns its result or throws a
 * {@link DavException} describing why the request failed.  Relative URLs
 * are resolved against the base URL, if one is set.
 */
public class WebDAVClient implements Closeable
{
    private static final Logger LOGGER = LoggerFactory.getLogger(WebDAVClient.class);

    public static final String DEFAULT_LOCK_OWNER = "dcache-webdav-client";

    public static final List<String> DEFAULT_PROPERTIES = ImmutableList.of("getcontentlength",
            "getlastmodified", "creationdate", "displayname", "getcontenttype", "resourcetype",
            "getetag", "lockdiscovery");

    private final AuthenticationNegotiator negotiator = new AuthenticationNegotiator();
    private final RequestDispatcher dispatcher;
    private final TransferManager transfers;
    private final LockManager locks;
    private final VersionManager versions;

    public WebDAVClient(CloseableHttpClient client)
    {
        this(client, RequestDefaults.defaults());
    }

    public WebDAVClient(CloseableHttpClient client, RequestDefaults defaults)
    {
        dispatcher = new RequestDispatcher(client, negotiator, defaults);
        transfers = new TransferManager(dispatcher);
        locks = new LockManager(dispatcher);
        versions = new VersionManager(dispatcher);
    }

    /** Build a client, with its own connection pool, from a configuration. */
    public static WebDAVClient create(Configuration config) throws GeneralSecurityException
    {
        config.checkValid();
        WebDAVClient client = new WebDAVClient(HttpClientFactory.create(config),
                config.toRequestDefaults());
        Configuration.Authentication auth = config.getAuthentication();
        if (auth != null) {
            if (auth.getDomain() != null) {
                client.setCredentialsWithDomain(auth.getUsername(), auth.getPassword(),
                        auth.getDomain(), auth.getWorkstation(), auth.isPreemptive());
            } else {
                client.setCredentials(auth.getUsername(), auth.getPassword(), auth.isPreemptive());
            }
        }
        return client;
    }

    // Authentication

    public void setCredentials(String username, String password)
    {
        setCredentials(username, password, false);
    }

    public void setCredentials(String username, String password, boolean preemptive)
    {
        negotiator.setCredentials(username, password);
        preemptive(preemptive);
    }

    public void setCredentialsWithDomain(String username, String password, String domain,
            String workstation)
    {
        setCredentialsWithDomain(username, password, domain, workstation, false);
    }

    public void setCredentialsWithDomain(String username, String password, String domain,
            String workstation, boolean preemptive)
    {
        negotiator.setCredentials(username, password, domain, workstation);
        preemptive(preemptive);
    }

    public void setAuthenticationHandler(AuthenticationHandler handler)
    {
        setAuthenticationHandler(handler, false);
    }

    public void setAuthenticationHandler(AuthenticationHandler handler, boolean preemptive)
    {
        negotiator.setHandler(handler);
        preemptive(preemptive);
    }

    public void clearAuthentication()
    {
        negotiator.clear();
    }

    /** Send credentials before any challenge, but only to the given host. */
    public void enablePreemptiveAuthentication(String host)
    {
        negotiator.enablePreemptive(host);
    }

    public void enablePreemptiveAuthentication(String host, int httpPort, int httpsPort)
    {
        negotiator.enablePreemptive(host, httpPort, httpsPort);
    }

    public void disablePreemptiveAuthentication()
    {
        negotiator.disablePreemptive();
    }

    private void preemptive(boolean enabled)
    {
        if (enabled) {
            negotiator.enablePreemptive();
        } else {
            negotiator.disablePreemptive();
        }
    }

    // Settings

    public void setBaseUrl(String url)
    {
        URI base = url == null ? null : UrlResolver.toUri(url);
        dispatcher.updateDefaults(d -> d.withBaseUrl(base));
    }

    public Optional<URI> getBaseUrl()
    {
        return dispatcher.getDefaults().getBaseUrl();
    }

    public void enableCompression()
    {
        dispatcher.updateDefaults(d -> d.withCompression(true));
    }

    public void disableCompression()
    {
        dispatcher.updateDefaults(d -> d.withCompression(false));
    }

    public boolean isCompressionEnabled()
    {
        return dispatcher.getDefaults().isCompressionEnabled();
    }

    public void ignoreCookies()
    {
        dispatcher.updateDefaults(d -> d.withIgnoreCookies(true));
    }

    /** Release the connection pool.  Later requests fail with a network error. */
    public void shutdown() throws IOException
    {
        dispatcher.close();
    }

    @Override
    public void close() throws IOException
    {
        shutdown();
    }

    // Listing

    /** List a collection and its members with all properties. */
    public List<DavResource> list(String url) throws DavException
    {
        return list(url, Depth.ONE);
    }

    public List<DavResource> list(String url, int depth) throws DavException
    {
        return list(url, depth, true);
    }

    public List<DavResource> list(String url, int depth, Set<String> properties) throws DavException
    {
        Set<String> names = new LinkedHashSet<>(properties);
        names.add("resourcetype");
        return propfind(url, depth, XmlRequestEncoder.propfind(davNames(names)));
    }

    /**
     * List resources, either with all properties or with the common
     * properties: length, dates, name, type, ETag and locks.
     */
    public List<DavResource> list(String url, int depth, boolean allProp) throws DavException
    {
        String body = allProp
                ? XmlRequestEncoder.propfindAllProp()
                : XmlRequestEncoder.propfind(davNames(DEFAULT_PROPERTIES));
        return propfind(url, depth, body);
    }

    public List<DavResource> propfind(String url, int depth, Set<String> properties)
            throws DavException
    {
        return list(url, depth, properties);
    }

    private List<DavResource> propfind(String url, int depth, String body) throws DavException
    {
        return dispatcher.send(DavRequest.builder("PROPFIND", url).depth(depth).xml(body).build())
                .parse(MultistatusParser::parseResources);
    }

    // Reports

    public <T> T report(String url, int depth, DavReport<T> report) throws DavException
    {
        DavRequest request = DavRequest.builder("REPORT", url)
                .depth(report.getDepth().orElse(depth))
                .headers(report.getHeaders())
                .xml(report.toXml())
                .build();
        Multistatus multistatus = dispatcher.send(request).parse(MultistatusParser::parse);
        return report.fromMultistatus(multistatus);
    }

    public List<DavResource> versionsList(String url) throws DavException
    {
        return versionsList(url, Depth.ONE);
    }

    public List<DavResource> versionsList(String url, int depth) throws DavException
    {
        return report(url, depth, new VersionTreeReport());
    }

    public List<DavResource> versionsList(String url, int depth, Set<String> properties)
            throws DavException
    {
        return report(url, depth, new VersionTreeReport(properties));
    }

    public SyncResult syncCollection(String url, String syncToken) throws DavException
    {
        return syncCollection(url, syncToken, Depth.ONE, SyncCollectionReport.DEFAULT_PROPERTIES, null);
    }

    /**
     * Fetch the changes to a collection since the given token.
     * @param limit the most results the server should return, or null
     */
    public SyncResult syncCollection(String url, String syncToken, int depth,
            List<String> properties, Integer limit) throws DavException
    {
        List<String> names = properties == null ? SyncCollectionReport.DEFAULT_PROPERTIES : properties;
        return report(url, depth, new SyncCollectionReport(syncToken, depth, names, limit));
    }

    public List<String> getSupportedReports(String url) throws DavException
    {
        return singleProperty(url, "supported-report-set")
                .map(ReportSetParser::parseSupportedReports)
                .orElseGet(List::of);
    }

    // Search

    /**
     * Issue a SEARCH.  The {@literal davbasic} language sends a basicsearch
     * for resources containing the query; any other language sends the
     * query as is.
     */
    public List<DavResource> search(String url, String language, String query) throws DavException
    {
        DavRequest request = DavRequest.builder("SEARCH", url)
                .xml(XmlRequestEncoder.searchRequest(language, query))
                .build();
        return dispatcher.send(request).parse(MultistatusParser::parseResources);
    }

    // Properties

    public List<DavResource> patch(String url, Map<String,String> set) throws DavException
    {
        return patch(url, set, List.of());
    }

    public List<DavResource> patch(String url, Map<String,String> set, List<String> remove)
            throws DavException
    {
        return patch(url, set, remove, Map.of());
    }

    /**
     * Set and remove properties.  A name in {@literal {namespace}local} form
     * is used as given; other names are placed in the client's own
     * namespace.
     */
    public List<DavResource> patch(String url, Map<String,String> set, List<String> remove,
            Map<String,String> headers) throws DavException
    {
        Map<QName,String> updates = new LinkedHashMap<>();
        set.forEach((name, value) -> updates.put(customName(name), value));
        List<QName> removals = remove.stream().map(WebDAVClient::customName).collect(toList());

        DavRequest request = DavRequest.builder("PROPPATCH", url)
                .headers(headers)
                .xml(XmlRequestEncoder.propertyUpdate(updates, removals))
                .build();
        return dispatcher.send(request).parse(MultistatusParser::parseResources);
    }

    // Content

    public byte[] get(String url) throws DavException
    {
        return get(url, Map.of());
    }

    public byte[] get(String url, Map<String,String> headers) throws DavException
    {
        return dispatcher.send(DavRequest.builder("GET", url).headers(headers).build()).getBody();
    }

    public byte[] getVersion(String url, String version) throws DavException
    {
        return versions.getVersion(url, version);
    }

    /** Open the content for reading.  The caller must close the stream. */
    public InputStream getStream(String url) throws DavException
    {
        return getStream(url, Map.of());
    }

    public InputStream getStream(String url, Map<String,String> headers) throws DavException
    {
        return transfers.download(url, headers);
    }

    public void downloadToFile(String url, Path target) throws IOException
    {
        downloadToFile(url, target, null);
    }

    public void downloadToFile(String url, Path target, ProgressListener listener) throws IOException
    {
        transfers.downloadToPath(url, target, listener, Map.of());
    }

    public void put(String url, byte[] data) throws DavException
    {
        put(url, data, DavResource.DEFAULT_CONTENT_TYPE);
    }

    public void put(String url, byte[] data, String contentType) throws DavException
    {
        put(url, data, contentType, false, data.length);
    }

    public void put(String url, byte[] data, Map<String,String> headers) throws DavException
    {
        String contentType = headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase("Content-Type"))
                .map(Map.Entry::getValue)
                .findFirst().orElse(DavResource.DEFAULT_CONTENT_TYPE);
        dispatcher.send(DavRequest.builder("PUT", url)
                .headers(headers)
                .entity(new ByteArrayEntity(data, ContentType.parse(contentType)))
                .build());
    }

    /**
     * Upload the first {@code contentLength} bytes of {@code data}.
     */
    public void put(String url, byte[] data, String contentType, boolean expectContinue,
            long contentLength) throws DavException
    {
        checkArgument(contentLength >= 0 && contentLength <= data.length,
                "Bad content length %s for %s bytes", contentLength, data.length);
        DavRequest.Builder builder = DavRequest.builder("PUT", url)
                .header("Content-Type", contentType)
                .entity(new ByteArrayEntity(data, 0, (int) contentLength, ContentType.parse(contentType)));
        if (expectContinue) {
            builder.expectContinue();
        }
        dispatcher.send(builder.build());
    }

    public void putFile(String url, Path file, String contentType) throws IOException
    {
        putFile(url, file, contentType, false);
    }

    public void putFile(String url, Path file, String contentType, boolean expectContinue)
            throws IOException
    {
        putFile(url, file, contentType, expectContinue, null);
    }

    /**
     * Upload a file.
     * @param lockToken the token of a lock held on the target, or null
     */
    public void putFile(String url, Path file, String contentType, boolean expectContinue,
            String lockToken) throws IOException
    {
        Map<String,String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", contentType);
        if (expectContinue) {
            headers.put("Expect", "100-continue");
        }
        if (lockToken != null && !lockToken.isEmpty()) {
            headers.put("If", "(<" + lockToken + ">)");
        }
        transfers.uploadFile(url, file, contentType, null, headers);
    }

    public void putStream(String url, InputStream source, long length, String contentType)
            throws DavException
    {
        putStream(url, source, length, contentType, null);
    }

    /**
     * Upload from a stream without buffering it.  The stream can only be
     * sent once, so enable preemptive authentication for servers that
     * require credentials.
     */
    public void putStream(String url, InputStream source, long length, String contentType,
            ProgressListener listener) throws DavException
    {
        transfers.upload(url, source, length, contentType, listener,
                ImmutableMap.of("Content-Type", contentType));
    }

    public void putFileStream(String url, Path file, String contentType, ProgressListener listener)
            throws IOException
    {
        transfers.uploadFile(url, file, contentType, listener,
                ImmutableMap.of("Content-Type", contentType));
    }

    // Namespace

    public void delete(String url) throws DavException
    {
        delete(url, Map.of());
    }

    public void delete(String url, Map<String,String> headers) throws DavException
    {
        dispatcher.send(DavRequest.builder("DELETE", url).headers(headers).build());
    }

    public void createDirectory(String url) throws DavException
    {
        dispatcher.send(DavRequest.builder("MKCOL", url).build());
    }

    public void move(String source, String destination) throws DavException
    {
        move(source, destination, true);
    }

    public void move(String source, String destination, boolean overwrite) throws DavException
    {
        move(source, destination, overwrite, (String) null);
    }

    public void move(String source, String destination, boolean overwrite, String lockToken)
            throws DavException
    {
        dispatcher.send(DavRequest.builder("MOVE", source)
                .destination(destination)
                .overwrite(overwrite)
                .ifLockToken(lockToken == null || lockToken.isEmpty() ? null : lockToken)
                .build());
    }

    public void move(String source, String destination, boolean overwrite,
            Map<String,String> headers) throws DavException
    {
        dispatcher.send(DavRequest.builder("MOVE", source)
                .headers(headers)
                .destination(destination)
                .overwrite(overwrite)
                .build());
    }

    public void copy(String source, String destination) throws DavException
    {
        copy(source, destination, true);
    }

    public void copy(String source, String destination, boolean overwrite) throws DavException
    {
        copy(source, destination, overwrite, Map.of());
    }

    public void copy(String source, String destination, boolean overwrite,
            Map<String,String> headers) throws DavException
    {
        dispatcher.send(DavRequest.builder("COPY", source)
                .headers(headers)
                .destination(destination)
                .overwrite(overwrite)
                .build());
    }

    /**
     * Check whether a resource exists.  Any failure is reported as absence,
     * including a URL that cannot be resolved.
     */
    public boolean exists(String url)
    {
        try {
            dispatcher.send(DavRequest.builder("HEAD", url).build());
            return true;
        } catch (DavException e) {
            LOGGER.debug("Treating {} as missing: {}", url, e.getMessage());
            return false;
        }
    }

    // Locking

    public String lock(String url) throws DavException
    {
        return lock(url, LockManager.DEFAULT_TIMEOUT);
    }

    public String lock(String url, int timeoutSeconds) throws DavException
    {
        String owner = negotiator.getUsername().orElse(DEFAULT_LOCK_OWNER);
        return locks.lock(url, timeoutSeconds, owner);
    }

    public String refreshLock(String url, String token) throws DavException
    {
        return locks.refreshLock(url, token);
    }

    public void unlock(String url, String token) throws DavException
    {
        locks.unlock(url, token);
    }

    public List<ActiveLock> discoverLocks(String url) throws DavException
    {
        return locks.discoverLocks(url);
    }

    public boolean isLocked(String url) throws DavException
    {
        return locks.isLocked(url);
    }

    public Optional<String> getLockToken(String url) throws DavException
    {
        return locks.getLockToken(url);
    }

    // Access control

    public DavAcl getAcl(String url) throws DavException
    {
        List<DavAce> aces = singleProperty(url, "acl")
                .map(AclParser::parseAces)
                .orElseGet(List::of);
        return new DavAcl(aces, url);
    }

    /** Replace the ACL.  Protected and inherited entries are not sent. */
    public void setAcl(String url, List<DavAce> aces) throws DavException
    {
        dispatcher.send(DavRequest.builder("ACL", url).xml(XmlRequestEncoder.acl(aces)).build());
    }

    /** List the members of a principal collection that are principals. */
    public List<DavPrincipal> getPrincipals(String url) throws DavException
    {
        DavRequest request = DavRequest.builder("PROPFIND", url)
                .depth(Depth.ONE)
                .xml(XmlRequestEncoder.propfind(davNames(List.of("displayname", "resourcetype",
                        "principal-URL"))))
                .build();
        List<DavResource> resources = dispatcher.send(request).parse(MultistatusParser::parseResources);

        List<DavPrincipal> principals = new ArrayList<>();
        for (DavResource resource : resources) {
            if (resource.getResourceTypes().contains("principal")) {
                principals.add(new DavPrincipal(resource.getHref().toString(),
                        resource.getDisplayName().orElse(null), DavPrincipal.Type.USER,
                        resource.getCustomProperties()));
            }
        }
        return principals;
    }

    public List<String> getPrincipalCollectionSet(String url) throws DavException
    {
        return singleProperty(url, "principal-collection-set")
                .map(XmlHelper::hrefs)
                .orElseGet(List::of);
    }

    public Set<String> getCurrentUserPrivileges(String url) throws DavException
    {
        return singleProperty(url, "current-user-privilege-set")
                .map(AclParser::privilegeNames)
                .orElseGet(Set::of);
    }

    public boolean hasPrivilege(String url, String privilege) throws DavException
    {
        return covers(getCurrentUserPrivileges(url), privilege);
    }

    /** Check several privileges with a single request. */
    public Map<String,Boolean> validatePrivileges(String url, Collection<String> privileges)
            throws DavException
    {
        Set<String> held = getCurrentUserPrivileges(url);
        Map<String,Boolean> results = new LinkedHashMap<>();
        for (String privilege : privileges) {
            results.put(privilege, covers(held, privilege));
        }
        return Collections.unmodifiableMap(results);
    }

    private static boolean covers(Set<String> held, String privilege)
    {
        return held.contains(privilege) || held.contains("all");
    }

    /**
     * Fetch the quota of a collection.  A server that reports no limit
     * yields {@link DavQuota#UNLIMITED} available bytes.
     */
    public DavQuota getQuota(String url) throws DavException
    {
        DavRequest request = DavRequest.builder("PROPFIND", url)
                .depth(Depth.ZERO)
                .xml(XmlRequestEncoder.propfind(davNames(List.of("quota-available-bytes",
                        "quota-used-bytes"))))
                .build();
        DavResponse response = dispatcher.send(request);
        Optional<MultistatusResponse> first = response.parse(MultistatusParser::parse).first();
        Map<String,String> properties = first.isPresent()
                ? MultistatusParser.toResource(first.get()).getCustomProperties()
                : Map.of();
        return new DavQuota(longProperty(response, properties, "quota-available-bytes", DavQuota.UNLIMITED),
                longProperty(response, properties, "quota-used-bytes", 0), url);
    }

    private static long longProperty(DavResponse response, Map<String,String> properties,
            String name, long defaultValue) throws DavMalformedResponseException
    {
        String value = properties.get(name);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new DavMalformedResponseException(response.getMethod(), response.getUrl(),
                    response.getStatusCode(), "bad " + name + ": " + value, e);
        }
    }

    // Binding

    /**
     * Make the resource at {@code source} also available at {@code target}.
     * The new binding's name is the last path segment of the target.
     */
    public void bind(String source, String target, boolean overwrite) throws DavException
    {
        String segment = DavResource.builder(dispatcher.resolve(target)).build().getName();
        checkArgument(!segment.isEmpty(), "Target has no name: %s", target);
        dispatcher.send(DavRequest.builder("BIND", target)
                .overwrite(overwrite)
                .xml(XmlRequestEncoder.bind(segment, dispatcher.resolve(source).toASCIIString()))
                .build());
    }

    public void unbind(String url, String segment) throws DavException
    {
        dispatcher.send(DavRequest.builder("UNBIND", url)
                .xml(XmlRequestEncoder.unbind(segment))
                .build());
    }

    // Versioning

    public void versionControl(String url) throws DavException
    {
        versions.versionControl(url);
    }

    /** Check out a resource, returning the URL of the working resource. */
    public String checkout(String url) throws DavException
    {
        return versions.checkout(url);
    }

    public String checkin(String url) throws DavException
    {
        return checkin(url, false);
    }

    /** Check in a resource, returning the URL of the new version. */
    public String checkin(String url, boolean keepCheckedOut) throws DavException
    {
        return versions.checkin(url, keepCheckedOut);
    }

    public void uncheckout(String url) throws DavException
    {
        versions.uncheckout(url);
    }

    public void baselineControl(String url) throws DavException
    {
        versions.baselineControl(url);
    }

    public String makeBaseline(String url) throws DavException
    {
        return versions.makeBaseline(url);
    }

    public List<String> getVersionHistory(String url) throws DavException
    {
        return versions.getVersionHistory(url);
    }

    /** Fetch one live property of a resource with a depth-0 PROPFIND. */
    private Optional<Element> singleProperty(String url, String name) throws DavException
    {
        DavRequest request = DavRequest.builder("PROPFIND", url)
                .depth(Depth.ZERO)
                .xml(XmlRequestEncoder.propfind(davNames(List.of(name))))
                .build();
        return dispatcher.send(request).parse(MultistatusParser::parse).first()
                .flatMap(r -> r.successfulPropertiesWith(name))
                .flatMap(p -> p.getElement(name));
    }

    private static List<QName> davNames(Collection<String> names)
    {
        return names.stream()
                .map(n -> XmlRequestEncoder.propertyName(n, DAV_NAMESPACE))
                .collect(toList());
    }

    private static QName customName(String name)
    {
        return XmlRequestEncoder.propertyName(name, XmlRequestEncoder.CUSTOM_NAMESPACE);
    }
}
