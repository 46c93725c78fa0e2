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
package org.dcache.webdav.http;

import org.apache.http.config.Registry;
import org.apache.http.config.RegistryBuilder;
import org.apache.http.conn.socket.ConnectionSocketFactory;
import org.apache.http.conn.socket.PlainConnectionSocketFactory;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.conn.ssl.TrustSelfSignedStrategy;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.ssl.SSLContexts;

import javax.net.ssl.SSLContext;

import java.security.GeneralSecurityException;

import org.dcache.webdav.Configuration;

/**
 * Builds the pooled HttpClient used by the WebDAV client.
 */
public class HttpClientFactory
{
    private HttpClientFactory()
    {
    }

    public static CloseableHttpClient create(Configuration config)
            throws GeneralSecurityException
    {
        HttpClientBuilder builder = HttpClientBuilder.create();

        SSLConnectionSocketFactory sslConnectionFactory;
        if (config.isTrustSelfSigned()) {
            SSLContext sslContext = SSLContexts.custom()
                    .loadTrustMaterial(null, new TrustSelfSignedStrategy()).build();
            sslConnectionFactory = new SSLConnectionSocketFactory(sslContext.getSocketFactory(),
                    new NoopHostnameVerifier());
        } else {
            sslConnectionFactory = SSLConnectionSocketFactory.getSocketFactory();
        }
        builder.setSSLSocketFactory(sslConnectionFactory);

        Registry<ConnectionSocketFactory> registry =
                RegistryBuilder.<ConnectionSocketFactory>create()
                .register("https", sslConnectionFactory)
                .register("http", new PlainConnectionSocketFactory())
                .build();

        PoolingHttpClientConnectionManager ccm = new PoolingHttpClientConnectionManager(registry);
        ccm.setMaxTotal(config.getMaxConnections());
        ccm.setDefaultMaxPerRoute(config.getMaxConnections());
        builder.setConnectionManager(ccm);

        builder.setDefaultRequestConfig(config.toRequestConfig());

        // Bodies are decoded by the dispatcher so progress reflects wire bytes.
        builder.disableContentCompression();
        builder.disableAuthCaching();
        return builder.build();
    }
}
