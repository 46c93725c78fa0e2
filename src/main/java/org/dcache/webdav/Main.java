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

/**
 * List the WebDAV collections given on the command line.
 */
public class Main
{
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception
    {
        if (args.length == 0) {
            System.err.println("Usage: Main URL...");
            System.exit(2);
        }

        String configPath = System.getProperty("configuration.path", "config.yaml");
        Configuration config = new ConfigurationLoader(configPath).load();

        int failures = 0;
        try (WebDAVClient client = WebDAVClient.create(config)) {
            for (String url : args) {
                try {
                    for (DavResource resource : client.list(url, Depth.ONE, false)) {
                        System.out.println(describe(resource));
                    }
                } catch (DavException e) {
                    LOGGER.error("Listing {} failed: {}", url, e.getMessage());
                    failures++;
                }
            }
        }
        System.exit(failures == 0 ? 0 : 1);
    }

    private static String describe(DavResource resource)
    {
        StringBuilder sb = new StringBuilder();
        sb.append(resource.isDirectory() ? 'd' : '-');
        sb.append(String.format(" %12d ", resource.getContentLength()));
        sb.append(resource.getModified().map(Object::toString).orElse("-"));
        sb.append(' ').append(resource.getPath());
        return sb.toString();
    }
}
