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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.dcache.webdav.DavMalformedResponseException;

import static org.dcache.webdav.xml.XmlHelper.children;
import static org.dcache.webdav.xml.XmlHelper.isNamed;
import static org.dcache.webdav.xml.XmlHelper.localName;

/**
 * The content of a DAV:error body: the precondition and postcondition
 * codes that explain a failure, and an optional human-readable text.
 */
public class DavError
{
    private static final Set<String> DESCRIPTIONS = ImmutableSet.of("responsedescription", "message");
    private static final Set<String> NOT_CONDITIONS = ImmutableSet.of("responsedescription",
            "message", "exception");

    private final List<String> conditions;
    private final String description;

    public DavError(List<String> conditions, String description)
    {
        this.conditions = ImmutableList.copyOf(conditions);
        this.description = description;
    }

    /**
     * Parse an error body.  Bodies that are not XML, or whose root is not
     * an error element, yield nothing.
     */
    public static Optional<DavError> parse(byte[] body)
    {
        if (body == null || body.length == 0) {
            return Optional.empty();
        }

        Element root;
        try {
            root = XmlHelper.parse(body).getDocumentElement();
        } catch (DavMalformedResponseException e) {
            return Optional.empty();
        }

        if (!isNamed(root, "error")) {
            return Optional.empty();
        }

        List<String> conditions = new ArrayList<>();
        String description = null;
        for (Element child : children(root)) {
            String name = localName(child);
            if (DESCRIPTIONS.contains(name) && description == null) {
                description = XmlHelper.text(child);
            }
            if (!NOT_CONDITIONS.contains(name)) {
                conditions.add(name);
            }
        }
        return Optional.of(new DavError(conditions, description));
    }

    public List<String> getConditions()
    {
        return conditions;
    }

    public Optional<String> getDescription()
    {
        return Optional.ofNullable(description);
    }
}
