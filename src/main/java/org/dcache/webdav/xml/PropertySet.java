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

import org.w3c.dom.Element;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.dcache.webdav.xml.XmlHelper.children;
import static org.dcache.webdav.xml.XmlHelper.firstChild;
import static org.dcache.webdav.xml.XmlHelper.hasDescendant;
import static org.dcache.webdav.xml.XmlHelper.localName;
import static org.dcache.webdav.xml.XmlHelper.text;

/**
 * The properties inside a single DAV:prop element, keyed by local name.
 * Each property has a textual value: its trimmed text content or, for
 * properties that only contain marker elements, the local name of the
 * first child.  The DOM element is kept so structured properties (ACLs,
 * lock discovery, privilege sets) can be parsed further.
 */
public class PropertySet
{
    public static final String COLLECTION = "collection";

    private static final PropertySet EMPTY = new PropertySet(Collections.emptyMap(),
            Collections.emptyMap());

    private final Map<String,String> values;
    private final Map<String,Element> elements;

    private PropertySet(Map<String,String> values, Map<String,Element> elements)
    {
        this.values = values;
        this.elements = elements;
    }

    public static PropertySet empty()
    {
        return EMPTY;
    }

    public static PropertySet of(Element prop)
    {
        Map<String,String> values = new LinkedHashMap<>();
        Map<String,Element> elements = new LinkedHashMap<>();
        for (Element property : children(prop)) {
            String name = localName(property);
            values.put(name, valueOf(name, property));
            elements.put(name, property);
        }
        return new PropertySet(Collections.unmodifiableMap(values),
                Collections.unmodifiableMap(elements));
    }

    private static String valueOf(String name, Element property)
    {
        if (name.equals("resourcetype") && hasDescendant(property, COLLECTION)) {
            return COLLECTION;
        }

        String text = text(property);
        if (!text.isEmpty()) {
            return text;
        }

        return firstChild(property).map(XmlHelper::localName).orElse("");
    }

    public Set<String> names()
    {
        return values.keySet();
    }

    public boolean contains(String name)
    {
        return values.containsKey(name);
    }

    public Optional<String> get(String name)
    {
        return Optional.ofNullable(values.get(name));
    }

    public Optional<Element> getElement(String name)
    {
        return Optional.ofNullable(elements.get(name));
    }

    public Map<String,String> asMap()
    {
        return values;
    }

    public boolean isEmpty()
    {
        return values.isEmpty();
    }

    @Override
    public String toString()
    {
        return values.toString();
    }
}
