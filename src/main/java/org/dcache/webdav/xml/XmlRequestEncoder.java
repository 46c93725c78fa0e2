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

import com.google.common.escape.Escaper;
import com.google.common.xml.XmlEscapers;

import javax.xml.namespace.QName;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.dcache.webdav.DavAce;

/**
 * Builds the XML request bodies of the WebDAV methods.  DAV: elements use
 * the prefix "D"; elements in any other namespace declare their namespace
 * in place.
 */
public final class XmlRequestEncoder
{
    /** Namespace used for plain (unqualified) custom property names. */
    public static final String CUSTOM_NAMESPACE = "SAR:";
    public static final String CUSTOM_PREFIX = "S";

    private static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n";
    private static final Escaper CONTENT = XmlEscapers.xmlContentEscaper();
    private static final Escaper ATTRIBUTE = XmlEscapers.xmlAttributeEscaper();

    private XmlRequestEncoder()
    {
    }

    /**
     * Interpret a property name.  Names in the form {namespace}local keep
     * their namespace; plain names are placed in the default namespace.
     */
    public static QName propertyName(String name, String defaultNamespace)
    {
        if (name.startsWith("{")) {
            return QName.valueOf(name);
        }
        return new QName(defaultNamespace, name);
    }

    public static String propfindAllProp()
    {
        return DECLARATION + "<D:propfind xmlns:D=\"DAV:\"><D:allprop/></D:propfind>";
    }

    public static String propfindPropName()
    {
        return DECLARATION + "<D:propfind xmlns:D=\"DAV:\"><D:propname/></D:propfind>";
    }

    public static String propfind(Collection<QName> properties)
    {
        StringBuilder sb = new StringBuilder(DECLARATION);
        sb.append("<D:propfind xmlns:D=\"DAV:\">");
        appendProp(sb, properties);
        sb.append("</D:propfind>");
        return sb.toString();
    }

    /**
     * A PROPPATCH body.  Properties to set share one set/prop block,
     * properties to remove are listed without value in one remove/prop
     * block.  An empty group is omitted.
     */
    public static String propertyUpdate(Map<QName,String> set, Collection<QName> remove)
    {
        StringBuilder sb = new StringBuilder(DECLARATION);
        sb.append("<D:propertyupdate xmlns:D=\"DAV:\">");
        if (!set.isEmpty()) {
            sb.append("<D:set><D:prop>");
            for (Map.Entry<QName,String> entry : set.entrySet()) {
                appendElement(sb, entry.getKey(), entry.getValue());
            }
            sb.append("</D:prop></D:set>");
        }
        if (!remove.isEmpty()) {
            sb.append("<D:remove>");
            appendProp(sb, remove);
            sb.append("</D:remove>");
        }
        sb.append("</D:propertyupdate>");
        return sb.toString();
    }

    public static String lockInfo(boolean exclusive, String owner)
    {
        StringBuilder sb = new StringBuilder(DECLARATION);
        sb.append("<D:lockinfo xmlns:D=\"DAV:\">");
        sb.append("<D:lockscope>").append(exclusive ? "<D:exclusive/>" : "<D:shared/>").append("</D:lockscope>");
        sb.append("<D:locktype><D:write/></D:locktype>");
        if (owner != null) {
            sb.append("<D:owner>").append(CONTENT.escape(owner)).append("</D:owner>");
        }
        sb.append("</D:lockinfo>");
        return sb.toString();
    }

    /**
     * An ACL body.  Protected and inherited entries cannot be set by a
     * client and are left out.
     */
    public static String acl(List<DavAce> aces)
    {
        StringBuilder sb = new StringBuilder(DECLARATION);
        sb.append("<D:acl xmlns:D=\"DAV:\">");
        for (DavAce ace : aces) {
            if (ace.isProtected() || ace.isInherited()) {
                continue;
            }
            sb.append("<D:ace><D:principal>");
            switch (ace.getPrincipal()) {
            case DavAce.ALL:
                sb.append("<D:all/>");
                break;
            case DavAce.AUTHENTICATED:
                sb.append("<D:authenticated/>");
                break;
            case DavAce.UNAUTHENTICATED:
                sb.append("<D:unauthenticated/>");
                break;
            case DavAce.SELF:
                sb.append("<D:self/>");
                break;
            default:
                sb.append("<D:href>").append(CONTENT.escape(ace.getPrincipal())).append("</D:href>");
                break;
            }
            sb.append("</D:principal>");
            String verb = ace.isGrant() ? "grant" : "deny";
            sb.append("<D:").append(verb).append('>');
            for (String privilege : ace.getPrivileges()) {
                sb.append("<D:privilege>");
                appendElement(sb, propertyName(privilege, XmlHelper.DAV_NAMESPACE), null);
                sb.append("</D:privilege>");
            }
            sb.append("</D:").append(verb).append("></D:ace>");
        }
        sb.append("</D:acl>");
        return sb.toString();
    }

    /**
     * A SEARCH body.  The "davbasic" language wraps the query in a
     * basicsearch over the whole tree; any other language sends the query
     * as an sql element.
     */
    public static String searchRequest(String language, String query)
    {
        StringBuilder sb = new StringBuilder(DECLARATION);
        sb.append("<D:searchrequest xmlns:D=\"DAV:\">");
        if (language.equals("davbasic")) {
            sb.append("<D:basicsearch>")
                    .append("<D:select><D:allprop/></D:select>")
                    .append("<D:from><D:scope><D:href>/</D:href><D:depth>infinity</D:depth></D:scope></D:from>")
                    .append("<D:where><D:contains>").append(CONTENT.escape(query)).append("</D:contains></D:where>")
                    .append("</D:basicsearch>");
        } else {
            sb.append("<D:sql>").append(CONTENT.escape(query)).append("</D:sql>");
        }
        sb.append("</D:searchrequest>");
        return sb.toString();
    }

    public static String syncCollection(String syncToken, String syncLevel, Integer limit,
            Collection<QName> properties)
    {
        StringBuilder sb = new StringBuilder(DECLARATION);
        sb.append("<D:sync-collection xmlns:D=\"DAV:\">");
        sb.append("<D:sync-token>").append(CONTENT.escape(syncToken == null ? "" : syncToken)).append("</D:sync-token>");
        sb.append("<D:sync-level>").append(syncLevel).append("</D:sync-level>");
        if (limit != null) {
            sb.append("<D:limit><D:nresults>").append(limit).append("</D:nresults></D:limit>");
        }
        appendProp(sb, properties);
        sb.append("</D:sync-collection>");
        return sb.toString();
    }

    public static String versionTree(Collection<QName> properties)
    {
        StringBuilder sb = new StringBuilder(DECLARATION);
        sb.append("<D:version-tree xmlns:D=\"DAV:\">");
        if (!properties.isEmpty()) {
            appendProp(sb, properties);
        }
        sb.append("</D:version-tree>");
        return sb.toString();
    }

    public static String versionControl(String version)
    {
        return hrefWrapper("version-control", "version", version);
    }

    public static String checkout(String activitySet)
    {
        return hrefWrapper("checkout", "activity-set", activitySet);
    }

    public static String checkin(boolean keepCheckedOut)
    {
        return DECLARATION + (keepCheckedOut
                ? "<D:checkin xmlns:D=\"DAV:\"><D:keep-checked-out/></D:checkin>"
                : "<D:checkin xmlns:D=\"DAV:\"/>");
    }

    public static String uncheckout()
    {
        return DECLARATION + "<D:uncheckout xmlns:D=\"DAV:\"/>";
    }

    public static String baselineControl(String baseline)
    {
        return hrefWrapper("baseline-control", "baseline", baseline);
    }

    public static String mkbaseline()
    {
        return DECLARATION + "<D:mkbaseline xmlns:D=\"DAV:\"/>";
    }

    public static String bind(String segment, String href)
    {
        return DECLARATION + "<D:bind xmlns:D=\"DAV:\"><D:segment>" + CONTENT.escape(segment)
                + "</D:segment><D:href>" + CONTENT.escape(href) + "</D:href></D:bind>";
    }

    public static String unbind(String segment)
    {
        return DECLARATION + "<D:unbind xmlns:D=\"DAV:\"><D:segment>" + CONTENT.escape(segment)
                + "</D:segment></D:unbind>";
    }

    private static String hrefWrapper(String root, String wrapper, String href)
    {
        if (href == null) {
            return DECLARATION + "<D:" + root + " xmlns:D=\"DAV:\"/>";
        }
        return DECLARATION + "<D:" + root + " xmlns:D=\"DAV:\"><D:" + wrapper + "><D:href>"
                + CONTENT.escape(href) + "</D:href></D:" + wrapper + "></D:" + root + ">";
    }

    private static void appendProp(StringBuilder sb, Collection<QName> properties)
    {
        sb.append("<D:prop>");
        for (QName property : properties) {
            appendElement(sb, property, null);
        }
        sb.append("</D:prop>");
    }

    private static void appendElement(StringBuilder sb, QName name, String value)
    {
        String namespace = name.getNamespaceURI();
        String tag;
        String declaration;
        if (namespace.equals(XmlHelper.DAV_NAMESPACE)) {
            tag = "D:" + name.getLocalPart();
            declaration = "";
        } else if (namespace.isEmpty()) {
            tag = name.getLocalPart();
            declaration = " xmlns=\"\"";
        } else {
            String prefix = namespace.equals(CUSTOM_NAMESPACE) ? CUSTOM_PREFIX : "ns0";
            tag = prefix + ":" + name.getLocalPart();
            declaration = " xmlns:" + prefix + "=\"" + ATTRIBUTE.escape(namespace) + "\"";
        }

        sb.append('<').append(tag).append(declaration);
        if (value == null) {
            sb.append("/>");
        } else {
            sb.append('>').append(CONTENT.escape(value)).append("</").append(tag).append('>');
        }
    }
}
