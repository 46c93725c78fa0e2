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

import java.util.ArrayList;
import java.util.List;

import static org.dcache.webdav.xml.XmlHelper.descendants;
import static org.dcache.webdav.xml.XmlHelper.firstDescendant;

/**
 * Parser for the RFC 3253 supported-report-set property.
 */
public final class ReportSetParser
{
    private ReportSetParser()
    {
    }

    /** The local names of the reports listed in the property. */
    public static List<String> parseSupportedReports(Element supportedReportSet)
    {
        List<String> reports = new ArrayList<>();
        for (Element supported : descendants(supportedReportSet, "supported-report")) {
            firstDescendant(supported, "report")
                    .flatMap(XmlHelper::firstChild)
                    .map(XmlHelper::localName)
                    .ifPresent(reports::add);
        }
        return reports;
    }
}
