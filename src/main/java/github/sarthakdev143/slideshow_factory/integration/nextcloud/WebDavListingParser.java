package github.sarthakdev143.slideshow_factory.integration.nextcloud;

import github.sarthakdev143.slideshow_factory.exception.TransportException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a PROPFIND multistatus body into entries. Hrefs are URL-decoded; the entry for
 * the collection itself is kept and flagged so callers can skip it.
 */
class WebDavListingParser {

    private static final String DAV_NAMESPACE = "DAV:";

    record Entry(String href, String name, boolean collection) {
    }

    List<Entry> parse(String multistatusXml) {
        Document document = parseDocument(multistatusXml);
        NodeList responses = document.getElementsByTagNameNS(DAV_NAMESPACE, "response");
        List<Entry> entries = new ArrayList<>();
        for (int index = 0; index < responses.getLength(); index++) {
            Element response = (Element) responses.item(index);
            String href = firstText(response, "href");
            if (href == null || href.isBlank()) {
                continue;
            }
            String decoded = URLDecoder.decode(href.replace("+", "%2B"), StandardCharsets.UTF_8);
            boolean collection = response.getElementsByTagNameNS(DAV_NAMESPACE, "collection").getLength() > 0;
            entries.add(new Entry(decoded, lastSegment(decoded), collection));
        }
        return entries;
    }

    private Document parseDocument(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new TransportException("Unreadable WebDAV listing: " + e.getMessage(), e);
        }
    }

    private String firstText(Element parent, String localName) {
        NodeList nodes = parent.getElementsByTagNameNS(DAV_NAMESPACE, localName);
        return nodes.getLength() == 0 ? null : nodes.item(0).getTextContent().trim();
    }

    static String lastSegment(String path) {
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        int slash = trimmed.lastIndexOf('/');
        return slash < 0 ? trimmed : trimmed.substring(slash + 1);
    }
}
