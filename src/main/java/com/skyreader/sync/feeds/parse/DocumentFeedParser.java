package com.skyreader.sync.feeds.parse;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyreader.sync.core.model.FeedEntry;
import com.skyreader.sync.core.model.ParsedFeed;
import com.skyreader.sync.feeds.config.FeedRefreshProperties;

/**
 * RSS 2.0, Atom, RSS 1.0 (RDF) and JSON Feed parser over the JDK DOM and Jackson.
 *
 * <p>Elements are matched by qualified name ({@code content:encoded}, {@code dc:creator}) which is what feeds
 * use in practice. External entities and DTDs are never loaded. At most {@code maxItems} entries are kept.</p>
 */
@Component
public class DocumentFeedParser implements FeedParser {

    private static final String JSON_FEED_VERSION_PREFIX = "https://jsonfeed.org/";
    private static final String UNTITLED_ITEM = "Untitled";
    private static final String UNTITLED_FEED = "Untitled Feed";

    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(\\d+);");
    private static final Pattern HEX_ENTITY = Pattern.compile("&#[xX]([0-9a-fA-F]+);");
    private static final Pattern IMG_SRC = Pattern.compile("<img[^>]+src=[\"']([^\"']+)[\"']",
            Pattern.CASE_INSENSITIVE);

    private final ObjectMapper mapper;
    private final int maxItems;

    public DocumentFeedParser(ObjectMapper mapper, FeedRefreshProperties props) {
        this(mapper, props.getMaxItems());
    }

    DocumentFeedParser(ObjectMapper mapper, int maxItems) {
        this.mapper = mapper;
        this.maxItems = maxItems;
    }

    @Override
    public ParsedFeed parse(byte[] body, String feedUrl) {
        if (body == null || body.length == 0) {
            throw new FeedParseException("Empty document from " + feedUrl);
        }
        String head = new String(body, 0, Math.min(body.length, 256), StandardCharsets.UTF_8)
                .replace("\uFEFF", "")
                .strip()
                .toLowerCase(Locale.ROOT);

        if (head.startsWith("{")) {
            ParsedFeed json = tryJsonFeed(body);
            if (json != null) {
                return json;
            }
        }
        if (head.startsWith("<!doctype html") || head.startsWith("<html")) {
            throw new FeedParseException("URL returned HTML instead of a feed: " + feedUrl);
        }

        Element root = readXml(body, feedUrl).getDocumentElement();
        String name = root.getNodeName();
        if ("feed".equals(name) || name.endsWith(":feed")) {
            return atom(root);
        }
        if ("rss".equals(name)) {
            Element channel = child(root, "channel");
            if (channel != null) {
                return rss(channel);
            }
        }
        if ("rdf:RDF".equals(name)) {
            return rdf(root);
        }
        throw new FeedParseException("Unknown feed format. Root element: " + name);
    }

    // ---- JSON Feed ----

    private ParsedFeed tryJsonFeed(byte[] body) {
        JsonNode json;
        try {
            json = mapper.readTree(body);
        } catch (IOException e) {
            return null;
        }
        String version = json.path("version").asText("");
        if (!version.startsWith(JSON_FEED_VERSION_PREFIX)) {
            return null;
        }

        List<FeedEntry> items = new ArrayList<>();
        for (JsonNode item : json.path("items")) {
            if (items.size() >= maxItems) {
                break;
            }
            String title = firstNonBlank(jsonText(item, "title"), UNTITLED_ITEM);
            String url = firstNonBlank(jsonText(item, "url"), jsonText(item, "external_url"));
            String guid = firstNonBlank(jsonText(item, "id"), url, slugGuid(title));
            String author = jsonText(item.path("author"), "name");
            if (author == null && item.path("authors").isArray() && item.path("authors").size() > 0) {
                author = jsonText(item.path("authors").get(0), "name");
            }
            items.add(new FeedEntry(guid, url, title, author,
                    jsonText(item, "summary"),
                    firstNonBlank(jsonText(item, "content_html"), jsonText(item, "content_text")),
                    firstNonBlank(jsonText(item, "image"), jsonText(item, "banner_image")),
                    date(firstNonBlank(jsonText(item, "date_published"), jsonText(item, "date_modified")))));
        }
        return new ParsedFeed(firstNonBlank(jsonText(json, "title"), UNTITLED_FEED), jsonText(json, "home_page_url"),
                jsonText(json, "description"), items);
    }

    private static String jsonText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || !v.isValueNode() || v.asText().isBlank() ? null : v.asText();
    }

    // ---- XML ----

    private static Document readXml(byte[] body, String feedUrl) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setNamespaceAware(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new ByteArrayInputStream(body));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        } catch (SAXException | IOException e) {
            throw new FeedParseException("Malformed feed XML from " + feedUrl + ": " + e.getMessage(), e);
        }
    }

    private ParsedFeed rss(Element channel) {
        List<FeedEntry> items = new ArrayList<>();
        for (Element item : children(channel, "item")) {
            if (items.size() >= maxItems) {
                break;
            }
            items.add(rssItem(item, true));
        }
        return new ParsedFeed(decode(firstNonBlank(text(channel, "title"), UNTITLED_FEED)), text(channel, "link"),
                decode(text(channel, "description")), items);
    }

    private ParsedFeed rdf(Element root) {
        Element channel = child(root, "channel");
        List<FeedEntry> items = new ArrayList<>();
        for (Element item : children(root, "item")) {
            if (items.size() >= maxItems) {
                break;
            }
            items.add(rssItem(item, false));
        }
        String title = channel == null ? null : text(channel, "title");
        return new ParsedFeed(decode(firstNonBlank(title, UNTITLED_FEED)),
                channel == null ? null : text(channel, "link"),
                channel == null ? null : decode(text(channel, "description")), items);
    }

    private FeedEntry rssItem(Element item, boolean honourGuid) {
        String title = firstNonBlank(text(item, "title"), UNTITLED_ITEM);
        String url = text(item, "link");
        String guid = firstNonBlank(honourGuid ? text(item, "guid") : null, url, slugGuid(title));
        String description = text(item, "description");
        String content = firstNonBlank(text(item, "content:encoded"), description);
        return new FeedEntry(guid, url, decode(title),
                decode(firstNonBlank(text(item, "author"), text(item, "dc:creator"))),
                decode(description),
                decode(content),
                rssImage(item, content),
                date(firstNonBlank(text(item, "pubDate"), text(item, "dc:date"))));
    }

    private ParsedFeed atom(Element feed) {
        List<FeedEntry> items = new ArrayList<>();
        for (Element entry : children(feed, "entry")) {
            if (items.size() >= maxItems) {
                break;
            }
            String title = firstNonBlank(text(entry, "title"), UNTITLED_ITEM);
            String url = atomLink(entry);
            String guid = firstNonBlank(text(entry, "id"), url, slugGuid(title));
            Element author = child(entry, "author");
            String summary = text(entry, "summary");
            String content = firstNonBlank(text(entry, "content"), summary);
            items.add(new FeedEntry(guid, url, decode(title),
                    author == null ? null : decode(text(author, "name")),
                    decode(summary),
                    decode(content),
                    content == null ? null : firstImage(content),
                    date(firstNonBlank(text(entry, "updated"), text(entry, "published")))));
        }
        return new ParsedFeed(decode(firstNonBlank(text(feed, "title"), UNTITLED_FEED)), atomLink(feed),
                decode(text(feed, "subtitle")), items);
    }

    private static String atomLink(Element parent) {
        String fallback = null;
        for (Element link : children(parent, "link")) {
            String href = blankToNull(link.getAttribute("href"));
            if (href == null) {
                continue;
            }
            String rel = blankToNull(link.getAttribute("rel"));
            if (rel == null || "alternate".equals(rel)) {
                return href;
            }
            if (fallback == null) {
                fallback = href;
            }
        }
        return fallback;
    }

    private static String rssImage(Element item, String content) {
        for (String tag : new String[] { "media:content", "media:thumbnail" }) {
            Element media = child(item, tag);
            if (media != null && blankToNull(media.getAttribute("url")) != null) {
                return media.getAttribute("url");
            }
        }
        for (Element enclosure : children(item, "enclosure")) {
            if (enclosure.getAttribute("type").startsWith("image/")
                    && blankToNull(enclosure.getAttribute("url")) != null) {
                return enclosure.getAttribute("url");
            }
        }
        return content == null ? null : firstImage(content);
    }

    private static String firstImage(String html) {
        Matcher m = IMG_SRC.matcher(html);
        return m.find() ? m.group(1) : null;
    }

    private static Element child(Element parent, String name) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE && name.equals(n.getNodeName())) {
                return (Element) n;
            }
        }
        return null;
    }

    private static List<Element> children(Element parent, String name) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE && name.equals(n.getNodeName())) {
                out.add((Element) n);
            }
        }
        return out;
    }

    private static String text(Element parent, String name) {
        Element e = child(parent, name);
        return e == null ? null : blankToNull(e.getTextContent());
    }

    // ---- values ----

    static Instant date(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim();
        try {
            return ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException ignored) {
            // not RFC 822 style, try ISO 8601
        }
        try {
            return OffsetDateTime.parse(v).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        try {
            return Instant.parse(v);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String decode(String text) {
        if (text == null) {
            return null;
        }
        String decoded = text.replace("&amp;", "&").replace("&lt;", "<").replace("&gt;", ">")
                .replace("&quot;", "\"").replace("&#39;", "'").replace("&apos;", "'").replace("&nbsp;", " ");
        decoded = replaceCodePoints(NUMERIC_ENTITY.matcher(decoded), 10);
        return replaceCodePoints(HEX_ENTITY.matcher(decoded), 16);
    }

    private static String replaceCodePoints(Matcher m, int radix) {
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String replacement;
            try {
                replacement = new String(Character.toChars(Integer.parseInt(m.group(1), radix)));
            } catch (IllegalArgumentException e) {
                replacement = m.group();
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    static String slugGuid(String title) {
        String slug = title.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "-");
        return "guid-" + (slug.length() > 50 ? slug.substring(0, 50) : slug);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.strip();
    }
}
