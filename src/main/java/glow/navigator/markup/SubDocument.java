package glow.navigator.markup;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import glow.navigator.model.Ids;

/**
 * Markup document embedded as a string field of a record (form data,
 * workflow definition, dependencies, condition expression). Parsed once;
 * every {@link #find} call walks the retained tree again.
 */
public final class SubDocument {

    static final String PLACEHOLDER = "Placeholder";

    private final Document document;

    private SubDocument(Document document) {
        this.document = document;
    }

    public static SubDocument parse(String xml) {
        Objects.requireNonNull(xml, "xml");
        try {
            final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            final var builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler());
            return new SubDocument(builder.parse(new InputSource(new StringReader(xml))));
        } catch (SAXException | IOException ex) {
            throw new SubDocumentException("Malformed embedded markup: " + ex.getMessage(), ex);
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser unavailable", ex);
        }
    }

    /**
     * Strips a {uri} or prefix: namespace from a tag or attribute name.
     */
    public static String localName(String name) {
        if (name == null) {
            return "";
        }
        String local = name;
        final int brace = local.lastIndexOf('}');
        if (local.startsWith("{") && brace > 0) {
            local = local.substring(brace + 1);
        }
        final int colon = local.indexOf(':');
        return colon >= 0 ? local.substring(colon + 1) : local;
    }

    public Iterable<Reference> find(String tag) {
        return find(tag, null);
    }

    /**
     * Descriptors for every element with the given tag, in document order.
     * With a subtype only elements whose subtype attribute matches are kept.
     */
    public Iterable<Reference> find(String tag, String subtype) {
        final ReferenceKind kind = ReferenceKind.forTag(tag)
                .orElseThrow(() -> new IllegalArgumentException("No reference kind for tag: " + tag));
        return () -> elements(tag)
                .filter(e -> subtype == null || subtype.equals(attributes(e).get(kind.subtypeAttribute())))
                .map(e -> describe(kind, tag, e))
                .flatMap(Optional::stream)
                .iterator();
    }

    /**
     * Descriptors keyed by the value of a raw attribute. Repeated values merge
     * into the first descriptor seen.
     */
    public Map<String, Reference> findByAttribute(String tag, String key) {
        final ReferenceKind kind = ReferenceKind.forTag(tag)
                .orElseThrow(() -> new IllegalArgumentException("No reference kind for tag: " + tag));
        final Map<String, Reference> out = new LinkedHashMap<>();
        elements(tag).forEach(e -> {
            final String value = attributes(e).get(key);
            if (value == null) {
                return;
            }
            describe(kind, tag, e).ifPresent(ref -> out.merge(value, ref, Reference::mergedWith));
        });
        return out;
    }

    /**
     * Leaf values of the document embedded in each control's
     * {@code containerField} placeholder (list columns, filters, sort fields).
     */
    public List<NestedReference> findNested(String containerField, String targetAttribute) {
        final List<NestedReference> out = new ArrayList<>();
        elements("control").forEach(control -> {
            final Map<String, String> placeholders = placeholders(control);
            final String nestedXml = placeholders.get(containerField);
            if (nestedXml == null) {
                return;
            }
            final String listType = placeholders.get("ListType");
            final SubDocument nested = parse(nestedXml);
            nested.elements(null).forEach(e -> {
                final String value = attributes(e).get(targetAttribute);
                if (value != null) {
                    out.add(new NestedReference(listType, value));
                }
            });
        });
        return out;
    }

    private Stream<Element> elements(String tag) {
        final NodeList all = document.getElementsByTagName("*");
        return IntStream.range(0, all.getLength())
                .mapToObj(all::item)
                .map(Element.class::cast)
                .filter(e -> tag == null || tag.equals(localName(e.getTagName())));
    }

    private static Optional<Reference> describe(ReferenceKind kind, String tag, Element element) {
        final Map<String, String> topics = new LinkedHashMap<>();
        final Map<String, String> attrs = attributes(element);
        kind.attributeTopics().forEach((raw, topic) -> {
            final String value = attrs.get(raw);
            if (value != null) {
                topics.put(topic, value);
            }
        });
        if (!kind.placeholderTopics().isEmpty()) {
            placeholders(element).forEach((name, value) -> {
                final String topic = kind.placeholderTopics().get(name);
                if (topic != null) {
                    topics.put(topic, value);
                }
            });
        }
        if (kind == ReferenceKind.CONDITION) {
            final String condition = topics.get("condition");
            if (condition == null || Ids.NULL_GUID.equalsIgnoreCase(condition.trim())) {
                return Optional.empty();
            }
        }
        return Optional.of(new Reference(kind, tag, topics));
    }

    /**
     * Non-empty attributes by local name.
     */
    private static Map<String, String> attributes(Element element) {
        final Map<String, String> out = new LinkedHashMap<>();
        final NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            final Attr attr = (Attr) attrs.item(i);
            final String name = attr.getName();
            if ("xmlns".equals(name) || name.startsWith("xmlns:")) {
                continue;
            }
            final String value = attr.getValue();
            if (value != null && !value.isEmpty()) {
                out.put(localName(name), value);
            }
        }
        return out;
    }

    /**
     * Name/Value pairs of the Placeholder elements below (and including) the
     * element; placeholders without a value are unset.
     */
    private static Map<String, String> placeholders(Element element) {
        final Map<String, String> out = new LinkedHashMap<>();
        final List<Element> candidates = new ArrayList<>();
        candidates.add(element);
        final NodeList below = element.getElementsByTagName("*");
        for (int i = 0; i < below.getLength(); i++) {
            candidates.add((Element) below.item(i));
        }
        for (Element e : candidates) {
            if (!PLACEHOLDER.equals(localName(e.getTagName()))) {
                continue;
            }
            final Map<String, String> attrs = attributes(e);
            final String name = attrs.get("Name");
            final String value = attrs.get("Value");
            if (name != null && value != null) {
                out.put(name, value);
            }
        }
        return out;
    }
}
