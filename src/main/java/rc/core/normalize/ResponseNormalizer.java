package rc.core.normalize;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import rc.core.error.DecodeException;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a raw response body into a {@link CanonicalBody}, dispatching on the declared content type
 * (case-insensitive, parameters ignored except charset).
 *
 * <ul>
 *   <li>JSON family: Jackson tree; malformed input is {@code MALFORMED_JSON}</li>
 *   <li>XML family: element tree via StAX, DOCTYPE refused; malformed input is {@code MALFORMED_XML}</li>
 *   <li>form-urlencoded: ordered multi-map</li>
 *   <li>text/plain, text/html, application/jwt: decoded text</li>
 *   <li>anything else, or no content type: raw bytes, never an error</li>
 * </ul>
 *
 * Decode errors are only raised for 2xx responses. A non-2xx body that does not parse falls back to
 * {@link RawBody}, so the status code alone drives the failure classification.
 *
 * Stateless apart from the configured parsers; safe to share across threads. Never retries.
 */
public final class ResponseNormalizer {

    private final ObjectMapper mapper;
    private final XMLInputFactory xmlInputFactory;

    public ResponseNormalizer() {
        this(new ObjectMapper());
    }

    public ResponseNormalizer(ObjectMapper mapper) {
        if (mapper == null) throw new IllegalArgumentException("mapper cannot be null");
        this.mapper = mapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.xmlInputFactory = XMLInputFactory.newFactory();
        xmlInputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        xmlInputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        xmlInputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
    }

    /**
     * @param statusCode HTTP status of the response
     * @param rawBody body bytes, possibly empty
     * @param declaredContentType Content-Type header value, possibly null
     * @throws DecodeException when a 2xx body does not parse as its declared JSON or XML type
     */
    public NormalizedResponse normalize(int statusCode, byte[] rawBody, String declaredContentType) {
        byte[] bytes = rawBody == null ? new byte[0] : rawBody;
        if (bytes.length == 0) {
            // zero bytes are a valid form with no fields
            CanonicalBody empty = MediaType.parse(declaredContentType).isForm()
                ? new FormBody(List.of())
                : RawBody.EMPTY;
            return new NormalizedResponse(statusCode, empty);
        }

        boolean success = statusCode >= 200 && statusCode <= 299;
        try {
            return new NormalizedResponse(statusCode, decode(bytes, declaredContentType));
        } catch (DecodeException e) {
            if (success) throw e;
            return new NormalizedResponse(statusCode, new RawBody(declaredContentType, bytes));
        }
    }

    /**
     * Decodes a body regardless of status.
     *
     * @throws DecodeException on malformed JSON or XML
     */
    public CanonicalBody decode(byte[] bytes, String declaredContentType) {
        MediaType mediaType = MediaType.parse(declaredContentType);

        if (mediaType.isJson()) {
            return new JsonBody(parseJson(bytes, mediaType));
        }
        if (mediaType.isXml()) {
            return new XmlBody(parseXml(bytes));
        }
        if (mediaType.isForm()) {
            String payload = new String(bytes, mediaType.charset());
            try {
                return new FormBody(FormCodec.decode(payload.trim(), mediaType.charset()));
            } catch (IllegalArgumentException e) {
                // bad percent escape: hand the bytes over untouched
                return new RawBody(declaredContentType, bytes);
            }
        }
        if (mediaType.isText()) {
            return new TextBody(mediaType.essence(), new String(bytes, mediaType.charset()));
        }
        return new RawBody(declaredContentType, bytes);
    }

    private JsonNode parseJson(byte[] bytes, MediaType mediaType) {
        try {
            // Jackson detects the UTF encodings itself
            if (mediaType.charset().name().startsWith("UTF-")) {
                return requireValue(mapper.readTree(bytes));
            }
            return requireValue(mapper.readTree(new String(bytes, mediaType.charset())));
        } catch (IOException e) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_JSON,
                "malformed JSON body: " + e.getMessage(), e);
        }
    }

    private static JsonNode requireValue(JsonNode node) {
        // blank content parses to a MissingNode rather than failing
        if (node == null || node.isMissingNode()) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_JSON, "JSON body has no value", null);
        }
        return node;
    }

    private XmlElement parseXml(byte[] bytes) {
        try {
            XMLStreamReader reader = xmlInputFactory.createXMLStreamReader(new ByteArrayInputStream(bytes));
            XmlElement root = readTree(reader);
            reader.close();
            return root;
        } catch (XMLStreamException e) {
            throw new DecodeException(DecodeException.Kind.MALFORMED_XML,
                "malformed XML body: " + e.getMessage(), e);
        }
    }

    private static XmlElement readTree(XMLStreamReader reader) throws XMLStreamException {
        Deque<ElementBuilder> open = new ArrayDeque<>();
        XmlElement root = null;

        while (reader.hasNext()) {
            int event = reader.next();
            switch (event) {
                case XMLStreamConstants.DTD -> throw new XMLStreamException("DOCTYPE is not allowed");
                case XMLStreamConstants.START_ELEMENT -> {
                    ElementBuilder element = new ElementBuilder(qualifiedName(reader));
                    for (int i = 0; i < reader.getAttributeCount(); i++) {
                        String prefix = reader.getAttributePrefix(i);
                        String local = reader.getAttributeLocalName(i);
                        String key = prefix == null || prefix.isEmpty() ? local : prefix + ":" + local;
                        element.attributes.put(key, reader.getAttributeValue(i));
                    }
                    open.push(element);
                }
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA -> {
                    if (!open.isEmpty()) open.peek().text.append(reader.getText());
                }
                case XMLStreamConstants.END_ELEMENT -> {
                    XmlElement done = open.pop().build();
                    if (open.isEmpty()) {
                        root = done;
                    } else {
                        open.peek().children.add(done);
                    }
                }
                default -> {
                    // comments, processing instructions, whitespace outside the root
                }
            }
        }
        if (root == null) throw new XMLStreamException("document has no root element");
        return root;
    }

    private static String qualifiedName(XMLStreamReader reader) {
        String prefix = reader.getPrefix();
        return prefix == null || prefix.isEmpty() ? reader.getLocalName() : prefix + ":" + reader.getLocalName();
    }

    private static final class ElementBuilder {
        private final String name;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<XmlElement> children = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();

        private ElementBuilder(String name) {
            this.name = name;
        }

        private XmlElement build() {
            return new XmlElement(name, attributes, children, text.toString().trim());
        }
    }
}
