package erlang.json.term;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Reads JSON text into [Term] trees and provides factories for tagged nodes.
///
/// Usage:
/// ```java
/// Term forms = Terms.read(Path.of("foo.json"));
/// Term expr = Terms.parse("[\"integer\", 1, 42]");
/// ```
public final class Terms {

    private static final Logger LOG = Logger.getLogger(Terms.class.getName());

    /// Deepest array nesting accepted. List literals are dumped as nested `cons`
    /// nodes, one level per element, so real modules go far past Jackson's default.
    static final int MAX_NESTING_DEPTH = 100_000;

    private static final ObjectMapper MAPPER = JsonMapper.builder(new JsonFactoryBuilder()
                    .streamReadConstraints(StreamReadConstraints.builder()
                            .maxNestingDepth(MAX_NESTING_DEPTH)
                            .build())
                    .build())
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    /// Longest dump kept by [#abbreviate(Term)].
    static final int MAX_DUMP = 256;

    private Terms() {
        // Static utility class
    }

    /// Parses JSON text into a `Term`.
    ///
    /// @param json the JSON text
    /// @return the root node
    /// @throws NullPointerException if json is null
    /// @throws TermParseException if the text is not valid JSON, has trailing content or contains an object
    public static Term parse(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return fromJson(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new TermParseException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /// Reads a JSON document from a file into a `Term`.
    ///
    /// @param path the file to read
    /// @return the root node
    /// @throws IOException if the file cannot be read
    /// @throws TermParseException if the content is not valid JSON or contains an object
    public static Term read(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        LOG.fine(() -> "Reading term tree from " + path);
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    /// Reads a JSON document from a stream into a `Term`. The stream is not closed.
    ///
    /// @param in the stream to read
    /// @return the root node
    /// @throws IOException if the stream cannot be read
    /// @throws TermParseException if the content is not valid JSON or contains an object
    public static Term read(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in must not be null");
        try {
            return fromJson(MAPPER.readTree(in));
        } catch (JsonProcessingException e) {
            throw new TermParseException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /// Converts a Jackson tree into a `Term`.
    ///
    /// Arrays are converted with an explicit stack, so nesting depth is bounded
    /// by [#MAX_NESTING_DEPTH] rather than by the thread stack.
    ///
    /// @param node the Jackson node
    /// @return the equivalent term
    /// @throws TermParseException if the tree contains an object, a float out of
    ///         double range, or is missing
    public static Term fromJson(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            throw new TermParseException("Empty JSON document");
        }
        if (!node.isArray()) {
            return scalar(node);
        }
        final Deque<OpenArray> open = new ArrayDeque<>();
        open.push(new OpenArray(node));
        while (true) {
            final OpenArray top = open.peek();
            if (top.children.hasNext()) {
                final JsonNode child = top.children.next();
                if (child.isArray()) {
                    open.push(new OpenArray(child));
                } else {
                    top.elements.add(scalar(child));
                }
                continue;
            }
            open.pop();
            final TermList done = new TermList(top.elements);
            if (open.isEmpty()) {
                return done;
            }
            open.peek().elements.add(done);
        }
    }

    private static Term scalar(JsonNode node) {
        if (node.isTextual()) {
            return new TermString(node.textValue());
        }
        if (node.isIntegralNumber()) {
            return new TermInteger(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            final double value = node.doubleValue();
            if (!Double.isFinite(value)) {
                throw new TermParseException("Float out of range: " + node);
            }
            return new TermFloat(value);
        }
        if (node.isBoolean()) {
            return TermBoolean.of(node.booleanValue());
        }
        if (node.isNull()) {
            return TermNull.of();
        }
        throw new TermParseException("Unsupported JSON node type " + node.getNodeType() + ": " + node);
    }

    /// An array whose elements are still being converted.
    private static final class OpenArray {
        final Iterator<JsonNode> children;
        final List<Term> elements;

        OpenArray(JsonNode array) {
            this.children = array.elements();
            this.elements = new ArrayList<>(array.size());
        }
    }

    /// {@return a tagged node `[tag, children...]`}
    ///
    /// @param tag the discriminator
    /// @param children the remaining elements
    public static TermList tagged(String tag, Term... children) {
        final List<Term> elements = new ArrayList<>(children.length + 1);
        elements.add(new TermString(tag));
        elements.addAll(List.of(children));
        return new TermList(elements);
    }

    /// {@return the JSON rendering of the node, cut to a readable length}
    /// @param term the node to render
    public static String abbreviate(Term term) {
        return term == null ? "null" : render(term, MAX_DUMP);
    }

    /// Renders `root` as JSON, stopping once the text is longer than `limit`;
    /// a cut rendering keeps `limit` chars and ends in `...`.
    /// Iterative, so arbitrarily deep trees render without recursion.
    static String render(Term root, int limit) {
        final StringBuilder out = new StringBuilder();
        final Deque<OpenList> open = new ArrayDeque<>();
        Term next = root;
        while (out.length() <= limit) {
            if (next instanceof TermList list) {
                out.append('[');
                open.push(new OpenList(list.elements().iterator()));
            } else if (next != null) {
                out.append(next);
            }
            next = null;
            final OpenList current = open.peek();
            if (current == null) {
                break;
            }
            if (current.elements.hasNext()) {
                if (!current.first) {
                    out.append(',');
                }
                current.first = false;
                next = current.elements.next();
            } else {
                out.append(']');
                open.pop();
            }
        }
        return out.length() > limit ? out.substring(0, limit) + "..." : out.toString();
    }

    /// A list whose elements are still being rendered.
    private static final class OpenList {
        final Iterator<Term> elements;
        boolean first = true;

        OpenList(Iterator<Term> elements) {
            this.elements = elements;
        }
    }

    static String quote(String value) {
        return '"' + new String(JsonStringEncoder.getInstance().quoteAsString(value)) + '"';
    }
}
