package org.javai.status.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * A parsed message template such as {@code "File {path} not found"}.
 *
 * <p>Syntax: <code>&#123;key&#125;</code> is replaced by the context value of {@code key};
 * <code>&#123;&#123;</code> and <code>&#125;&#125;</code> produce literal braces. Anything that is
 * not a well-formed placeholder, such as an unterminated or empty one, is kept as literal text.
 * Parsing never fails.
 */
public final class MessageTemplate {

    sealed interface Segment permits Literal, Placeholder {
    }

    record Literal(String text) implements Segment {
    }

    record Placeholder(String key) implements Segment {
    }

    private final String source;
    private final List<Segment> segments;

    private MessageTemplate(String source, List<Segment> segments) {
        this.source = source;
        this.segments = List.copyOf(segments);
    }

    public static MessageTemplate parse(String template) {
        Objects.requireNonNull(template, "template must not be null");
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        int length = template.length();
        while (i < length) {
            char c = template.charAt(i);
            if (c == '{' && i + 1 < length && template.charAt(i + 1) == '{') {
                literal.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < length && template.charAt(i + 1) == '}') {
                literal.append('}');
                i += 2;
            } else if (c == '{') {
                int close = template.indexOf('}', i + 1);
                int reopen = template.indexOf('{', i + 1);
                if (close < 0 || (reopen >= 0 && reopen < close)) {
                    literal.append(c);
                    i++;
                    continue;
                }
                String key = template.substring(i + 1, close).trim();
                if (key.isEmpty()) {
                    literal.append(template, i, close + 1);
                } else {
                    flush(literal, segments);
                    segments.add(new Placeholder(key));
                }
                i = close + 1;
            } else {
                literal.append(c);
                i++;
            }
        }
        flush(literal, segments);
        return new MessageTemplate(template, segments);
    }

    private static void flush(StringBuilder literal, List<Segment> segments) {
        if (literal.length() > 0) {
            segments.add(new Literal(literal.toString()));
            literal.setLength(0);
        }
    }

    /**
     * Substitutes placeholders.
     *
     * @param values resolves a placeholder key to its text, or empty when the key is unknown
     * @param unknownMarker text used for keys the resolver cannot supply
     * @return the rendered text
     */
    public String render(Function<String, Optional<String>> values, String unknownMarker) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(unknownMarker, "unknownMarker must not be null");
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            if (segment instanceof Literal literal) {
                sb.append(literal.text());
            } else if (segment instanceof Placeholder placeholder) {
                sb.append(values.apply(placeholder.key()).orElse(unknownMarker));
            }
        }
        return sb.toString();
    }

    /**
     * Returns the placeholder keys in order of first appearance.
     */
    public Set<String> placeholders() {
        Set<String> keys = new LinkedHashSet<>();
        for (Segment segment : segments) {
            if (segment instanceof Placeholder placeholder) {
                keys.add(placeholder.key());
            }
        }
        return Collections.unmodifiableSet(keys);
    }

    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }
}
