package org.javai.status.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.status.Classification;
import org.javai.status.ContextValue;
import org.javai.status.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link Status} into human-readable text.
 *
 * <p>Resolution order for a single status:
 * <ol>
 *   <li>the literal message, if the status has one, verbatim;</li>
 *   <li>the resolver's template for the classification in the requested locale;</li>
 *   <li>the resolver's template in its {@linkplain TemplateResolver#defaultLocale() default locale};</li>
 *   <li>a generic form listing the classification id and the context keys.</li>
 * </ol>
 * Placeholders take the last value appended under their key; keys missing from the context
 * render as the unknown marker. Rendering always produces non-empty text.
 *
 * <p>Example usage:
 * <pre>{@code
 * Renderer renderer = Renderer.of(resolver);
 * String text = renderer.render(status, Locale.US);
 * List<String> lines = renderer.renderChain(status, Locale.US);
 * }</pre>
 *
 * <p>Instances are immutable and can be shared between threads, provided the resolver can.
 */
public final class Renderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Renderer.class);

    public static final String DEFAULT_UNKNOWN_MARKER = "<unknown>";
    public static final String CAUSED_BY_PREFIX = "Caused by: ";

    private final TemplateResolver resolver;
    private final String unknownMarker;

    private Renderer(TemplateResolver resolver, String unknownMarker) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.unknownMarker = Objects.requireNonNull(unknownMarker, "unknownMarker must not be null");
    }

    /**
     * Creates a renderer with the default unknown marker.
     */
    public static Renderer of(TemplateResolver resolver) {
        return new Renderer(resolver, DEFAULT_UNKNOWN_MARKER);
    }

    public static Builder builder(TemplateResolver resolver) {
        return new Builder(resolver);
    }

    /**
     * Renders the given status alone; its causes are not included.
     *
     * @param status the status to render
     * @param locale the preferred locale
     * @return non-empty text
     */
    public String render(Status status, Locale locale) {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(locale, "locale must not be null");

        Optional<String> literal = status.message();
        if (literal.isPresent() && !literal.get().isEmpty()) {
            return literal.get();
        }

        Optional<String> template = lookup(status.classification(), locale);
        if (template.isEmpty()) {
            Optional<Locale> fallback = defaultLocale().filter(d -> !d.equals(locale));
            if (fallback.isPresent()) {
                LOGGER.debug("No template for {} in {}, trying default locale {}",
                        status.classification().id(), locale, fallback.get());
                template = lookup(status.classification(), fallback.get());
            }
        }
        if (template.isEmpty()) {
            LOGGER.debug("No template for {}, rendering generic form", status.classification().id());
            return genericMessage(status);
        }

        String rendered = MessageTemplate.parse(template.get())
                .render(key -> status.context().latest(key).map(ContextValue::render), unknownMarker);
        return rendered.isEmpty() ? genericMessage(status) : rendered;
    }

    /**
     * Renders every status of the causal chain, outermost first.
     */
    public List<String> renderChain(Status status, Locale locale) {
        Objects.requireNonNull(status, "status must not be null");
        List<String> lines = new ArrayList<>();
        for (Status level : status.chain()) {
            lines.add(render(level, locale));
        }
        return List.copyOf(lines);
    }

    /**
     * Renders the chain as a multi-line diagnostic report, each cause on a "Caused by:" line.
     */
    public String renderReport(Status status, Locale locale) {
        List<String> lines = renderChain(status, locale);
        StringBuilder sb = new StringBuilder(lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            sb.append(System.lineSeparator()).append(CAUSED_BY_PREFIX).append(lines.get(i));
        }
        return sb.toString();
    }

    /**
     * The built-in form used when no template can be found: the classification id followed by
     * the distinct context keys, e.g. {@code "storage.not_found [path, user]"}.
     */
    public static String genericMessage(Status status) {
        Objects.requireNonNull(status, "status must not be null");
        String id = status.classification().id();
        Set<String> keys = status.context().keys();
        if (keys.isEmpty()) {
            return id;
        }
        return id + " " + keys;
    }

    private Optional<String> lookup(Classification classification, Locale locale) {
        try {
            return Objects.requireNonNullElse(resolver.lookup(classification, locale), Optional.empty());
        } catch (RuntimeException e) {
            LOGGER.warn("Template lookup failed for {} in {}: {}", classification.id(), locale, e.toString());
            return Optional.empty();
        }
    }

    private Optional<Locale> defaultLocale() {
        try {
            Locale locale = resolver.defaultLocale();
            if (locale == null) {
                LOGGER.warn("Template resolver {} has no default locale", resolver.getClass().getName());
            }
            return Optional.ofNullable(locale);
        } catch (RuntimeException e) {
            LOGGER.warn("Default locale lookup failed: {}", e.toString());
            return Optional.empty();
        }
    }

    /**
     * Builder for configuring a {@link Renderer}.
     */
    public static final class Builder {
        private final TemplateResolver resolver;
        private String unknownMarker = DEFAULT_UNKNOWN_MARKER;

        private Builder(TemplateResolver resolver) {
            this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        }

        /**
         * Sets the text substituted for placeholders whose key is not in the context.
         *
         * @param unknownMarker the marker (defaults to {@value Renderer#DEFAULT_UNKNOWN_MARKER})
         * @return this builder
         */
        public Builder unknownMarker(String unknownMarker) {
            this.unknownMarker = Objects.requireNonNull(unknownMarker, "unknownMarker must not be null");
            return this;
        }

        public Renderer build() {
            return new Renderer(resolver, unknownMarker);
        }
    }
}
