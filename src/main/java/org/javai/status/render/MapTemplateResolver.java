package org.javai.status.render;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.status.Classification;

/**
 * An immutable, in-memory template catalog keyed by classification id and locale.
 *
 * <p>Example usage:
 * <pre>{@code
 * TemplateResolver resolver = MapTemplateResolver.builder()
 *     .defaultLocale(Locale.ENGLISH)
 *     .template(StorageError.NOT_FOUND, Locale.ENGLISH, "File {path} not found")
 *     .template(StorageError.NOT_FOUND, Locale.GERMAN, "Datei {path} nicht gefunden")
 *     .build();
 * }</pre>
 */
public final class MapTemplateResolver implements TemplateResolver {

    private final Map<Key, String> templates;
    private final Locale defaultLocale;

    private MapTemplateResolver(Map<Key, String> templates, Locale defaultLocale) {
        this.templates = Map.copyOf(templates);
        this.defaultLocale = defaultLocale;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<String> lookup(Classification classification, Locale locale) {
        Objects.requireNonNull(classification, "classification must not be null");
        Objects.requireNonNull(locale, "locale must not be null");
        return Optional.ofNullable(templates.get(new Key(classification.id(), locale)));
    }

    @Override
    public Locale defaultLocale() {
        return defaultLocale;
    }

    public int size() {
        return templates.size();
    }

    private record Key(String classificationId, Locale locale) {
    }

    /**
     * Builder for creating a {@link MapTemplateResolver}.
     */
    public static final class Builder {
        private final Map<Key, String> templates = new HashMap<>();
        private Locale defaultLocale = Locale.ROOT;

        private Builder() {}

        /**
         * Sets the locale used when the requested locale has no template (defaults to {@link Locale#ROOT}).
         *
         * @param locale the fallback locale
         * @return this builder
         */
        public Builder defaultLocale(Locale locale) {
            this.defaultLocale = Objects.requireNonNull(locale, "locale must not be null");
            return this;
        }

        /**
         * Registers a template, replacing any earlier one for the same classification and locale.
         *
         * @return this builder
         */
        public Builder template(Classification classification, Locale locale, String template) {
            Objects.requireNonNull(classification, "classification must not be null");
            return template(classification.id(), locale, template);
        }

        /**
         * Registers a template by classification id.
         *
         * @return this builder
         */
        public Builder template(String classificationId, Locale locale, String template) {
            Classification.requireValidId(classificationId);
            Objects.requireNonNull(locale, "locale must not be null");
            Objects.requireNonNull(template, "template must not be null");
            templates.put(new Key(classificationId, locale), template);
            return this;
        }

        public MapTemplateResolver build() {
            return new MapTemplateResolver(templates, defaultLocale);
        }
    }
}
