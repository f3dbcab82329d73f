package org.javai.status.render;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.Optional;
import java.util.ResourceBundle;
import org.javai.status.Classification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads templates from {@link ResourceBundle} properties files keyed by classification id.
 *
 * <p>For base name {@code status-messages}, a catalog might contain
 * {@code status-messages_en.properties}:
 * <pre>
 * storage.not_found=File {path} not found
 * </pre>
 *
 * <p>The JVM default locale is never consulted; only the requested locale (with its usual
 * parent candidates) and then {@link #defaultLocale()} are tried.
 */
public final class ResourceBundleTemplateResolver implements TemplateResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBundleTemplateResolver.class);

    private static final ResourceBundle.Control NO_FALLBACK =
            ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    private final String baseName;
    private final ClassLoader classLoader;
    private final Locale defaultLocale;

    public ResourceBundleTemplateResolver(String baseName, Locale defaultLocale) {
        this(baseName, defaultLocale, ResourceBundleTemplateResolver.class.getClassLoader());
    }

    public ResourceBundleTemplateResolver(String baseName, Locale defaultLocale, ClassLoader classLoader) {
        this.baseName = Objects.requireNonNull(baseName, "baseName must not be null");
        this.defaultLocale = Objects.requireNonNull(defaultLocale, "defaultLocale must not be null");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader must not be null");
    }

    @Override
    public Optional<String> lookup(Classification classification, Locale locale) {
        Objects.requireNonNull(classification, "classification must not be null");
        Objects.requireNonNull(locale, "locale must not be null");
        ResourceBundle bundle;
        try {
            bundle = ResourceBundle.getBundle(baseName, locale, classLoader, NO_FALLBACK);
        } catch (MissingResourceException e) {
            LOGGER.debug("No message bundle '{}' for locale {}", baseName, locale);
            return Optional.empty();
        }
        if (!bundle.containsKey(classification.id())) {
            return Optional.empty();
        }
        return Optional.of(bundle.getString(classification.id()));
    }

    @Override
    public Locale defaultLocale() {
        return defaultLocale;
    }
}
