package org.javai.status.render;

import java.util.Locale;
import java.util.Optional;
import org.javai.status.Classification;

/**
 * Looks up the message template for a classification in a given locale.
 * Implementations are supplied by the application and own the catalog they read from.
 */
@FunctionalInterface
public interface TemplateResolver {

    /**
     * Returns the template for the classification in the locale, if the catalog has one.
     *
     * @param classification the failure classification
     * @param locale the requested locale
     * @return a template using {@code {key}} placeholders, or empty
     */
    Optional<String> lookup(Classification classification, Locale locale);

    /**
     * The locale tried when the requested one has no template.
     */
    default Locale defaultLocale() {
        return Locale.ROOT;
    }

    /**
     * A resolver with no templates. Every status renders in the generic form.
     */
    static TemplateResolver empty() {
        return (classification, locale) -> Optional.empty();
    }
}
