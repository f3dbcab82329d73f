package org.javai.status.render;

import java.util.Locale;
import org.javai.status.SampleError;
import org.javai.status.Status;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ResourceBundleTemplateResolverTest {

    private final ResourceBundleTemplateResolver resolver =
            new ResourceBundleTemplateResolver("test-status-messages", Locale.ENGLISH);

    @Test
    void lookup_findsTemplateForLocale() {
        assertThat(resolver.lookup(SampleError.NOT_FOUND, Locale.GERMAN)).contains("Datei {path} nicht gefunden");
        assertThat(resolver.lookup(SampleError.NOT_FOUND, Locale.ENGLISH)).contains("File {path} not found");
    }

    @Test
    void lookup_countryVariant_usesLanguageBundle() {
        assertThat(resolver.lookup(SampleError.NOT_FOUND, Locale.US)).contains("File {path} not found");
    }

    @Test
    void lookup_missingKey_isEmpty() {
        assertThat(resolver.lookup(SampleError.IO_ERROR, Locale.GERMAN)).isEmpty();
        assertThat(resolver.lookup(SampleError.PERMISSION_DENIED, Locale.ENGLISH)).isEmpty();
    }

    @Test
    void lookup_missingBundle_isEmpty() {
        assertThat(resolver.lookup(SampleError.NOT_FOUND, Locale.FRENCH)).isEmpty();
        assertThat(new ResourceBundleTemplateResolver("no-such-bundle", Locale.ENGLISH)
                .lookup(SampleError.NOT_FOUND, Locale.ENGLISH)).isEmpty();
    }

    @Test
    void renderer_fallsBackToDefaultLocaleBundle() {
        Renderer renderer = Renderer.of(resolver);
        Status status = Status.of(SampleError.IO_ERROR).withContext("path", "/dev/sda");

        assertThat(renderer.render(status, Locale.GERMAN)).isEqualTo("I/O failure on /dev/sda");
        assertThat(renderer.render(Status.of(SampleError.NOT_FOUND).withContext("path", "x"), Locale.GERMAN))
                .isEqualTo("Datei x nicht gefunden");
    }

    @Test
    void defaultLocale_isConfiguredLocale() {
        assertThat(resolver.defaultLocale()).isEqualTo(Locale.ENGLISH);
    }
}
