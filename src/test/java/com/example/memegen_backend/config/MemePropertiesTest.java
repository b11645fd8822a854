package com.example.memegen_backend.config;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MemePropertiesTest {

    @Test
    void defaultsMatchPublicApi() {
        RenderSettings settings = new MemeProperties().toRenderSettings();

        assertThat(settings.allowedExtensions()).containsExactly("gif", "jpg", "png", "webp");
        assertThat(settings.defaultExtension()).isEqualTo("png");
        assertThat(settings.defaultStyle()).isEqualTo("default");
        assertThat(settings.errorTemplateId()).isEqualTo("_error");
        assertThat(settings.styleKeys()).containsExactly("style", "alt");
        assertThat(settings.backgroundKeys()).containsExactly("background", "alt");
        assertThat(settings.minDimension()).isEqualTo(10);
        assertThat(settings.maxDimension()).isEqualTo(2000);
    }

    @Test
    void maxDimensionIsConfigurable() {
        MemeProperties properties = new MemeProperties();
        properties.setMaxDimension(500);

        assertThat(properties.toRenderSettings().maxDimension()).isEqualTo(500);
    }

    @Test
    void settingsAreDetachedFromBinding() {
        MemeProperties properties = new MemeProperties();
        properties.setAllowedExtensions(new ArrayList<>(List.of("png")));
        RenderSettings settings = properties.toRenderSettings();

        properties.getAllowedExtensions().add("bmp");

        assertThat(settings.isAllowedExtension("bmp")).isFalse();
        assertThat(settings.isAllowedExtension("png")).isTrue();
        assertThat(settings.isAllowedExtension(null)).isFalse();
    }

    @Test
    void placeholderComparison() {
        assertThat(RenderSettings.DEFAULT.isPlaceholder("string")).isTrue();
        assertThat(RenderSettings.DEFAULT.isPlaceholder("String")).isFalse();
        assertThat(RenderSettings.DEFAULT.isPlaceholder(null)).isFalse();
    }
}
