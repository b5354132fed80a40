package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.PipelineConfigFixtures;
import io.crimeradar.pipeline.api.exception.PipelineInitializationException;
import io.crimeradar.pipeline.config.PlacesConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlaceExtractorRegistryTest {

    @Test
    @DisplayName("Should serve each supported language from its own gazetteer")
    void shouldResolveLanguageSpecificExtractors() {
        PlaceExtractorRegistry registry = new PlaceExtractorRegistry(PipelineConfigFixtures.pipelineConfig());

        assertThat(registry.extractorFor("en").language()).isEqualTo("en");
        assertThat(registry.extractorFor("pt").language()).isEqualTo("pt");
        assertThat(registry.extractPlaces("Shooting in Chicago and New York", "en"))
                .containsExactly("Chicago", "New York");
    }

    @Test
    @DisplayName("Should fall back to the multilingual extractor")
    void shouldFallBackToMultilingual() {
        GazetteerPlaceExtractor english = new GazetteerPlaceExtractor("en", List.of("London"));
        GazetteerPlaceExtractor multilingual = new GazetteerPlaceExtractor(PlacesConfig.MULTILINGUAL, List.of("Lisboa"));

        PlaceExtractorRegistry registry = new PlaceExtractorRegistry(List.of("en", "pt"),
                Map.of("en", english, PlacesConfig.MULTILINGUAL, multilingual), 5);

        assertThat(registry.extractorFor("pt")).isSameAs(multilingual);
        assertThat(registry.extractPlaces("Roubo em Lisboa", "pt")).containsExactly("Lisboa");
    }

    @Test
    @DisplayName("Should refuse to start when a language has no extractor")
    void shouldFailWithoutExtractor() {
        GazetteerPlaceExtractor english = new GazetteerPlaceExtractor("en", List.of("London"));

        assertThatThrownBy(() -> new PlaceExtractorRegistry(List.of("en", "pt"), Map.of("en", english), 5))
                .isInstanceOf(PipelineInitializationException.class)
                .hasMessageContaining("pt");
    }

    @Test
    @DisplayName("Should reject lookups for languages outside the table")
    void shouldRejectUnknownLanguage() {
        PlaceExtractorRegistry registry = new PlaceExtractorRegistry(PipelineConfigFixtures.pipelineConfig());

        assertThatThrownBy(() -> registry.extractorFor("de")).isInstanceOf(IllegalArgumentException.class);
    }
}
