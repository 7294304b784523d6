package org.mediascan.service.naming;

import org.mediascan.model.enums.ExtraType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExtraRuleResolverTest {

    private final ExtraRuleResolver resolver = NamingTestFixtures.extraRuleResolver();

    @Test
    void resolve_shouldDetectSuffix() {
        assertThat(resolver.resolve("/movies/Movie/Movie-trailer.mkv", "/movies")).contains(ExtraType.TRAILER);
        assertThat(resolver.resolve("/movies/Movie/Movie-behindthescenes.mkv", "/movies")).contains(ExtraType.BEHIND_THE_SCENES);
    }

    @Test
    void resolve_shouldIgnoreTrailingDigitsOfSuffix() {
        assertThat(resolver.resolve("/movies/Movie/Movie-trailer2.mkv", "/movies")).contains(ExtraType.TRAILER);
    }

    @Test
    void resolve_shouldDetectFileName() {
        assertThat(resolver.resolve("/movies/Movie/sample.mkv", "/movies")).contains(ExtraType.SAMPLE);
    }

    @Test
    void resolve_shouldDetectDirectoryName() {
        assertThat(resolver.resolve("/movies/Movie/trailers/Teaser.mkv", "/movies")).contains(ExtraType.TRAILER);
        assertThat(resolver.resolve("/movies/Movie/extras/Making Of.mkv", "/movies")).contains(ExtraType.UNKNOWN);
        assertThat(resolver.resolve("/movies/Movie/Behind The Scenes/Crew.mkv", "/movies")).contains(ExtraType.BEHIND_THE_SCENES);
    }

    @Test
    void resolve_shouldNotUseLibraryRootAsExtraDirectory() {
        assertThat(resolver.resolve("/media/trailers/Movie.mkv", "/media/trailers")).isEmpty();
        assertThat(resolver.resolve("/media/trailers/Movie.mkv", "/media/trailers/")).isEmpty();
    }

    @Test
    void resolve_shouldReturnEmptyForMainContent() {
        assertThat(resolver.resolve("/movies/Movie (2020)/Movie (2020).mkv", "/movies")).isEmpty();
        assertThat(resolver.resolve("/tv/Show/Season 1/Show S01E01 - [1080p].mkv", "/tv")).isEmpty();
        assertThat(resolver.resolve("", "/movies")).isEmpty();
    }
}
