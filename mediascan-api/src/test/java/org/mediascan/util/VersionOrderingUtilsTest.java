package org.mediascan.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class VersionOrderingUtilsTest {

    @Test
    void hasResolution_shouldRequireAtLeastThreeDigitsAndScanType() {
        assertThat(VersionOrderingUtils.hasResolution("Movie - 1080p")).isTrue();
        assertThat(VersionOrderingUtils.hasResolution("Movie - 480I")).isTrue();
        assertThat(VersionOrderingUtils.hasResolution("Movie - 4K")).isFalse();
        assertThat(VersionOrderingUtils.hasResolution("Movie - 10p")).isFalse();
        assertThat(VersionOrderingUtils.hasResolution(null)).isFalse();
    }

    @Test
    void extractResolution_shouldReturnFirstMarker() {
        assertThat(VersionOrderingUtils.extractResolution("Movie 2160p remux 1080p")).isEqualTo("2160p");
        assertThat(VersionOrderingUtils.extractResolution("Movie")).isEmpty();
    }

    @Test
    void sortByResolution_shouldPutHighestResolutionFirstAndNamesAfter() {
        List<String> names = List.of("Movie - Extended", "Movie - 720p", "Movie - 2160p", "Movie - Cinema", "Movie - 1080p");

        List<String> ordered = VersionOrderingUtils.sortByResolution(names, Function.identity(), Function.identity());

        assertThat(ordered).containsExactly("Movie - 2160p", "Movie - 1080p", "Movie - 720p", "Movie - Cinema", "Movie - Extended");
    }

    @Test
    void sortByResolution_shouldBreakResolutionTiesByName() {
        List<String> names = List.of("Movie - 1080p HEVC", "Movie - 1080p AVC");

        List<String> ordered = VersionOrderingUtils.sortByResolution(names, Function.identity(), Function.identity());

        assertThat(ordered).containsExactly("Movie - 1080p AVC", "Movie - 1080p HEVC");
    }
}
