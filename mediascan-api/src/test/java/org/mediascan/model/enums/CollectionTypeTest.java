package org.mediascan.model.enums;

import org.mediascan.exception.APIException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollectionTypeTest {

    @Test
    void fromValue_shouldIgnoreCaseAndWhitespace() {
        assertThat(CollectionType.fromValue("tvshows")).isEqualTo(CollectionType.TVSHOWS);
        assertThat(CollectionType.fromValue(" Movies ")).isEqualTo(CollectionType.MOVIES);
    }

    @Test
    void fromValue_shouldTreatBlankAsUnspecified() {
        assertThat(CollectionType.fromValue(null)).isNull();
        assertThat(CollectionType.fromValue("  ")).isNull();
    }

    @Test
    void fromValue_shouldRejectUnknownType() {
        assertThatThrownBy(() -> CollectionType.fromValue("anime"))
                .isInstanceOf(APIException.class)
                .hasMessage("Unknown collection type: anime");
    }

    @Test
    void isVideo_shouldOnlyHoldForVideoCollections() {
        assertThat(CollectionType.MUSICVIDEOS.isVideo()).isTrue();
        assertThat(CollectionType.BOOKS.isVideo()).isFalse();
    }
}
