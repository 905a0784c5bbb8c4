package org.assetlink.models.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CardinalityModeTest {

    @Test
    void fromParameter_acceptsNamesAndDescriptiveAliases() {
        assertThat(CardinalityMode.fromParameter(null)).isEqualTo(CardinalityMode.ALL);
        assertThat(CardinalityMode.fromParameter("All")).isEqualTo(CardinalityMode.ALL);
        assertThat(CardinalityMode.fromParameter("exactly-one-source")).isEqualTo(CardinalityMode.UNIQUE);
        assertThat(CardinalityMode.fromParameter("MORE-THAN-ONE-SOURCE")).isEqualTo(CardinalityMode.MULTIPLE);
    }

    @Test
    void fromParameter_unknownValue_isRejected() {
        assertThatThrownBy(() -> CardinalityMode.fromParameter("some"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void matches_countsSources() {
        assertThat(CardinalityMode.UNIQUE.matches(1)).isTrue();
        assertThat(CardinalityMode.UNIQUE.matches(2)).isFalse();
        assertThat(CardinalityMode.MULTIPLE.matches(2)).isTrue();
        assertThat(CardinalityMode.ALL.matches(1)).isTrue();
    }
}
