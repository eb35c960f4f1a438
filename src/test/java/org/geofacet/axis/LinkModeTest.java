package org.geofacet.axis;

import org.geofacet.GeoFacetException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LinkModeTest {

    @ParameterizedTest
    @CsvSource({
            "none, NONE",
            "x, X",
            "Y, Y",
            "both, BOTH",
            "primary, X",
            "Secondary, Y",
            "' both ', BOTH"
    })
    @DisplayName("Parses names and aliases case-insensitively")
    void parse_shouldAcceptKnownValues(String input, LinkMode expected) {
        assertThat(LinkMode.parse(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Unknown values are invalid options")
    void parse_shouldRejectUnknownValues() {
        assertThatThrownBy(() -> LinkMode.parse("diagonal"))
                .isInstanceOf(GeoFacetException.class)
                .hasMessageContaining("diagonal")
                .extracting(e -> ((GeoFacetException) e).getKind())
                .isEqualTo(GeoFacetException.Kind.INVALID_OPTION);
        assertThatThrownBy(() -> LinkMode.parse(null))
                .isInstanceOf(GeoFacetException.class);
    }

    @Test
    @DisplayName("Directions covered by each mode")
    void links_shouldReflectMode() {
        assertThat(LinkMode.NONE.linksX()).isFalse();
        assertThat(LinkMode.NONE.linksY()).isFalse();
        assertThat(LinkMode.X.linksX()).isTrue();
        assertThat(LinkMode.X.linksY()).isFalse();
        assertThat(LinkMode.Y.linksY()).isTrue();
        assertThat(LinkMode.BOTH.linksX()).isTrue();
        assertThat(LinkMode.BOTH.linksY()).isTrue();
    }

    @Test
    @DisplayName("The y axis side defaults to left and rejects unknown values")
    void yAxisPosition_shouldParseOption() {
        assertThat(YAxisPosition.of(AxisOptions.empty())).isEqualTo(YAxisPosition.LEFT);
        assertThat(YAxisPosition.of(AxisOptions.of(AxisOptions.Y_AXIS_POSITION, "Right")))
                .isEqualTo(YAxisPosition.RIGHT);
        assertThat(YAxisPosition.of(AxisOptions.of(AxisOptions.Y_AXIS_POSITION, YAxisPosition.RIGHT)))
                .isEqualTo(YAxisPosition.RIGHT);
        assertThatThrownBy(() -> YAxisPosition.of(AxisOptions.of(AxisOptions.Y_AXIS_POSITION, "top")))
                .isInstanceOf(GeoFacetException.class);
    }
}
