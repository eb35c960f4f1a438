package org.geofacet.facet;

import com.typesafe.config.ConfigFactory;
import org.geofacet.GeoFacetException;
import org.geofacet.axis.AxisOptions;
import org.geofacet.axis.LinkMode;
import org.geofacet.config.GeoFacetConfig;
import org.geofacet.render.IFigureFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@Tag("unit")
class FacetOptionsTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Defaults reflect reference.conf")
    void defaults_shouldMatchReferenceConf() {
        FacetOptions options = FacetOptions.builder(GeoFacetConfig.defaults()).build();

        assertThat(options.grid()).isEmpty();
        assertThat(options.defaultGridName()).isEqualTo("us_state_grid1");
        assertThat(options.linkMode()).isEqualTo(LinkMode.NONE);
        assertThat(options.missingRegions()).isEqualTo(MissingRegionPolicy.SKIP);
        assertThat(options.extraRegions()).isEqualTo(ExtraRegionPolicy.ERROR);
        assertThat(options.hideInnerDecorations()).isTrue();
        assertThat(options.commonAxisOptions().isEmpty()).isTrue();
        assertThat(options.axisOptionsList()).isEmpty();
        assertThat(options.legend()).isEmpty();
        assertThat(options.title()).isEmpty();
        assertThat(options.figureWidth(11)).isEqualTo(2200);
        assertThat(options.figureHeight(8)).isEqualTo(1200);
        assertThat(options.legendWidth()).isEqualTo(160);
        assertThat(options.titleHeight()).isEqualTo(40);
        assertThat(options.extraArgs()).isEmpty();
    }

    @Test
    @DisplayName("A configuration file changes the defaults")
    void builder_shouldReadGivenConfig() {
        FacetOptions options = FacetOptions.builder(GeoFacetConfig.load("org/geofacet/config/test.conf")).build();

        assertThat(options.linkMode()).isEqualTo(LinkMode.BOTH);
        assertThat(options.missingRegions()).isEqualTo(MissingRegionPolicy.PLACEHOLDER);
        assertThat(options.extraRegions()).isEqualTo(ExtraRegionPolicy.WARN);
        assertThat(options.figureWidth(3)).isEqualTo(300);
    }

    @Test
    @DisplayName("An invalid configured value is rejected as an invalid option")
    void builder_shouldRejectInvalidConfiguredValue() {
        assertThatThrownBy(() -> FacetOptions.builder(GeoFacetConfig.load("org/geofacet/config/invalid-link.conf")))
                .isInstanceOf(GeoFacetException.class)
                .hasMessageContaining("diagonal");
    }

    @Test
    @DisplayName("Built options are immutable snapshots of the builder")
    void build_shouldCopyCollections() {
        List<AxisOptions> perAxis = new ArrayList<>(List.of(AxisOptions.of(AxisOptions.Y_LABEL, "a")));
        FacetOptions.Builder builder = FacetOptions.builder(GeoFacetConfig.defaults())
                .withAxisOptionsList(perAxis)
                .withExtraArg("k", 1);
        FacetOptions options = builder.build();

        perAxis.add(AxisOptions.empty());
        builder.withExtraArg("k2", 2);

        assertThat(options.axisOptionsList()).hasSize(1);
        assertThat(options.extraArgs()).containsOnlyKeys("k");
        assertThatThrownBy(() -> options.extraArgs().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("toBuilder keeps every setting")
    void toBuilder_shouldRoundTripSettings() {
        IFigureFactory factory = mock(IFigureFactory.class);
        FacetOptions original = FacetOptions.builder(GeoFacetConfig.defaults())
                .withLinkAxes("secondary")
                .withMissingRegions("error")
                .withTitle("T")
                .withFigureSize(10, 20)
                .withFigureFactory(factory)
                .build();

        FacetOptions copy = original.toBuilder().withHideInnerDecorations(false).build();

        assertThat(copy.linkMode()).isEqualTo(LinkMode.Y);
        assertThat(copy.missingRegions()).isEqualTo(MissingRegionPolicy.ERROR);
        assertThat(copy.title()).contains("T");
        assertThat(copy.figureWidth(99)).isEqualTo(10);
        assertThat(copy.figureFactory()).isSameAs(factory);
        assertThat(copy.hideInnerDecorations()).isFalse();
        assertThat(original.hideInnerDecorations()).isTrue();
    }

    @Test
    @DisplayName("Legend options validate their placement")
    void legendOptions_shouldValidatePlacement() {
        assertThatThrownBy(() -> new LegendOptions(null, 1, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LegendOptions.defaults().inRows(3, 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LegendOptions.defaults().inColumn(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FacetOptions.builder(GeoFacetConfig.defaults()).withFigureSize(0, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
