package org.geofacet.grid;

import org.geofacet.config.GeoFacetConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PredefinedGridsTest {

    private PredefinedGrids grids;

    @BeforeEach
    void setUp() {
        grids = new PredefinedGrids(GeoFacetConfig.defaults());
    }

    @Test
    @DisplayName("Lists the bundled grids from the configuration")
    void available_shouldListBundledGrids() {
        assertThat(grids.available()).containsExactly(
                "us_state_grid1", "us_state_grid2", "us_state_without_DC_grid1", "us_state_contiguous_grid1");
        assertThat(grids.count()).isEqualTo(4);
    }

    @Test
    @DisplayName("Every bundled grid loads and is well formed")
    void get_shouldLoadEveryBundledGrid() throws Exception {
        for (String name : grids.available()) {
            GeoGrid grid = grids.get(name);
            assertThat(grid.name()).isEqualTo(name);
            assertThat(grid.validate()).isTrue();
            assertThat(grid.isCompleteRectangle()).isFalse();
        }
    }

    @Test
    @DisplayName("Grids are loaded once and cached")
    void get_shouldCacheGrids() throws Exception {
        assertThat(grids.get("us_state_grid1")).isSameAs(grids.get("us_state_grid1"));
    }

    @Test
    @DisplayName("The US state grids hold the expected regions")
    void usGrids_shouldHoldExpectedRegions() throws Exception {
        GeoGrid grid1 = grids.usStateGrid(1);
        assertThat(grid1.size()).isEqualTo(51);
        assertThat(grid1.dimensions()).isEqualTo(new GridDimensions(8, 11));
        assertThat(grid1.positionOf("AK")).contains(GridPosition.of(1, 1));
        assertThat(grid1.positionOf("ME")).contains(GridPosition.of(1, 11));
        assertThat(grid1.entry("DC").orElseThrow().name()).isEqualTo("District of Columbia");

        assertThat(grids.usStateGrid(2).size()).isEqualTo(51);

        GeoGrid withoutDc = grids.usStateGridWithoutDc();
        assertThat(withoutDc.size()).isEqualTo(50);
        assertThat(withoutDc.hasRegion("DC")).isFalse();

        GeoGrid contiguous = grids.usContiguousGrid();
        assertThat(contiguous.size()).isEqualTo(49);
        assertThat(contiguous.hasRegion("AK")).isFalse();
        assertThat(contiguous.hasRegion("HI")).isFalse();
    }

    @Test
    @DisplayName("Unknown names and versions are rejected")
    void get_shouldRejectUnknownGrids() {
        assertThatThrownBy(() -> grids.get("moon_grid"))
                .isInstanceOf(GridLoadException.class)
                .hasMessageContaining("Unknown predefined grid 'moon_grid'")
                .hasMessageContaining("us_state_grid1");
        assertThatThrownBy(() -> grids.usStateGrid(3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("The shared registry is a singleton")
    void shared_shouldReturnSameInstance() {
        assertThat(PredefinedGrids.shared()).isSameAs(PredefinedGrids.shared());
    }
}
