package org.geofacet.data;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class DataTableTest {

    private static DataTable sample() {
        return DataTable.builder("state", "year", "value")
                .addRow("CA", 2020, 1.5)
                .addRow("ny", 2020, 2.0)
                .addRow("CA", 2021, null)
                .addRow(null, 2021, 4.0)
                .build();
    }

    @Test
    @DisplayName("Builder keeps column order and rows")
    void builder_shouldKeepColumnsAndRows() {
        DataTable table = sample();

        assertThat(table.columns()).containsExactly("state", "year", "value");
        assertThat(table.rowCount()).isEqualTo(4);
        assertThat(table.value(1, "state")).isEqualTo("ny");
        assertThat(table.hasColumn("year")).isTrue();
        assertThat(table.hasColumn("Year")).isFalse();
    }

    @Test
    @DisplayName("Builder rejects duplicate columns and rows of the wrong width")
    void builder_shouldValidateShape() {
        assertThatThrownBy(() -> DataTable.builder("a", "a"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> DataTable.builder("a", "b").addRow(1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A table without rows or without columns is empty")
    void isEmpty_shouldCheckRowsAndColumns() {
        assertThat(DataTable.empty().isEmpty()).isTrue();
        assertThat(DataTable.builder("a").build().isEmpty()).isTrue();
        assertThat(DataTable.builder().addRow().build().isEmpty()).isTrue();
        assertThat(sample().isEmpty()).isFalse();
    }

    @Test
    @DisplayName("Column vectors of equal length become rows")
    void fromColumns_shouldTransposeColumns() {
        Map<String, List<?>> columns = new LinkedHashMap<>();
        columns.put("x", List.of(1, 2, 3));
        columns.put("y", List.of(10.0, 20.0, 30.0));

        DataTable table = DataTable.fromColumns(columns);

        assertThat(table.rowCount()).isEqualTo(3);
        assertThat(table.doubles("y")).containsExactly(10.0, 20.0, 30.0);

        columns.put("z", List.of(1));
        assertThatThrownBy(() -> DataTable.fromColumns(columns))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'z'");
    }

    @Test
    @DisplayName("Numeric extraction maps null to NaN and rejects text")
    void doubles_shouldConvertNumbers() {
        DataTable table = sample();

        double[] values = table.doubles("value");

        assertThat(values[0]).isEqualTo(1.5);
        assertThat(values[2]).isNaN();
        assertThat(table.doubles("year")).containsExactly(2020, 2020, 2021, 2021);
        assertThatThrownBy(() -> table.doubles("state"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not numeric");
    }

    @Test
    @DisplayName("Unknown columns are reported by name")
    void column_shouldRejectUnknownColumn() {
        assertThatThrownBy(() -> sample().column("population"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Column population not found in data");
    }

    @Test
    @DisplayName("Grouping keeps first-seen order and shares rows with the source")
    void groupBy_shouldPartitionRows() {
        DataTable table = sample();

        GroupedTable grouped = table.groupBy("state");

        assertThat(grouped.column()).isEqualTo("state");
        assertThat(grouped.keys()).containsExactly("CA", "ny", "");
        DataTable ca = grouped.group("CA").orElseThrow();
        assertThat(ca.rowCount()).isEqualTo(2);
        assertThat(ca.columns()).isEqualTo(table.columns());
        assertThat(ca.rows().get(0)).isSameAs(table.rows().get(0));
        assertThat(grouped.group("TX")).isEmpty();
        assertThat(grouped.size()).isEqualTo(3);
    }
}
