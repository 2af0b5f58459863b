package com.projectedjournal.cashgrid.grid;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, column-oriented view of one worksheet as it was read from disk.
 *
 * <p>Columns keep their original left-to-right order and header text. Cells are heterogeneous:
 * <ul>
 *   <li>{@link String}: text</li>
 *   <li>{@link Number}: usually {@link java.math.BigDecimal}</li>
 *   <li>{@link java.time.LocalDate}, {@link java.time.LocalDateTime}, {@link java.util.Date}: dates</li>
 *   <li>{@link Boolean}</li>
 *   <li>{@code null}: blank</li>
 * </ul>
 *
 * <p>All columns have the same number of rows.
 */
public final class RawGrid {

    private final List<String> columnNames;
    private final Map<String, List<Object>> columns;
    private final int rowCount;

    private RawGrid(List<String> columnNames, Map<String, List<Object>> columns, int rowCount) {
        this.columnNames = List.copyOf(columnNames);
        this.columns = columns;
        this.rowCount = rowCount;
    }

    public static RawGrid empty() {
        return new RawGrid(List.of(), Map.of(), 0);
    }

    /**
     * Builds a grid from a header and row-major data. Short rows are padded with blanks and
     * cells beyond the header width are ignored.
     */
    public static RawGrid ofRows(List<String> header, List<? extends List<?>> rows) {
        Builder builder = builder();
        for (int c = 0; c < header.size(); c++) {
            List<Object> values = new ArrayList<>(rows.size());
            for (List<?> row : rows) {
                values.add(c < row.size() ? row.get(c) : null);
            }
            builder.column(header.get(c), values);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public int getColumnCount() {
        return columnNames.size();
    }

    public int getRowCount() {
        return rowCount;
    }

    /** A grid with no columns or no rows carries nothing to normalise. */
    public boolean isEmpty() {
        return columnNames.isEmpty() || rowCount == 0;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException if the grid has no column with that name
     */
    public List<Object> column(String name) {
        List<Object> values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("No column named '" + name + "'");
        }
        return values;
    }

    public Object cell(int row, String columnName) {
        return column(columnName).get(row);
    }

    @Override
    public String toString() {
        return "RawGrid[" + rowCount + " rows x " + columnNames + "]";
    }

    public static final class Builder {

        private final List<String> names = new ArrayList<>();
        private final Map<String, List<Object>> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder column(String name, Object... cells) {
            return column(name, cells == null ? List.of() : Arrays.asList(cells));
        }

        public Builder column(String name, List<?> cells) {
            Objects.requireNonNull(name, "column name");
            if (values.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate column '" + name + "'");
            }
            names.add(name);
            values.put(name, Collections.unmodifiableList(new ArrayList<>(cells)));
            return this;
        }

        public RawGrid build() {
            int rows = -1;
            for (Map.Entry<String, List<Object>> entry : values.entrySet()) {
                int size = entry.getValue().size();
                if (rows >= 0 && size != rows) {
                    throw new IllegalArgumentException("Column '" + entry.getKey() + "' has " + size
                            + " cells, expected " + rows);
                }
                rows = size;
            }
            return new RawGrid(names, Collections.unmodifiableMap(new LinkedHashMap<>(values)), Math.max(rows, 0));
        }
    }
}
