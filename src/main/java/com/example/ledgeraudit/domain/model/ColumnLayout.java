package com.example.ledgeraudit.domain.model;

import java.util.List;

/**
 * Column start offsets inferred for one page. An empty layout means the page is read in single-column mode.
 */
public record ColumnLayout(List<Float> starts) {

    private static final ColumnLayout SINGLE_COLUMN = new ColumnLayout(List.of());

    public ColumnLayout {
        starts = starts == null ? List.of() : starts.stream().sorted().toList();
    }

    public static ColumnLayout singleColumn() {
        return SINGLE_COLUMN;
    }

    public boolean isSingleColumn() {
        return starts.isEmpty();
    }

    public int columnCount() {
        return Math.max(1, starts.size());
    }

    /**
     * Resolves the column whose start is the closest one at or left of {@code x}.
     * Positions left of the first column belong to column zero.
     *
     * @param x horizontal position
     * @param slack tolerance applied to column starts to absorb scan skew
     * @return zero-based column index
     */
    public int columnOf(float x, float slack) {
        int column = 0;
        for (int i = 0; i < starts.size(); i++) {
            if (x + slack >= starts.get(i)) {
                column = i;
            } else {
                break;
            }
        }
        return column;
    }
}
