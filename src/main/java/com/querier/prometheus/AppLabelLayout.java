package com.querier.prometheus;

/**
 * Position of an app label inside a metric's row: the label's value id is
 * stored in column {@code app_label_value_id_<columnIndex>}
 */
public class AppLabelLayout {
    private final String labelName;
    private final int columnIndex;

    public AppLabelLayout(String labelName, int columnIndex) {
        this.labelName = labelName;
        this.columnIndex = columnIndex;
    }

    public String getLabelName() {
        return labelName;
    }

    public int getColumnIndex() {
        return columnIndex;
    }

    public String getColumn() {
        return "app_label_value_id_" + columnIndex;
    }

    @Override
    public String toString() {
        return labelName + "@" + columnIndex;
    }
}
