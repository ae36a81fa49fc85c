package org.dice.truthtables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a table generation. Columns start with the variables, in the order used for counting
 * rows; rows are ordered from all variables false to all variables true.
 */
public class TruthTable {

    private final List<String> variables;
    private final List<TruthTableColumn> columns;
    private final List<TruthTableRow> rows;

    public TruthTable(List<String> variables, List<TruthTableColumn> columns, List<TruthTableRow> rows) {
        this.variables = Collections.unmodifiableList(new ArrayList<String>(variables));
        this.columns = Collections.unmodifiableList(new ArrayList<TruthTableColumn>(columns));
        this.rows = Collections.unmodifiableList(new ArrayList<TruthTableRow>(rows));
    }

    public List<String> getVariables() {
        return variables;
    }

    public List<TruthTableColumn> getColumns() {
        return columns;
    }

    public List<TruthTableRow> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public List<String> getHeaders() {
        List<String> headers = new ArrayList<String>(columns.size());
        for (TruthTableColumn column : columns) {
            headers.add(column.getHeader());
        }
        return headers;
    }

    /**
     * @return index of the first column with this header, or -1
     */
    public int indexOf(String header) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).getHeader().equals(header)) {
                return i;
            }
        }
        return -1;
    }

    public List<Boolean> getColumnValues(int column) {
        List<Boolean> values = new ArrayList<Boolean>(rows.size());
        for (TruthTableRow row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    public List<Boolean> getColumnValues(String header) {
        int column = indexOf(header);
        if (column < 0) {
            throw new IllegalArgumentException(String.format("No column named '%s'", header));
        }
        return getColumnValues(column);
    }

    public boolean hasAllTrueColumn() {
        return indexOf(TruthTableColumn.ALL_TRUE_HEADER) >= 0;
    }
}
