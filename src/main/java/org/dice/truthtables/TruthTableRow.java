package org.dice.truthtables;

import java.util.Arrays;

public class TruthTableRow {

    private final boolean[] values;

    public TruthTableRow(boolean[] values) {
        this.values = values.clone();
    }

    public boolean get(int column) {
        return values[column];
    }

    public int size() {
        return values.length;
    }

    public boolean[] getValues() {
        return values.clone();
    }

    @Override
    public String toString(){
        StringBuilder sb = new StringBuilder();
        for (boolean value : values) {
            sb.append(value ? 'T' : 'F');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TruthTableRow && Arrays.equals(values, ((TruthTableRow) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }
}
