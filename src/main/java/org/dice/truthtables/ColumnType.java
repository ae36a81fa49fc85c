package org.dice.truthtables;

public enum ColumnType {
    VARIABLE,
    SUB_EXPRESSION,
    FORMULA,
    PREMISE,
    ALL_TRUE,
    CONCLUSION
}
